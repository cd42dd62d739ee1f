package com.realestate.compatibility.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.realestate.compatibility.dto.RunLogEntry;
import com.realestate.compatibility.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * History of compatibility audit runs, kept as a JSON array on disk.
 * Writing to the history never fails the run being recorded.
 */
@Service
public class RunLogService {

    private static final Logger log = LoggerFactory.getLogger(RunLogService.class);

    @Value("${compatibility.run-log.file:logs/run-log.json}")
    private String runLogFilePath;

    @Value("${compatibility.run-log.max-entries:1000}")
    private int maxEntries;

    @Value("${compatibility.run-log.retention-days:30}")
    private int retentionDays;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @PostConstruct
    public void init() {
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

        Path path = Paths.get(runLogFilePath);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(path)) {
                objectMapper.writeValue(path.toFile(), new ArrayList<RunLogEntry>());
                log.info("Created run log at {}", path.toAbsolutePath());
            } else {
                readEntries(path.toFile());
                log.info("Using existing run log at {}", path.toAbsolutePath());
            }
        } catch (IOException e) {
            log.error("Run log at {} is unreadable, starting a new one", path.toAbsolutePath(), e);
            backupAndReset(path);
        }
    }

    /**
     * Append an event to the run log, trimming it to the configured size.
     *
     * @param action   event type, e.g. COMPATIBILITY_AUDIT_SUCCESS
     * @param details  free text
     * @param username requester; "system" when null
     */
    public void logRunEvent(String action, String details, String username) {
        if (action == null || action.trim().isEmpty()) {
            log.warn("Ignoring run log event without an action");
            return;
        }

        RunLogEntry entry = new RunLogEntry(
                LocalDateTime.now(),
                action,
                details != null ? details : "No details provided",
                username != null ? username : "system");

        rwLock.writeLock().lock();
        try {
            List<RunLogEntry> entries = readRetainedEntries();
            entries.add(entry);
            if (entries.size() > maxEntries) {
                entries = new ArrayList<>(entries.subList(entries.size() - maxEntries, entries.size()));
            }
            objectMapper.writeValue(new File(runLogFilePath), entries);
            log.info("Run log entry recorded: {}", entry);
        } catch (IOException e) {
            log.error("Failed to write run log entry {}: {}", entry, e.getMessage(), e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public List<RunLogEntry> getAllRunLogs() {
        return query(entry -> true, "all runs");
    }

    /**
     * @throws BusinessException if the username is empty or the log cannot be read
     */
    public List<RunLogEntry> getRunLogsByUser(String username) {
        if (username == null || username.isEmpty()) {
            throw new BusinessException("Username cannot be empty");
        }
        return query(entry -> username.equals(entry.getUsername()), "user " + username);
    }

    /**
     * @throws BusinessException if the action is empty or the log cannot be read
     */
    public List<RunLogEntry> getRunLogsByAction(String action) {
        if (action == null || action.isEmpty()) {
            throw new BusinessException("Action cannot be empty");
        }
        return query(entry -> action.equals(entry.getAction()), "action " + action);
    }

    private List<RunLogEntry> query(Predicate<RunLogEntry> filter, String description) {
        rwLock.readLock().lock();
        try {
            List<RunLogEntry> entries = readRetainedEntries().stream().filter(filter).toList();
            log.info("Retrieved {} run log entries for {}", entries.size(), description);
            return entries;
        } catch (IOException e) {
            log.error("Error reading run log for {}", description, e);
            throw new BusinessException("Unable to read run log for " + description, e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    private List<RunLogEntry> readRetainedEntries() throws IOException {
        File file = new File(runLogFilePath);
        if (!file.exists() || file.length() == 0) {
            return new ArrayList<>();
        }
        List<RunLogEntry> entries = readEntries(file);
        pruneExpired(entries);
        return entries;
    }

    private List<RunLogEntry> readEntries(File file) throws IOException {
        return objectMapper.readValue(file,
                objectMapper.getTypeFactory().constructCollectionType(List.class, RunLogEntry.class));
    }

    private void pruneExpired(List<RunLogEntry> entries) {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        int before = entries.size();
        entries.removeIf(entry -> entry.getTimestamp() == null || entry.getTimestamp().isBefore(cutoff));
        int removed = before - entries.size();
        if (removed > 0) {
            log.info("Pruned {} run log entries older than {} days", removed, retentionDays);
        }
    }

    private void backupAndReset(Path path) {
        Path backup = Paths.get(runLogFilePath + ".backup." + System.currentTimeMillis());
        try {
            if (Files.exists(path)) {
                Files.copy(path, backup);
                log.info("Backed up unreadable run log to {}", backup);
            }
            objectMapper.writeValue(path.toFile(), new ArrayList<RunLogEntry>());
        } catch (IOException e) {
            log.error("Could not reset run log at {}", path.toAbsolutePath(), e);
        }
    }
}
