package com.realestate.compatibility.controller;

import com.realestate.compatibility.dto.RunLogEntry;
import com.realestate.compatibility.service.RunLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
@Slf4j
public class RunLogController {

    private final RunLogService runLogService;

    @GetMapping
    public ResponseEntity<List<RunLogEntry>> getAllRuns() {
        log.info("Fetching run log");
        return ResponseEntity.ok(runLogService.getAllRunLogs());
    }

    /**
     * Runs requested by one user.
     *
     * @param username requester recorded with the run
     */
    @GetMapping("/user")
    public ResponseEntity<List<RunLogEntry>> getRunsByUser(@RequestParam(name = "username") String username) {
        log.info("Fetching run log for user: {}", username);
        return ResponseEntity.ok(runLogService.getRunLogsByUser(username));
    }

    @GetMapping("/action")
    public ResponseEntity<List<RunLogEntry>> getRunsByAction(@RequestParam(name = "action") String action) {
        log.info("Fetching run log for action: {}", action);
        return ResponseEntity.ok(runLogService.getRunLogsByAction(action));
    }
}
