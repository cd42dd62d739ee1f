package com.realestate.compatibility.service;

import com.realestate.compatibility.dto.CompatibilityAuditRequest;
import com.realestate.compatibility.engine.CompatibilityMatrix;
import com.realestate.compatibility.exception.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class CompatibilityMatrixServiceTest {

    private final CompatibilityMatrixService service = new CompatibilityMatrixService();

    @Test
    void loadsMatrixFile(@TempDir Path dir) throws Exception {
        Path csv = dir.resolve("matrix.csv");
        Files.write(csv, "use,A,B\nA,5,2\nB,3,5\n".getBytes(StandardCharsets.UTF_8));

        CompatibilityMatrix matrix = service.loadFromFile(csv.toString());

        assertEquals(OptionalInt.of(2), matrix.lookup("A", "B"));
        assertEquals(OptionalInt.of(3), matrix.lookup("B", "A"));
    }

    @Test
    void rejectsBlankPath() {
        assertThrows(InvalidInputException.class, () -> service.loadFromFile(" "));
    }

    @Test
    void acceptsNestedMapOrCsvButNotBoth() {
        CompatibilityAuditRequest request = new CompatibilityAuditRequest();
        request.setMatrix(Map.of("A", Map.of("B", 1)));
        assertEquals(OptionalInt.of(1), service.fromRequest(request).lookup("A", "B"));

        request.setMatrixCsv("use,A,B\nA,5,4\n");
        assertThrows(InvalidInputException.class, () -> service.fromRequest(request));

        request.setMatrix(null);
        assertEquals(OptionalInt.of(4), service.fromRequest(request).lookup("A", "B"));
    }

    @Test
    void requiresSomeMatrix() {
        CompatibilityAuditRequest request = new CompatibilityAuditRequest();
        request.setMatrixCsv("   ");

        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> service.fromRequest(request));
        assertTrue(ex.getMessage().contains("required"));
    }
}
