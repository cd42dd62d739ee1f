package com.realestate.compatibility.service;

import com.realestate.compatibility.dto.CompatibilityAuditRequest;
import com.realestate.compatibility.engine.CompatibilityMatrix;
import com.realestate.compatibility.exception.InvalidInputException;
import com.realestate.compatibility.util.CompatibilityMatrixCsvReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;

@Service
@Slf4j
public class CompatibilityMatrixService {

    /**
     * Load a matrix CSV from disk. Loaded once per path.
     *
     * @param path location of the CSV
     * @return the parsed matrix
     * @throws InvalidInputException if the file is missing or malformed
     */
    @Cacheable(value = "compatibilityMatrix", key = "#path")
    public CompatibilityMatrix loadFromFile(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidInputException("No compatibility matrix path configured (compatibility.matrix.path)");
        }
        CompatibilityMatrix matrix = CompatibilityMatrixCsvReader.read(Paths.get(path));
        log.info("Loaded compatibility matrix with {} entries from {}", matrix.size(), path);
        return matrix;
    }

    /**
     * Resolve the matrix supplied with an audit request, either as a nested map or as CSV text.
     *
     * @throws InvalidInputException if neither or both forms are supplied, or the matrix is malformed
     */
    public CompatibilityMatrix fromRequest(CompatibilityAuditRequest request) {
        boolean hasMap = request.getMatrix() != null;
        boolean hasCsv = request.getMatrixCsv() != null && !request.getMatrixCsv().isBlank();

        if (hasMap && hasCsv) {
            throw new InvalidInputException("Supply the compatibility matrix either as 'matrix' or as 'matrixCsv', not both");
        }
        if (hasMap) {
            return CompatibilityMatrix.fromNestedMap(request.getMatrix());
        }
        if (hasCsv) {
            return CompatibilityMatrixCsvReader.read(request.getMatrixCsv(), "'matrixCsv'");
        }
        throw new InvalidInputException("A compatibility matrix is required: supply 'matrix' or 'matrixCsv'");
    }
}
