package com.realestate.compatibility.service;

import com.realestate.compatibility.dto.CompatibilityAuditRequest;
import com.realestate.compatibility.dto.CompatibilityAuditResponse;
import com.realestate.compatibility.engine.CompatibilityEngine;
import com.realestate.compatibility.engine.CompatibilityMatrix;
import com.realestate.compatibility.engine.CompatibilityResult;
import com.realestate.compatibility.engine.LandParcel;
import com.realestate.compatibility.exception.CompatibilityAnalysisException;
import com.realestate.compatibility.exception.InvalidInputException;
import com.realestate.compatibility.util.GeoJSONConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates audit input, runs the compatibility engine and shapes the response.
 * Structural problems with the input are reported before any geometric work starts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompatibilityAuditService {

    private final CompatibilityEngine engine;
    private final CompatibilityMatrixService matrixService;
    private final StoredParcelService storedParcelService;
    private final CoordinateSpaceInspector coordinateSpaceInspector;

    @Value("${compatibility.analysis.default-adjacency-distance:10}")
    private double defaultAdjacencyDistance;

    @Value("${compatibility.analysis.default-land-use-field:KARBARI_MO}")
    private String defaultLandUseField;

    @Value("${compatibility.matrix.path:data/input/compatibility-matrix.csv}")
    private String matrixPath;

    /**
     * Audit the parcels and matrix supplied with the request.
     *
     * @param request parcels as GeoJSON plus a matrix and run parameters
     * @return scored parcels and summary tables
     * @throws InvalidInputException if the input is structurally unusable
     * @throws CompatibilityAnalysisException if the engine fails on valid input
     */
    public CompatibilityAuditResponse audit(CompatibilityAuditRequest request) {
        long start = System.currentTimeMillis();
        String landUseField = resolveLandUseField(request.getLandUseField());
        double distance = resolveDistance(request.getAdjacencyDistance());

        log.info("Loading and preparing data");
        List<LandParcel> parcels = GeoJSONConverter.readParcels(request.getParcels(), landUseField);
        requireParcels(parcels, "request");
        log.info("Loaded {} parcels", parcels.size());

        log.info("Loading compatibility matrix");
        CompatibilityMatrix matrix = matrixService.fromRequest(request);
        log.info("Matrix loaded with {} entries", matrix.size());

        String crsName = request.getCrs() != null ? request.getCrs() : GeoJSONConverter.readCrsName(request.getParcels());
        CoordinateSpace space = coordinateSpaceInspector.inspect(crsName);

        return run(parcels, matrix, distance, landUseField, space, crsName, start);
    }

    /**
     * Audit the stored parcel layer against the configured matrix file.
     *
     * @param adjacencyDistance buffer distance; null for the configured default
     * @param landUseField      stored attribute column; null for {@code land_use}
     * @param username          requester, recorded in the run log
     */
    public CompatibilityAuditResponse auditStored(Double adjacencyDistance, String landUseField, String username) {
        long start = System.currentTimeMillis();
        String field = landUseField != null && !landUseField.isBlank() ? landUseField : "land_use";
        double distance = resolveDistance(adjacencyDistance);

        log.info("Loading stored parcel layer classified by '{}'", field);
        StoredParcelService.StoredParcels stored = storedParcelService.loadParcels(field);
        requireParcels(stored.getParcels(), "stored parcel layer");

        log.info("Loading compatibility matrix from {}", matrixPath);
        CompatibilityMatrix matrix = matrixService.loadFromFile(matrixPath);

        CoordinateSpace space = coordinateSpaceInspector.inspect(stored.getSrid());
        return run(stored.getParcels(), matrix, distance, field, space, "EPSG:" + stored.getSrid(), start);
    }

    private CompatibilityAuditResponse run(List<LandParcel> parcels, CompatibilityMatrix matrix, double distance,
                                           String landUseField, CoordinateSpace space, String crsName, long start) {
        List<String> warnings = new ArrayList<>();
        coordinateSpaceInspector.warningFor(space, crsName).ifPresent(warning -> {
            log.warn(warning);
            warnings.add(warning);
        });
        if (matrix.isEmpty()) {
            String warning = "Compatibility matrix is empty; every parcel will receive the default score";
            log.warn(warning);
            warnings.add(warning);
        }

        CompatibilityResult result;
        try {
            result = engine.analyze(parcels, matrix, distance);
        } catch (InvalidInputException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Compatibility analysis failed for {} parcels", parcels.size(), e);
            throw new CompatibilityAnalysisException("Compatibility analysis failed: " + e.getMessage(), e);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("Analysis complete in {} ms", elapsed);

        return CompatibilityAuditResponse.builder()
                .scoredParcels(GeoJSONConverter.convertToGeoJSON(result.getScoredParcels()))
                .overallSummary(result.getOverallSummary())
                .detailedBreakdown(result.getDetailedBreakdown())
                .parcelCount(parcels.size())
                .adjacentPairCount(result.getAdjacentPairCount())
                .adjacencyDistance(distance)
                .landUseField(landUseField)
                .coordinateSpace(space.name())
                .warnings(warnings)
                .elapsedMillis(elapsed)
                .build();
    }

    private String resolveLandUseField(String landUseField) {
        return landUseField != null && !landUseField.isBlank() ? landUseField : defaultLandUseField;
    }

    private double resolveDistance(Double adjacencyDistance) {
        double distance = adjacencyDistance != null ? adjacencyDistance : defaultAdjacencyDistance;
        if (Double.isNaN(distance) || Double.isInfinite(distance) || distance < 0) {
            throw new InvalidInputException("Adjacency distance must be a finite, non-negative number, got " + distance);
        }
        return distance;
    }

    private static void requireParcels(List<LandParcel> parcels, String source) {
        if (parcels.isEmpty()) {
            throw new InvalidInputException("Parcel collection from " + source + " is empty");
        }
    }
}
