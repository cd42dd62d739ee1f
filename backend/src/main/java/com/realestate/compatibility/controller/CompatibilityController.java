package com.realestate.compatibility.controller;

import com.realestate.compatibility.dto.CompatibilityAuditRequest;
import com.realestate.compatibility.dto.CompatibilityAuditResponse;
import com.realestate.compatibility.service.CompatibilityAuditService;
import com.realestate.compatibility.util.SummaryCsvWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/compatibility")
@RequiredArgsConstructor
@Slf4j
public class CompatibilityController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private static final String DEFAULT_BASE_NAME = "compatibility";

    private final CompatibilityAuditService auditService;

    /**
     * Score every submitted parcel against its neighbours.
     *
     * @param request GeoJSON parcels, compatibility matrix and run parameters
     * @return scored parcels with both summary tables
     */
    @PostMapping("/audit")
    public ResponseEntity<CompatibilityAuditResponse> audit(@Valid @RequestBody CompatibilityAuditRequest request) {
        log.info("Received compatibility audit request");
        return ResponseEntity.ok(auditService.audit(request));
    }

    /**
     * Same audit, returning the city-wide score distribution as CSV.
     */
    @PostMapping(value = "/audit/reports/overall", produces = "text/csv")
    public ResponseEntity<String> overallReport(@Valid @RequestBody CompatibilityAuditRequest request) {
        log.info("Received overall summary report request");
        CompatibilityAuditResponse response = auditService.audit(request);
        return csv(SummaryCsvWriter.overallSummary(response.getOverallSummary()),
                baseName(request) + "_overall_summary.csv");
    }

    /**
     * Same audit, returning the per-land-use breakdown as CSV.
     */
    @PostMapping(value = "/audit/reports/detailed", produces = "text/csv")
    public ResponseEntity<String> detailedReport(@Valid @RequestBody CompatibilityAuditRequest request) {
        log.info("Received detailed breakdown report request");
        CompatibilityAuditResponse response = auditService.audit(request);
        return csv(SummaryCsvWriter.detailedBreakdown(response.getDetailedBreakdown(), response.getLandUseField()),
                baseName(request) + "_detailed_breakdown.csv");
    }

    @GetMapping("/audit/stored")
    public ResponseEntity<CompatibilityAuditResponse> auditStored(
            @RequestParam(name = "adjacencyDistance", required = false) Double adjacencyDistance,
            @RequestParam(name = "landUseField", required = false) String landUseField,
            @RequestParam(name = "username", required = false) String username) {
        log.info("Received stored layer audit request: distance={}, landUseField={}", adjacencyDistance, landUseField);
        return ResponseEntity.ok(auditService.auditStored(adjacencyDistance, landUseField, username));
    }

    private static String baseName(CompatibilityAuditRequest request) {
        String baseName = request.getBaseName();
        if (baseName == null || baseName.isBlank()) {
            return DEFAULT_BASE_NAME;
        }
        return baseName.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static ResponseEntity<String> csv(String body, String fileName) {
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .body(body);
    }
}
