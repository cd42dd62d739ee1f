package com.realestate.compatibility.dto;

import com.realestate.compatibility.engine.LandUseBreakdownRow;
import com.realestate.compatibility.engine.ScoreSummaryRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result of one compatibility audit run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityAuditResponse {

    // GeoJSON FeatureCollection, every feature carrying compat_score
    private Map<String, Object> scoredParcels;

    private List<ScoreSummaryRow> overallSummary;

    private List<LandUseBreakdownRow> detailedBreakdown;

    private int parcelCount;
    private int adjacentPairCount;
    private double adjacencyDistance;
    private String landUseField;

    // PROJECTED, GEOGRAPHIC or UNDEFINED
    private String coordinateSpace;

    private List<String> warnings;

    private long elapsedMillis;
}
