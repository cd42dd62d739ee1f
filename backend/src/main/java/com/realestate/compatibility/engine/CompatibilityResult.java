package com.realestate.compatibility.engine;

import lombok.Value;

import java.util.List;

@Value
public class CompatibilityResult {
    List<ScoredParcel> scoredParcels;
    List<ParcelScore> parcelScores;
    int adjacentPairCount;
    List<ScoreSummaryRow> overallSummary;
    List<LandUseBreakdownRow> detailedBreakdown;
}
