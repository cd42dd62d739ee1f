package com.realestate.compatibility.engine;

import lombok.Value;

/**
 * One row of the city-wide score distribution.
 */
@Value
public class ScoreSummaryRow {
    int compatibilityScore;
    long parcelCount;
    double percentage;
}
