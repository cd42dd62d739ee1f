package com.realestate.compatibility.engine;

import lombok.Value;

import java.util.Map;

/**
 * Parcel counts per compatibility score for one land-use class.
 * {@code countsByScore} always holds keys 1 to 5 in ascending order.
 */
@Value
public class LandUseBreakdownRow {
    String landUseClass;
    Map<Integer, Long> countsByScore;
    long totalParcels;
}
