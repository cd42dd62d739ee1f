package com.realestate.compatibility.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tabulates final parcel scores into the city-wide distribution and the
 * per-land-use breakdown. Both tables always carry every score from
 * {@link #MIN_SCORE} to {@link #MAX_SCORE}, zero-filled.
 */
public class SummaryReporter {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;
    public static final String UNKNOWN_CLASS = "Unknown";

    public List<ScoreSummaryRow> overallSummary(List<ParcelScore> scores) {
        long[] counts = new long[MAX_SCORE + 1];
        for (ParcelScore score : scores) {
            int value = score.getCompatScore();
            if (value >= MIN_SCORE && value <= MAX_SCORE) {
                counts[value]++;
            }
        }

        long total = scores.size();
        List<ScoreSummaryRow> rows = new ArrayList<>(MAX_SCORE);
        for (int value = MIN_SCORE; value <= MAX_SCORE; value++) {
            double percentage = total == 0 ? 0.0 : counts[value] * 100.0 / total;
            rows.add(new ScoreSummaryRow(value, counts[value], percentage));
        }
        return rows;
    }

    public List<LandUseBreakdownRow> detailedBreakdown(List<ScoredParcel> scoredParcels) {
        Map<String, long[]> countsByClass = new TreeMap<>();
        Map<String, Long> totals = new TreeMap<>();

        for (ScoredParcel scored : scoredParcels) {
            String landUse = scored.getParcel().getLandUseClass() != null
                    ? scored.getParcel().getLandUseClass()
                    : UNKNOWN_CLASS;
            long[] counts = countsByClass.computeIfAbsent(landUse, k -> new long[MAX_SCORE + 1]);
            int value = scored.getCompatScore();
            if (value >= MIN_SCORE && value <= MAX_SCORE) {
                counts[value]++;
            }
            totals.merge(landUse, 1L, Long::sum);
        }

        List<LandUseBreakdownRow> rows = new ArrayList<>(countsByClass.size());
        countsByClass.forEach((landUse, counts) -> {
            Map<Integer, Long> byScore = new LinkedHashMap<>();
            for (int value = MIN_SCORE; value <= MAX_SCORE; value++) {
                byScore.put(value, counts[value]);
            }
            rows.add(new LandUseBreakdownRow(landUse, Collections.unmodifiableMap(byScore), totals.get(landUse)));
        });
        return rows;
    }
}
