package com.realestate.compatibility.engine;

import com.realestate.compatibility.exception.InvalidInputException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Directional policy table scoring ordered pairs of land-use classes.
 * <p>
 * Rows are the class of the parcel being assessed, columns the class of its
 * neighbour. {@code (A, B)} and {@code (B, A)} are independent entries; nothing is
 * mirrored. Scores are nominally 1 (least compatible) to 5 (fully compatible) but
 * are stored as given.
 */
public final class CompatibilityMatrix {

    private static final CompatibilityMatrix EMPTY = new CompatibilityMatrix(Collections.emptyMap());

    private final Map<String, Map<String, Integer>> scores;

    private CompatibilityMatrix(Map<String, Map<String, Integer>> scores) {
        this.scores = scores;
    }

    public static CompatibilityMatrix empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a matrix from a nested row-to-column map. Null cells are skipped.
     *
     * @throws InvalidInputException if a score is not an integer
     */
    public static CompatibilityMatrix fromNestedMap(Map<String, ? extends Map<String, ? extends Number>> rows) {
        Builder builder = builder();
        if (rows == null) {
            return builder.build();
        }
        rows.forEach((row, columns) -> {
            if (row == null || columns == null) {
                return;
            }
            columns.forEach((column, score) -> {
                if (column != null && score != null) {
                    builder.put(row, column, integralScore(row, column, score));
                }
            });
        });
        return builder.build();
    }

    private static int integralScore(String row, String column, Number score) {
        double value = score.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            throw new InvalidInputException(String.format(
                    "Compatibility score for (%s, %s) must be an integer, got %s", row, column, score));
        }
        return (int) value;
    }

    /**
     * Score recorded for exactly the ordered pair {@code (leftClass, rightClass)}.
     *
     * @return the score, or empty when the pair is not in the matrix
     */
    public OptionalInt lookup(String leftClass, String rightClass) {
        if (leftClass == null || rightClass == null) {
            return OptionalInt.empty();
        }
        Map<String, Integer> row = scores.get(leftClass);
        if (row == null) {
            return OptionalInt.empty();
        }
        Integer score = row.get(rightClass);
        return score == null ? OptionalInt.empty() : OptionalInt.of(score);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    /**
     * Number of ordered pairs with a recorded score.
     */
    public int size() {
        return scores.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * All class labels that appear as a row or a column.
     */
    public Set<String> classes() {
        Set<String> classes = new LinkedHashSet<>(scores.keySet());
        scores.values().forEach(row -> classes.addAll(row.keySet()));
        return classes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CompatibilityMatrix && scores.equals(((CompatibilityMatrix) o).scores);
    }

    @Override
    public int hashCode() {
        return scores.hashCode();
    }

    @Override
    public String toString() {
        return "CompatibilityMatrix" + scores;
    }

    public static final class Builder {

        private final Map<String, Map<String, Integer>> scores = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String rowClass, String columnClass, int score) {
            scores.computeIfAbsent(rowClass, k -> new LinkedHashMap<>()).put(columnClass, score);
            return this;
        }

        public CompatibilityMatrix build() {
            Map<String, Map<String, Integer>> copy = new LinkedHashMap<>();
            scores.forEach((row, columns) ->
                    copy.put(row, Collections.unmodifiableMap(new LinkedHashMap<>(columns))));
            return new CompatibilityMatrix(Collections.unmodifiableMap(copy));
        }
    }
}
