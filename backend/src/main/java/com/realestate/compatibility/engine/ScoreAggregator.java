package com.realestate.compatibility.engine;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reduces every parcel's scored pairs to its worst-case (minimum) compatibility.
 * <p>
 * Unresolved pairs take no part in the minimum. A parcel without pairs, or whose
 * pairs are all unresolved, receives {@link #DEFAULT_SCORE}: missing neighbour or
 * matrix data never flags a parcel as problematic.
 */
public class ScoreAggregator {

    public static final int DEFAULT_SCORE = 5;

    private final boolean parallel;

    public ScoreAggregator(boolean parallel) {
        this.parallel = parallel;
    }

    public ScoreAggregator() {
        this(true);
    }

    /**
     * @param parcels     every parcel of the run, in output order
     * @param scoredPairs scored pairs of the run
     * @return one score per parcel, same order as {@code parcels}
     */
    public List<ParcelScore> aggregate(List<LandParcel> parcels, List<ScoredPair> scoredPairs) {
        Map<Integer, Integer> worstByParcel = worstResolvedScores(scoredPairs);
        return parcels.stream()
                .map(parcel -> new ParcelScore(parcel.getId(),
                        worstByParcel.getOrDefault(parcel.getId(), DEFAULT_SCORE)))
                .collect(Collectors.toList());
    }

    /**
     * Minimum resolved score per left parcel id. Parcels with no resolved pair are absent.
     */
    public Map<Integer, Integer> worstResolvedScores(List<ScoredPair> scoredPairs) {
        Stream<ScoredPair> stream = parallel ? scoredPairs.parallelStream() : scoredPairs.stream();
        return stream
                .filter(ScoredPair::isResolved)
                .collect(Collectors.toConcurrentMap(
                        ScoredPair::getLeftId,
                        pair -> pair.getScore().getAsInt(),
                        Math::min));
    }
}
