package com.realestate.compatibility.engine;

import com.realestate.compatibility.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Batch compatibility audit over a static parcel set:
 * prepare geometry, find neighbours, look up scores, aggregate, summarize.
 * <p>
 * Every stage accepts empty input. A run either completes or throws; no partial
 * result is returned.
 */
@Slf4j
public class CompatibilityEngine {

    private final GeometryPreparer geometryPreparer;
    private final NeighborFinder neighborFinder;
    private final ScoreAggregator scoreAggregator;
    private final SummaryReporter summaryReporter;
    private final boolean parallel;

    public CompatibilityEngine(GeometryPreparer geometryPreparer,
                               NeighborFinder neighborFinder,
                               ScoreAggregator scoreAggregator,
                               SummaryReporter summaryReporter,
                               boolean parallel) {
        this.geometryPreparer = geometryPreparer;
        this.neighborFinder = neighborFinder;
        this.scoreAggregator = scoreAggregator;
        this.summaryReporter = summaryReporter;
        this.parallel = parallel;
    }

    public CompatibilityEngine() {
        this(new GeometryPreparer(), new NeighborFinder(), new ScoreAggregator(), new SummaryReporter(), true);
    }

    /**
     * Runs the full audit.
     *
     * @param parcels           parcels with unique ids and non-null geometry
     * @param matrix            directional compatibility matrix, possibly empty
     * @param adjacencyDistance buffer distance defining adjacency, in coordinate units
     * @return scored parcels and both summary tables
     * @throws InvalidInputException on duplicate ids, missing geometry or an invalid distance
     */
    public CompatibilityResult analyze(List<LandParcel> parcels, CompatibilityMatrix matrix, double adjacencyDistance) {
        validate(parcels, adjacencyDistance);
        CompatibilityMatrix policy = matrix != null ? matrix : CompatibilityMatrix.empty();

        log.info("[1/5] Buffering {} parcels by {}", parcels.size(), adjacencyDistance);
        List<Geometry> regions = geometryPreparer.prepareAll(parcels, adjacencyDistance);

        log.info("[2/5] Performing adjacency analysis");
        List<AdjacencyPair> pairs = neighborFinder.findPairs(parcels, regions);
        log.info("Found {} adjacent parcel pairs", pairs.size());

        log.info("[3/5] Scoring pairs against {} matrix entries", policy.size());
        List<ScoredPair> scoredPairs = lookupScores(pairs, policy);
        if (log.isDebugEnabled()) {
            long unresolved = scoredPairs.stream().filter(pair -> !pair.isResolved()).count();
            log.debug("{} of {} pairs had no matrix entry", unresolved, scoredPairs.size());
        }

        log.info("[4/5] Aggregating results using minimum score");
        List<ParcelScore> parcelScores = scoreAggregator.aggregate(parcels, scoredPairs);

        List<ScoredParcel> scoredParcels = new ArrayList<>(parcels.size());
        for (int i = 0; i < parcels.size(); i++) {
            scoredParcels.add(new ScoredParcel(parcels.get(i), parcelScores.get(i).getCompatScore()));
        }

        log.info("[5/5] Generating summary reports");
        return new CompatibilityResult(
                scoredParcels,
                parcelScores,
                pairs.size(),
                summaryReporter.overallSummary(parcelScores),
                summaryReporter.detailedBreakdown(scoredParcels));
    }

    public List<ScoredPair> lookupScores(List<AdjacencyPair> pairs, CompatibilityMatrix matrix) {
        Stream<AdjacencyPair> stream = parallel ? pairs.parallelStream() : pairs.stream();
        return stream
                .map(pair -> new ScoredPair(pair, matrix.lookup(pair.getLeftClass(), pair.getRightClass())))
                .collect(Collectors.toList());
    }

    private void validate(List<LandParcel> parcels, double adjacencyDistance) {
        if (parcels == null) {
            throw new InvalidInputException("Parcel collection must not be null");
        }
        GeometryPreparer.requireValidDistance(adjacencyDistance);

        Set<Integer> seen = new HashSet<>();
        for (LandParcel parcel : parcels) {
            if (parcel.getGeometry() == null) {
                throw new InvalidInputException("Parcel " + parcel.getId() + " has no geometry");
            }
            if (!seen.add(parcel.getId())) {
                throw new InvalidInputException("Duplicate parcel id " + parcel.getId());
            }
        }
    }
}
