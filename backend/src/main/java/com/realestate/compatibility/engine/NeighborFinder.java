package com.realestate.compatibility.engine;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Finds directed adjacency pairs: parcel B is a neighbour of parcel A when B's
 * proximity region intersects A's original footprint. Both directions are produced
 * independently since every parcel is queried against the regions of all others.
 */
@Slf4j
public class NeighborFinder {

    private final SpatialIndexType indexType;
    private final double gridCellSize;
    private final boolean parallel;

    public NeighborFinder(SpatialIndexType indexType, double gridCellSize, boolean parallel) {
        this.indexType = indexType;
        this.gridCellSize = gridCellSize;
        this.parallel = parallel;
    }

    public NeighborFinder() {
        this(SpatialIndexType.STRTREE, 0, true);
    }

    /**
     * @param parcels parcels in input order
     * @param regions proximity region of each parcel, same order as {@code parcels}
     * @return pairs ordered by the left parcel's input position, then by right parcel id
     */
    public List<AdjacencyPair> findPairs(List<LandParcel> parcels, List<Geometry> regions) {
        if (parcels.size() != regions.size()) {
            throw new IllegalArgumentException(String.format(
                    "Expected one proximity region per parcel, got %d regions for %d parcels",
                    regions.size(), parcels.size()));
        }

        List<Envelope> boxes = regions.stream()
                .map(Geometry::getEnvelopeInternal)
                .collect(Collectors.toList());

        // Entries are keyed by input position, not parcel id
        SpatialIndex index = indexType.newIndex(boxes, gridCellSize);
        for (int i = 0; i < boxes.size(); i++) {
            index.insert(i, boxes.get(i));
        }
        index.build();
        log.debug("Built {} index over {} proximity regions", indexType, index.size());

        List<PreparedGeometry> preparedRegions = regions.stream()
                .map(PreparedGeometryFactory::prepare)
                .collect(Collectors.toList());

        IntStream positions = IntStream.range(0, parcels.size());
        if (parallel) {
            positions = positions.parallel();
        }
        return positions
                .mapToObj(i -> neighboursOf(i, parcels, preparedRegions, index))
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    private List<AdjacencyPair> neighboursOf(int position, List<LandParcel> parcels,
                                             List<PreparedGeometry> regions, SpatialIndex index) {
        LandParcel left = parcels.get(position);
        Geometry footprint = left.getGeometry();
        List<AdjacencyPair> pairs = new ArrayList<>();

        for (Integer candidate : index.query(footprint.getEnvelopeInternal())) {
            if (candidate == position) {
                continue;
            }
            LandParcel right = parcels.get(candidate);
            if (right.getId() == left.getId()) {
                continue;
            }
            if (regions.get(candidate).intersects(footprint)) {
                pairs.add(new AdjacencyPair(left.getId(), left.getLandUseClass(),
                        right.getId(), right.getLandUseClass()));
            }
        }
        pairs.sort(Comparator.comparingInt(AdjacencyPair::getRightId));
        return pairs;
    }
}
