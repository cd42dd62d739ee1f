package com.realestate.compatibility.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.locationtech.jts.geom.Geometry;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.realestate.compatibility.engine.TestParcels.parcel;
import static org.junit.jupiter.api.Assertions.*;

class NeighborFinderTest {

    private final GeometryPreparer preparer = new GeometryPreparer();

    private List<AdjacencyPair> pairs(NeighborFinder finder, List<LandParcel> parcels, double distance) {
        List<Geometry> regions = preparer.prepareAll(parcels, distance);
        return finder.findPairs(parcels, regions);
    }

    @ParameterizedTest
    @EnumSource(SpatialIndexType.class)
    void gapWithinBufferProducesBothDirections(SpatialIndexType type) {
        List<LandParcel> parcels = List.of(
                parcel(1, "Residential", 0, 0, 1, 1),
                parcel(2, "Industrial", 1.05, 0, 2, 1));

        List<AdjacencyPair> found = pairs(new NeighborFinder(type, 0, true), parcels, 0.1);

        assertEquals(List.of(
                new AdjacencyPair(1, "Residential", 2, "Industrial"),
                new AdjacencyPair(2, "Industrial", 1, "Residential")), found);
    }

    @ParameterizedTest
    @EnumSource(SpatialIndexType.class)
    void gapBeyondBufferProducesNothing(SpatialIndexType type) {
        List<LandParcel> parcels = List.of(
                parcel(1, "Residential", 0, 0, 1, 1),
                parcel(2, "Industrial", 1.05, 0, 2, 1));

        assertTrue(pairs(new NeighborFinder(type, 0, true), parcels, 0.01).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(SpatialIndexType.class)
    void zeroDistanceFindsTouchingParcelsButNeverSelf(SpatialIndexType type) {
        List<LandParcel> parcels = List.of(
                parcel(10, "A", 0, 0, 1, 1),
                parcel(11, "B", 1, 0, 2, 1),
                parcel(12, "C", 3, 0, 4, 1));

        List<AdjacencyPair> found = pairs(new NeighborFinder(type, 0, false), parcels, 0);

        assertEquals(2, found.size());
        assertTrue(found.stream().noneMatch(p -> p.getLeftId() == p.getRightId()));
        assertTrue(found.stream().noneMatch(p -> p.getLeftId() == 12 || p.getRightId() == 12));
    }

    @Test
    void diagonalCornerGapIsMeasuredByTrueDistance() {
        // Envelopes of the buffered region overlap but the rounded corner does not reach
        List<LandParcel> parcels = List.of(
                parcel(1, "A", 0, 0, 1, 1),
                parcel(2, "B", 1.08, 1.08, 2, 2));

        assertTrue(pairs(new NeighborFinder(), parcels, 0.1).isEmpty());
        assertEquals(2, pairs(new NeighborFinder(), parcels, 0.12).size());
    }

    @Test
    void rightIdsAreSortedPerLeftParcel() {
        List<LandParcel> parcels = List.of(
                parcel(50, "Hub", 1, 1, 2, 2),
                parcel(40, "X", 0, 1, 1, 2),
                parcel(30, "X", 2, 1, 3, 2),
                parcel(20, "X", 1, 0, 2, 1),
                parcel(10, "X", 1, 2, 2, 3));

        List<AdjacencyPair> found = pairs(new NeighborFinder(), parcels, 0.01);
        List<Integer> hubNeighbours = found.stream()
                .filter(p -> p.getLeftId() == 50)
                .map(AdjacencyPair::getRightId)
                .collect(Collectors.toList());

        assertEquals(List.of(10, 20, 30, 40), hubNeighbours);
        assertEquals(50, found.get(0).getLeftId());
    }

    @Test
    void emptyInputYieldsNoPairs() {
        assertTrue(new NeighborFinder().findPairs(List.of(), List.of()).isEmpty());
    }

    @Test
    void rejectsMismatchedRegionCount() {
        List<LandParcel> parcels = List.of(parcel(1, "A", 0, 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new NeighborFinder().findPairs(parcels, List.of()));
    }

    @Test
    void gridAndTreeFindTheSamePairs() {
        List<LandParcel> parcels = TestParcels.grid(12, 9, 0.3, "A", "B", "C");

        List<AdjacencyPair> tree = pairs(new NeighborFinder(SpatialIndexType.STRTREE, 0, true), parcels, 0.5);
        List<AdjacencyPair> grid = pairs(new NeighborFinder(SpatialIndexType.GRID, 0, true), parcels, 0.5);
        List<AdjacencyPair> sequential = pairs(new NeighborFinder(SpatialIndexType.GRID, 2.5, false), parcels, 0.5);

        assertEquals(tree, grid);
        assertEquals(tree, sequential);
        // gap 0.3 < buffer 0.5 reaches orthogonal neighbours; diagonal distance 0.42 does too
        Set<Integer> cornerNeighbours = tree.stream()
                .filter(p -> p.getLeftId() == 0)
                .map(AdjacencyPair::getRightId)
                .collect(Collectors.toSet());
        assertEquals(Set.of(1, 12, 13), cornerNeighbours);
    }
}
