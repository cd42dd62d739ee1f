package com.realestate.compatibility.engine;

import com.realestate.compatibility.exception.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeometryPreparerTest {

    private final GeometryPreparer preparer = new GeometryPreparer();

    @Test
    void zeroDistanceKeepsFootprint() {
        Geometry square = TestParcels.rect(0, 0, 1, 1);
        Geometry region = preparer.buffer(square, 0);
        assertTrue(region.equalsTopo(square));
    }

    @Test
    void bufferExpandsEnvelopeByDistance() {
        Geometry region = preparer.buffer(TestParcels.rect(0, 0, 1, 1), 0.5);
        Envelope env = region.getEnvelopeInternal();

        assertEquals(-0.5, env.getMinX(), 1e-9);
        assertEquals(-0.5, env.getMinY(), 1e-9);
        assertEquals(1.5, env.getMaxX(), 1e-9);
        assertEquals(1.5, env.getMaxY(), 1e-9);
        assertTrue(region.getArea() > 1.0);
        assertTrue(region.contains(TestParcels.rect(0, 0, 1, 1)));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, Double.NaN, Double.POSITIVE_INFINITY})
    void rejectsInvalidDistance(double distance) {
        assertThrows(InvalidInputException.class, () -> preparer.buffer(TestParcels.rect(0, 0, 1, 1), distance));
    }

    @Test
    void prepareAllPreservesOrder() {
        List<LandParcel> parcels = TestParcels.grid(5, 4, 2.0, "A");
        List<Geometry> regions = new GeometryPreparer(8, true).prepareAll(parcels, 0.25);

        assertEquals(parcels.size(), regions.size());
        for (int i = 0; i < parcels.size(); i++) {
            assertTrue(regions.get(i).contains(parcels.get(i).getGeometry()), "region " + i);
        }
    }

    @Test
    void prepareAllAcceptsEmptyInput() {
        assertTrue(preparer.prepareAll(List.of(), 10).isEmpty());
    }
}
