package com.realestate.compatibility.engine;

import com.realestate.compatibility.exception.InvalidInputException;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Expands parcel geometries into proximity regions by a uniform adjacency distance.
 */
public class GeometryPreparer {

    private final BufferParameters bufferParameters;
    private final boolean parallel;

    public GeometryPreparer(int quadrantSegments, boolean parallel) {
        this.bufferParameters = new BufferParameters(quadrantSegments);
        this.parallel = parallel;
    }

    public GeometryPreparer() {
        this(BufferParameters.DEFAULT_QUADRANT_SEGMENTS, true);
    }

    /**
     * Minkowski expansion of {@code geometry} by {@code distance}.
     * A zero distance returns the geometry itself, so adjacency degenerates to touching or overlapping.
     *
     * @param geometry parcel footprint in a metric coordinate space
     * @param distance non-negative expansion distance, in coordinate units
     * @return the proximity region
     * @throws InvalidInputException if the distance is negative or not finite
     */
    public Geometry buffer(Geometry geometry, double distance) {
        requireValidDistance(distance);
        if (distance == 0.0) {
            return geometry;
        }
        return BufferOp.bufferOp(geometry, distance, bufferParameters);
    }

    /**
     * Buffers every parcel, preserving input order.
     */
    public List<Geometry> prepareAll(List<LandParcel> parcels, double distance) {
        requireValidDistance(distance);
        return (parallel ? parcels.parallelStream() : parcels.stream())
                .map(parcel -> buffer(parcel.getGeometry(), distance))
                .collect(Collectors.toList());
    }

    static void requireValidDistance(double distance) {
        if (Double.isNaN(distance) || Double.isInfinite(distance)) {
            throw new InvalidInputException("Adjacency distance must be a finite number, got " + distance);
        }
        if (distance < 0) {
            throw new InvalidInputException("Adjacency distance must not be negative, got " + distance);
        }
    }
}
