package com.realestate.compatibility.engine;

import lombok.Value;
import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single land unit entering a compatibility run.
 * Geometry coordinates are expected in a projected, metric space.
 */
@Value
public class LandParcel {

    int id;
    Geometry geometry;
    String landUseClass;

    // Source properties, carried through unchanged into the scored output
    Map<String, Object> attributes;

    public LandParcel(int id, Geometry geometry, String landUseClass) {
        this(id, geometry, landUseClass, Collections.emptyMap());
    }

    public LandParcel(int id, Geometry geometry, String landUseClass, Map<String, Object> attributes) {
        this.id = id;
        this.geometry = geometry;
        this.landUseClass = landUseClass;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
