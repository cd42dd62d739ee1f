package com.realestate.compatibility.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies the coordinate reference system parcels arrive in. Adjacency
 * distances are only meaningful in a projected (metric) space; anything else
 * is reported, never reprojected.
 */
@Component
public class CoordinateSpaceInspector {

    // Common geographic (lon/lat) EPSG codes
    private static final Set<Integer> GEOGRAPHIC_CODES = Set.of(
            4326, 4269, 4258, 4267, 4283, 4230, 4322, 4167, 4490, 4612, 4674, 4617, 4759, 4019);

    private static final Set<String> GEOGRAPHIC_OGC_NAMES = Set.of("CRS84", "CRS83", "CRS27");

    private static final Pattern EPSG_CODE = Pattern.compile("EPSG[:/](?:[\\d.]*[:/])?(\\d+)$");

    public CoordinateSpace inspect(String crsName) {
        if (crsName == null || crsName.isBlank()) {
            return CoordinateSpace.UNDEFINED;
        }
        String name = crsName.trim().toUpperCase(Locale.ROOT);
        for (String ogcName : GEOGRAPHIC_OGC_NAMES) {
            if (name.endsWith(ogcName)) {
                return CoordinateSpace.GEOGRAPHIC;
            }
        }
        return epsgCode(name)
                .map(this::inspect)
                .orElse(CoordinateSpace.PROJECTED);
    }

    /**
     * @param srid spatial reference id; 0 means none was recorded
     */
    public CoordinateSpace inspect(int srid) {
        if (srid <= 0) {
            return CoordinateSpace.UNDEFINED;
        }
        return GEOGRAPHIC_CODES.contains(srid) ? CoordinateSpace.GEOGRAPHIC : CoordinateSpace.PROJECTED;
    }

    /**
     * Warning text for a coordinate space that makes distances unreliable, if any.
     */
    public Optional<String> warningFor(CoordinateSpace space, String crsDescription) {
        switch (space) {
            case UNDEFINED:
                return Optional.of("Input CRS is undefined. Adjacency distances, and hence results, may be unreliable.");
            case GEOGRAPHIC:
                return Optional.of("Input CRS " + crsDescription + " is geographic. Adjacency distances are in degrees, "
                        + "not metres; reproject the parcels to a projected CRS for reliable results.");
            default:
                return Optional.empty();
        }
    }

    private static Optional<Integer> epsgCode(String name) {
        Matcher matcher = EPSG_CODE.matcher(name);
        if (matcher.find()) {
            return Optional.of(Integer.parseInt(matcher.group(1)));
        }
        return Optional.empty();
    }
}
