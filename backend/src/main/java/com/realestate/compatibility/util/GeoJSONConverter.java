package com.realestate.compatibility.util;

import com.realestate.compatibility.engine.LandParcel;
import com.realestate.compatibility.engine.ScoredParcel;
import com.realestate.compatibility.exception.InvalidInputException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts between GeoJSON feature collections (as Jackson maps) and parcels.
 * Only Polygon and MultiPolygon geometries are supported.
 */
public class GeoJSONConverter {

    public static final String SCORE_PROPERTY = "compat_score";

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    private GeoJSONConverter() {
    }

    /**
     * Reads parcels from a FeatureCollection.
     * Feature ids are used when every feature has an integral id; otherwise ids 0..N-1
     * are assigned in feature order. A feature without the land-use property gets a null
     * class, which never resolves against the matrix.
     *
     * @param featureCollection parsed GeoJSON
     * @param landUseField      property holding the land-use class
     * @throws InvalidInputException on a malformed collection or geometry, duplicate feature ids,
     *                               or when no feature carries the land-use field
     */
    public static List<LandParcel> readParcels(Map<String, Object> featureCollection, String landUseField) {
        List<Map<String, Object>> features = features(featureCollection);
        List<Integer> ids = resolveIds(features);

        List<Map<String, Object>> propertiesByFeature = new ArrayList<>(features.size());
        Set<String> availableFields = new TreeSet<>();
        boolean fieldPresent = false;
        for (int i = 0; i < features.size(); i++) {
            Map<String, Object> properties = properties(features.get(i), i);
            propertiesByFeature.add(properties);
            availableFields.addAll(properties.keySet());
            fieldPresent |= properties.containsKey(landUseField);
        }
        if (!features.isEmpty() && !fieldPresent) {
            throw new InvalidInputException(String.format(
                    "Land use field '%s' not found on any feature. Available fields are: %s",
                    landUseField, availableFields));
        }

        List<LandParcel> parcels = new ArrayList<>(features.size());
        for (int i = 0; i < features.size(); i++) {
            Map<String, Object> properties = propertiesByFeature.get(i);
            Object landUse = properties.get(landUseField);
            Geometry geometry = readGeometry(features.get(i).get("geometry"), i);
            parcels.add(new LandParcel(ids.get(i), geometry, landUse != null ? landUse.toString() : null, properties));
        }
        return parcels;
    }

    /**
     * Name of the coordinate reference system from the legacy {@code crs} member, if any.
     */
    public static String readCrsName(Map<String, Object> featureCollection) {
        if (featureCollection == null || !(featureCollection.get("crs") instanceof Map)) {
            return null;
        }
        Object properties = ((Map<?, ?>) featureCollection.get("crs")).get("properties");
        if (properties instanceof Map) {
            Object name = ((Map<?, ?>) properties).get("name");
            return name != null ? name.toString() : null;
        }
        return null;
    }

    /**
     * Writes scored parcels back as a FeatureCollection: original properties plus {@value #SCORE_PROPERTY}.
     */
    public static Map<String, Object> convertToGeoJSON(List<ScoredParcel> scoredParcels) {
        Map<String, Object> featureCollection = new LinkedHashMap<>();
        featureCollection.put("type", "FeatureCollection");

        List<Map<String, Object>> features = new ArrayList<>(scoredParcels.size());
        for (ScoredParcel scored : scoredParcels) {
            LandParcel parcel = scored.getParcel();

            Map<String, Object> feature = new LinkedHashMap<>();
            feature.put("type", "Feature");
            feature.put("id", parcel.getId());

            Map<String, Object> properties = new LinkedHashMap<>(parcel.getAttributes());
            properties.put(SCORE_PROPERTY, scored.getCompatScore());
            feature.put("properties", properties);
            feature.put("geometry", convertGeometryToGeoJSON(parcel.getGeometry()));

            features.add(feature);
        }

        featureCollection.put("features", features);
        return featureCollection;
    }

    public static Map<String, Object> convertGeometryToGeoJSON(Geometry geometry) {
        if (geometry == null) {
            return null;
        }

        Map<String, Object> json = new LinkedHashMap<>();
        if (geometry instanceof Polygon) {
            json.put("type", "Polygon");
            json.put("coordinates", polygonCoordinates((Polygon) geometry));
        } else if (geometry instanceof MultiPolygon) {
            List<List<List<List<Double>>>> polygons = new ArrayList<>();
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                polygons.add(polygonCoordinates((Polygon) geometry.getGeometryN(i)));
            }
            json.put("type", "MultiPolygon");
            json.put("coordinates", polygons);
        } else {
            throw new IllegalArgumentException("Unsupported geometry type " + geometry.getGeometryType());
        }
        return json;
    }

    private static List<List<List<Double>>> polygonCoordinates(Polygon polygon) {
        List<List<List<Double>>> rings = new ArrayList<>();
        rings.add(ringCoordinates(polygon.getExteriorRing().getCoordinates()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(ringCoordinates(polygon.getInteriorRingN(i).getCoordinates()));
        }
        return rings;
    }

    private static List<List<Double>> ringCoordinates(Coordinate[] coordinates) {
        List<List<Double>> ring = new ArrayList<>(coordinates.length);
        for (Coordinate coord : coordinates) {
            List<Double> point = new ArrayList<>(2);
            point.add(coord.x);
            point.add(coord.y);
            ring.add(point);
        }
        return ring;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> features(Map<String, Object> featureCollection) {
        if (featureCollection == null || !"FeatureCollection".equals(featureCollection.get("type"))) {
            throw new InvalidInputException("Parcels must be supplied as a GeoJSON FeatureCollection");
        }
        Object features = featureCollection.get("features");
        if (!(features instanceof List)) {
            throw new InvalidInputException("GeoJSON FeatureCollection has no 'features' array");
        }

        List<Map<String, Object>> result = new ArrayList<>();
        int index = 0;
        for (Object feature : (List<Object>) features) {
            if (!(feature instanceof Map)) {
                throw new InvalidInputException("Feature " + index + " is not a GeoJSON object");
            }
            result.add((Map<String, Object>) feature);
            index++;
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> properties(Map<String, Object> feature, int index) {
        Object properties = feature.get("properties");
        if (properties == null) {
            return Collections.emptyMap();
        }
        if (!(properties instanceof Map)) {
            throw new InvalidInputException("Feature " + index + " has a non-object 'properties' member");
        }
        return (Map<String, Object>) properties;
    }

    private static List<Integer> resolveIds(List<Map<String, Object>> features) {
        boolean allIdentified = features.stream()
                .map(feature -> feature.get("id"))
                .allMatch(id -> id instanceof Number && isIntegral((Number) id));

        List<Integer> ids = new ArrayList<>(features.size());
        if (!allIdentified) {
            for (int i = 0; i < features.size(); i++) {
                ids.add(i);
            }
            return ids;
        }

        Set<Integer> seen = new HashSet<>();
        for (Map<String, Object> feature : features) {
            int value = ((Number) feature.get("id")).intValue();
            if (!seen.add(value)) {
                throw new InvalidInputException("Duplicate feature id " + value + " in parcel collection");
            }
            ids.add(value);
        }
        return ids;
    }

    private static boolean isIntegral(Number number) {
        double value = number.doubleValue();
        return value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    private static Geometry readGeometry(Object geometry, int index) {
        if (!(geometry instanceof Map)) {
            throw new InvalidInputException("Feature " + index + " has no geometry");
        }
        Map<?, ?> json = (Map<?, ?>) geometry;
        Object type = json.get("type");
        Object coordinates = json.get("coordinates");

        try {
            if ("Polygon".equals(type)) {
                return readPolygon(coordinates);
            }
            if ("MultiPolygon".equals(type)) {
                List<?> parts = asList(coordinates);
                Polygon[] polygons = new Polygon[parts.size()];
                for (int i = 0; i < parts.size(); i++) {
                    polygons[i] = readPolygon(parts.get(i));
                }
                return geometryFactory.createMultiPolygon(polygons);
            }
        } catch (IllegalArgumentException | ClassCastException | NullPointerException e) {
            throw new InvalidInputException("Feature " + index + " has malformed " + type + " geometry: " + e.getMessage(), e);
        }
        throw new InvalidInputException("Feature " + index + " has unsupported geometry type '" + type
                + "'; only Polygon and MultiPolygon are supported");
    }

    private static Polygon readPolygon(Object coordinates) {
        List<?> rings = asList(coordinates);
        if (rings.isEmpty()) {
            throw new IllegalArgumentException("polygon has no rings");
        }
        LinearRing shell = readRing(rings.get(0));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = readRing(rings.get(i));
        }
        return geometryFactory.createPolygon(shell, holes);
    }

    private static LinearRing readRing(Object ring) {
        List<?> positions = asList(ring);
        Coordinate[] coordinates = new Coordinate[positions.size()];
        for (int i = 0; i < positions.size(); i++) {
            List<?> position = asList(positions.get(i));
            if (position.size() < 2) {
                throw new IllegalArgumentException("position needs at least two ordinates");
            }
            coordinates[i] = new Coordinate(((Number) position.get(0)).doubleValue(),
                    ((Number) position.get(1)).doubleValue());
        }
        // LinearRing rejects unclosed or too short rings with IllegalArgumentException
        return geometryFactory.createLinearRing(coordinates);
    }

    private static List<?> asList(Object value) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("expected a coordinate array");
        }
        return (List<?>) value;
    }
}
