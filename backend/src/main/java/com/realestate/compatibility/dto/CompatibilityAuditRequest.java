package com.realestate.compatibility.dto;

import lombok.Data;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.Map;

@Data
public class CompatibilityAuditRequest {

    // GeoJSON FeatureCollection of Polygon / MultiPolygon parcels
    @NotNull(message = "Parcel collection cannot be null")
    private Map<String, Object> parcels;

    // Row class -> column class -> score; alternative to matrixCsv
    private Map<String, Map<String, Number>> matrix;

    private String matrixCsv;

    @PositiveOrZero(message = "Adjacency distance must be zero or positive")
    private Double adjacencyDistance;

    @Size(min = 1, max = 100, message = "Land use field must be between 1 and 100 characters")
    private String landUseField;

    private String crs;

    @Size(max = 100, message = "Base name must be at most 100 characters")
    private String baseName;

    private String username;
}
