package com.realestate.compatibility.service;

import com.realestate.compatibility.engine.LandParcel;
import com.realestate.compatibility.exception.InvalidInputException;
import com.realestate.compatibility.exception.ParcelSourceException;
import com.realestate.compatibility.model.Parcel;
import com.realestate.compatibility.repository.ParcelRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.JDBCConnectionException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the parcel layer stored in PostGIS as engine input.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoredParcelService {

    public static final List<String> ATTRIBUTE_FIELDS = List.of("land_use", "zoning", "zoning_typ", "zoning_sub", "usedesc");

    private final ParcelRepository parcelRepository;

    /**
     * Load every stored parcel with a geometry, classified by the given attribute column.
     *
     * @param landUseField one of {@link #ATTRIBUTE_FIELDS}
     * @return parcels and the SRID of the layer (0 when unknown)
     * @throws InvalidInputException if the field is not a stored attribute
     * @throws ParcelSourceException if the layer cannot be read
     */
    @Transactional(readOnly = true)
    public StoredParcels loadParcels(String landUseField) {
        if (!ATTRIBUTE_FIELDS.contains(landUseField)) {
            throw new InvalidInputException(String.format(
                    "Land use field '%s' not found on stored parcels. Available fields are: %s",
                    landUseField, ATTRIBUTE_FIELDS));
        }

        List<Parcel> rows;
        try {
            rows = parcelRepository.findAllWithGeometry();
        } catch (JDBCConnectionException e) {
            log.error("Database connection error while loading stored parcels", e);
            throw new ParcelSourceException("Unable to connect to the parcel database", e);
        } catch (DataAccessException e) {
            log.error("Error accessing database while loading stored parcels", e);
            throw new ParcelSourceException("Stored parcel layer could not be read", e);
        }

        List<LandParcel> parcels = new ArrayList<>(rows.size());
        int srid = 0;
        for (Parcel row : rows) {
            Map<String, Object> attributes = attributesOf(row);
            Object landUse = attributes.get(landUseField);
            parcels.add(new LandParcel(row.getId(), row.getGeom(), landUse != null ? landUse.toString() : null, attributes));
            if (srid == 0) {
                srid = row.getGeom().getSRID();
            }
        }
        log.info("Loaded {} stored parcels (SRID {})", parcels.size(), srid);
        return new StoredParcels(parcels, srid);
    }

    static Map<String, Object> attributesOf(Parcel parcel) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("land_use", parcel.getLandUse());
        attributes.put("zoning", parcel.getZoning());
        attributes.put("zoning_typ", parcel.getZoningType());
        attributes.put("zoning_sub", parcel.getZoningSub());
        attributes.put("usedesc", parcel.getUseDescription());
        return attributes;
    }

    @Value
    public static class StoredParcels {
        List<LandParcel> parcels;
        int srid;
    }
}
