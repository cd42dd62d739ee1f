package com.realestate.compatibility.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

import jakarta.persistence.*;

/**
 * Parcel row of the stored land-use layer. Geometry is expected in a projected SRID.
 */
@Entity
@Table(name = "land_parcels")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Parcel {
    @Id
    private Integer id;

    @Column(columnDefinition = "geometry")
    private Geometry geom;

    @Column(name = "land_use")
    private String landUse;

    private String zoning;

    @Column(name = "zoning_typ")
    private String zoningType;

    @Column(name = "zoning_sub")
    private String zoningSub;

    @Column(name = "usedesc")
    private String useDescription;
}
