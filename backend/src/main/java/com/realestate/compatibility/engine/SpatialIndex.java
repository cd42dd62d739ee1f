package com.realestate.compatibility.engine;

import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * Bounding-box index used to prune candidate neighbours before exact intersection tests.
 * Entries are inserted first, then {@link #build()} is called once; after that the
 * index is read-only and {@link #query(Envelope)} may be called from several threads.
 */
public interface SpatialIndex {

    void insert(int id, Envelope bbox);

    void build();

    /**
     * @return ids of all entries whose box intersects {@code bbox}, ascending, without duplicates
     */
    List<Integer> query(Envelope bbox);

    int size();
}
