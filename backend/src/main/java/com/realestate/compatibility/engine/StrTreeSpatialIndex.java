package com.realestate.compatibility.engine;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Packed R-tree backed by the JTS {@link STRtree}.
 */
public class StrTreeSpatialIndex implements SpatialIndex {

    private final STRtree tree = new STRtree();
    private boolean built = false;
    private int size = 0;

    @Override
    public void insert(int id, Envelope bbox) {
        if (built) {
            throw new IllegalStateException("Index already built, no further inserts allowed");
        }
        if (bbox.isNull()) {
            return;
        }
        tree.insert(bbox, id);
        size++;
    }

    @Override
    public void build() {
        if (!built) {
            tree.build();
            built = true;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Integer> query(Envelope bbox) {
        build();
        List<Integer> ids = new ArrayList<>((List<Integer>) tree.query(bbox));
        Collections.sort(ids);
        return ids;
    }

    @Override
    public int size() {
        return size;
    }
}
