package com.realestate.compatibility.engine;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Uniform grid over bounding boxes. Each entry is registered in every cell its box
 * overlaps; a query collects the entries of the cells overlapped by the query box
 * and keeps those whose own box actually intersects it.
 * <p>
 * Boxes spanning more than {@link #MAX_CELLS_PER_BOX} cells, or lying outside the
 * addressable cell range, are kept in an overflow list that every query scans.
 * A query box of that kind scans all boxes instead of walking cells.
 */
public class GridSpatialIndex implements SpatialIndex {

    static final long MAX_CELLS_PER_BOX = 1L << 16;

    private final double cellSize;
    private final List<Integer> overflow = new ArrayList<>();
    private final Map<Long, List<Integer>> cells = new HashMap<>();
    private final Map<Integer, Envelope> boxes = new HashMap<>();
    private boolean built = false;

    public GridSpatialIndex(double cellSize) {
        if (!(cellSize > 0) || Double.isInfinite(cellSize)) {
            throw new IllegalArgumentException("Grid cell size must be positive and finite, got " + cellSize);
        }
        this.cellSize = cellSize;
    }

    @Override
    public void insert(int id, Envelope bbox) {
        if (built) {
            throw new IllegalStateException("Index already built, no further inserts allowed");
        }
        if (bbox.isNull()) {
            return;
        }
        boxes.put(id, bbox);
        long[] range = cellRange(bbox);
        if (range == null) {
            overflow.add(id);
            return;
        }
        for (long cx = range[0]; cx <= range[1]; cx++) {
            for (long cy = range[2]; cy <= range[3]; cy++) {
                cells.computeIfAbsent(key(cx, cy), k -> new ArrayList<>()).add(id);
            }
        }
    }

    @Override
    public void build() {
        built = true;
    }

    @Override
    public List<Integer> query(Envelope bbox) {
        if (bbox.isNull() || boxes.isEmpty()) {
            return new ArrayList<>();
        }
        TreeSet<Integer> found = new TreeSet<>();
        long[] range = cellRange(bbox);
        if (range == null) {
            collect(boxes.keySet(), bbox, found);
            return new ArrayList<>(found);
        }
        for (long cx = range[0]; cx <= range[1]; cx++) {
            for (long cy = range[2]; cy <= range[3]; cy++) {
                List<Integer> ids = cells.get(key(cx, cy));
                if (ids != null) {
                    collect(ids, bbox, found);
                }
            }
        }
        collect(overflow, bbox, found);
        return new ArrayList<>(found);
    }

    @Override
    public int size() {
        return boxes.size();
    }

    public double getCellSize() {
        return cellSize;
    }

    private void collect(Iterable<Integer> ids, Envelope bbox, TreeSet<Integer> found) {
        for (Integer id : ids) {
            if (!found.contains(id) && boxes.get(id).intersects(bbox)) {
                found.add(id);
            }
        }
    }

    /**
     * Cell bounds {minX, maxX, minY, maxY} of a box, or null when the box is too wide
     * for cell-by-cell registration or its cells fall outside the int range.
     */
    private long[] cellRange(Envelope bbox) {
        double minX = Math.floor(bbox.getMinX() / cellSize);
        double maxX = Math.floor(bbox.getMaxX() / cellSize);
        double minY = Math.floor(bbox.getMinY() / cellSize);
        double maxY = Math.floor(bbox.getMaxY() / cellSize);
        if (!addressable(minX) || !addressable(maxX) || !addressable(minY) || !addressable(maxY)) {
            return null;
        }
        if ((maxX - minX + 1) * (maxY - minY + 1) > MAX_CELLS_PER_BOX) {
            return null;
        }
        return new long[]{(long) minX, (long) maxX, (long) minY, (long) maxY};
    }

    private static boolean addressable(double cell) {
        return cell >= Integer.MIN_VALUE && cell <= Integer.MAX_VALUE;
    }

    private static long key(long cx, long cy) {
        return (cx << 32) ^ (cy & 0xffffffffL);
    }
}
