package com.realestate.compatibility.engine;

import org.locationtech.jts.geom.Envelope;

import java.util.List;

public enum SpatialIndexType {

    STRTREE {
        @Override
        public SpatialIndex newIndex(List<Envelope> boxes, double gridCellSize) {
            return new StrTreeSpatialIndex();
        }
    },

    GRID {
        @Override
        public SpatialIndex newIndex(List<Envelope> boxes, double gridCellSize) {
            return new GridSpatialIndex(gridCellSize > 0 ? gridCellSize : deriveCellSize(boxes));
        }
    };

    /**
     * Creates an empty index sized for the given boxes.
     *
     * @param boxes        envelopes about to be inserted
     * @param gridCellSize grid cell size; non-positive derives one from the boxes
     */
    public abstract SpatialIndex newIndex(List<Envelope> boxes, double gridCellSize);

    // Mean of the larger box side, so a typical box spans one or two cells
    static double deriveCellSize(List<Envelope> boxes) {
        double sum = 0;
        int count = 0;
        for (Envelope box : boxes) {
            if (box.isNull()) {
                continue;
            }
            sum += Math.max(box.getWidth(), box.getHeight());
            count++;
        }
        double mean = count == 0 ? 0 : sum / count;
        return mean > 0 ? mean : 1.0;
    }
}
