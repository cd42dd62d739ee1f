package com.realestate.compatibility.config;

import com.realestate.compatibility.engine.CompatibilityEngine;
import com.realestate.compatibility.engine.GeometryPreparer;
import com.realestate.compatibility.engine.NeighborFinder;
import com.realestate.compatibility.engine.ScoreAggregator;
import com.realestate.compatibility.engine.SpatialIndexType;
import com.realestate.compatibility.engine.SummaryReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the compatibility engine from {@code compatibility.analysis.*} properties.
 */
@Configuration
@Slf4j
public class AnalysisConfig {

    @Value("${compatibility.analysis.parallel:true}")
    private boolean parallel;

    @Value("${compatibility.analysis.index-type:STRTREE}")
    private SpatialIndexType indexType;

    // 0 derives the cell size from the data
    @Value("${compatibility.analysis.grid-cell-size:0}")
    private double gridCellSize;

    @Value("${compatibility.analysis.buffer-quadrant-segments:8}")
    private int bufferQuadrantSegments;

    @Bean
    public CompatibilityEngine compatibilityEngine() {
        log.info("Compatibility engine: index={}, gridCellSize={}, parallel={}, quadrantSegments={}",
                indexType, gridCellSize, parallel, bufferQuadrantSegments);
        return new CompatibilityEngine(
                new GeometryPreparer(bufferQuadrantSegments, parallel),
                new NeighborFinder(indexType, gridCellSize, parallel),
                new ScoreAggregator(parallel),
                new SummaryReporter(),
                parallel);
    }
}
