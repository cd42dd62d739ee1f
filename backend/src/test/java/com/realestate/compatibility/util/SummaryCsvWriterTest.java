package com.realestate.compatibility.util;

import com.realestate.compatibility.engine.LandUseBreakdownRow;
import com.realestate.compatibility.engine.ScoreSummaryRow;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SummaryCsvWriterTest {

    @Test
    void overallSummaryHasHeaderAndOneLinePerScore() {
        List<ScoreSummaryRow> rows = List.of(
                new ScoreSummaryRow(1, 2, 50.0),
                new ScoreSummaryRow(2, 0, 0.0),
                new ScoreSummaryRow(3, 0, 0.0),
                new ScoreSummaryRow(4, 0, 0.0),
                new ScoreSummaryRow(5, 2, 50.0));

        String[] lines = SummaryCsvWriter.overallSummary(rows).split("\r\n");

        assertEquals(6, lines.length);
        assertEquals("compatibility_score,parcel_count,percentage", lines[0]);
        assertEquals("1,2,50.0", lines[1]);
        assertEquals("5,2,50.0", lines[5]);
    }

    @Test
    void detailedBreakdownUsesLandUseFieldAsFirstColumn() {
        Map<Integer, Long> counts = new LinkedHashMap<>();
        counts.put(1, 1L);
        counts.put(2, 0L);
        counts.put(3, 0L);
        counts.put(4, 0L);
        counts.put(5, 3L);

        String csv = SummaryCsvWriter.detailedBreakdown(
                List.of(new LandUseBreakdownRow("Residential, low density", counts, 4)), "KARBARI_MO");
        String[] lines = csv.split("\r\n");

        assertEquals("KARBARI_MO,1,2,3,4,5,total_parcels", lines[0]);
        assertEquals("\"Residential, low density\",1,0,0,0,3,4", lines[1]);
    }

    @Test
    void emptyBreakdownIsHeaderOnly() {
        String csv = SummaryCsvWriter.detailedBreakdown(List.of(), "use");
        assertEquals("use,1,2,3,4,5,total_parcels\r\n", csv);
    }
}
