package com.realestate.compatibility.util;

import com.realestate.compatibility.engine.LandUseBreakdownRow;
import com.realestate.compatibility.engine.ScoreSummaryRow;
import com.realestate.compatibility.engine.SummaryReporter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the summary tables as CSV.
 */
public class SummaryCsvWriter {

    private SummaryCsvWriter() {
    }

    public static String overallSummary(List<ScoreSummaryRow> rows) {
        StringBuilder out = new StringBuilder();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader("compatibility_score", "parcel_count", "percentage")
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (ScoreSummaryRow row : rows) {
                printer.printRecord(row.getCompatibilityScore(), row.getParcelCount(), row.getPercentage());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render overall summary", e);
        }
        return out.toString();
    }

    public static String detailedBreakdown(List<LandUseBreakdownRow> rows, String landUseField) {
        List<String> header = new ArrayList<>();
        header.add(landUseField);
        for (int score = SummaryReporter.MIN_SCORE; score <= SummaryReporter.MAX_SCORE; score++) {
            header.add(String.valueOf(score));
        }
        header.add("total_parcels");

        StringBuilder out = new StringBuilder();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (LandUseBreakdownRow row : rows) {
                List<Object> record = new ArrayList<>();
                record.add(row.getLandUseClass());
                for (int score = SummaryReporter.MIN_SCORE; score <= SummaryReporter.MAX_SCORE; score++) {
                    record.add(row.getCountsByScore().getOrDefault(score, 0L));
                }
                record.add(row.getTotalParcels());
                printer.printRecord(record);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render detailed breakdown", e);
        }
        return out.toString();
    }
}
