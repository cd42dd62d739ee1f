package com.realestate.compatibility.util;

import com.realestate.compatibility.engine.CompatibilityMatrix;
import com.realestate.compatibility.exception.InvalidInputException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads a compatibility matrix from CSV.
 * <pre>
 * use,Residential,Industrial
 * Residential,5,1
 * Industrial,2,5
 * </pre>
 * The first column holds the row class (the parcel being assessed), the header row the
 * column classes (its neighbours). Blank cells are pairs without a score.
 */
public class CompatibilityMatrixCsvReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private CompatibilityMatrixCsvReader() {
    }

    public static CompatibilityMatrix read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InvalidInputException("Compatibility matrix CSV not found at " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new InvalidInputException("Could not read compatibility matrix CSV at " + path, e);
        }
    }

    public static CompatibilityMatrix read(String csv, String source) {
        try {
            return read(new StringReader(csv), source);
        } catch (IOException e) {
            throw new InvalidInputException("Could not read compatibility matrix from " + source, e);
        }
    }

    public static CompatibilityMatrix read(Reader reader, String source) throws IOException {
        CompatibilityMatrix.Builder builder = CompatibilityMatrix.builder();

        try (CSVParser parser = CSVParser.parse(reader, FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new InvalidInputException("Compatibility matrix " + source + " has no header row");
            }
            List<String> columns = headerColumns(records.next());

            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() != columns.size() + 1) {
                    throw new InvalidInputException(String.format(
                            "Compatibility matrix %s, line %d: expected %d cells but found %d",
                            source, parser.getCurrentLineNumber(), columns.size() + 1, record.size()));
                }
                String rowClass = record.get(0);
                for (int c = 0; c < columns.size(); c++) {
                    String cell = record.get(c + 1);
                    if (cell.isEmpty() || cell.equalsIgnoreCase("nan")) {
                        continue;
                    }
                    builder.put(rowClass, columns.get(c), parseScore(cell, source, parser.getCurrentLineNumber()));
                }
            }
        } catch (IllegalStateException | UncheckedIOException e) {
            throw new InvalidInputException("Compatibility matrix " + source + " is not valid CSV: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static List<String> headerColumns(CSVRecord header) {
        List<String> columns = new ArrayList<>(header.size());
        for (int i = 1; i < header.size(); i++) {
            columns.add(header.get(i));
        }
        return columns;
    }

    private static int parseScore(String cell, String source, long line) {
        double value;
        try {
            value = Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new InvalidInputException(String.format(
                    "Compatibility matrix %s, line %d: '%s' is not a number", source, line, cell));
        }
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            throw new InvalidInputException(String.format(
                    "Compatibility matrix %s, line %d: score '%s' is not an integer", source, line, cell));
        }
        return (int) value;
    }
}
