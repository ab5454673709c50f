package edu.harvard.hms.dbmi.avillach.idmap.etl.sample.inspect;

import com.fasterxml.jackson.databind.JsonNode;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleRecord;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleRecordReader;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleValues;

import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Summarizes the column names used across the head of a sample corpus.
 *
 * <p>Records that are arrays of two element arrays are read as lists of key/value pairs. Column
 * names that parse as numbers are counted separately from named columns, and named columns are
 * grouped by the prefix before their first underscore.</p>
 *
 * <p>Usage: {@code SampleColumnSummarizer --path <file> [--max-rows 200] [--max-cols-print 200]}</p>
 */
public class SampleColumnSummarizer {

    private static final int TOP_PREFIXES = 10;
    private static final int NUMERIC_PREVIEW = 10;

    public static void main(String[] args) throws IOException {
        InspectorArguments arguments;
        try {
            arguments = new InspectorArguments(args);
            arguments.requiredPath("path");
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: SampleColumnSummarizer --path <file> [--max-rows 200] [--max-cols-print 200]");
            System.exit(1);
            return;
        }
        Path path = arguments.requiredPath("path");
        ColumnSummary summary = new SampleColumnSummarizer().summarize(path, arguments.intValue("max-rows", 200));
        summary.print(System.out, path.getFileName().toString(), arguments.intValue("max-cols-print", 200));
    }

    public ColumnSummary summarize(Path samplePath, int maxRows) throws IOException {
        List<SampleRecord> records = new ArrayList<>();
        try (SampleRecordReader reader = new SampleRecordReader(samplePath)) {
            while (records.size() < maxRows) {
                Optional<SampleRecord> next = reader.next();
                if (next.isEmpty()) {
                    break;
                }
                records.add(next.get());
            }
        }
        return summarize(records);
    }

    public ColumnSummary summarize(List<SampleRecord> records) {
        Set<String> columns = new LinkedHashSet<>();
        for (SampleRecord record : records) {
            if (record.isStructured()) {
                columns.addAll(record.fields().keySet());
            } else {
                pairKeys(record.payload()).ifPresent(columns::addAll);
            }
        }

        List<String> numericNamed = new ArrayList<>();
        List<String> named = new ArrayList<>();
        for (String column : columns) {
            if (isNumeric(column)) {
                numericNamed.add(column);
            } else {
                named.add(column);
            }
        }
        named.sort(null);

        Tally prefixes = new Tally();
        for (String column : named) {
            int underscore = column.indexOf('_');
            prefixes.add(underscore >= 0 ? column.substring(0, underscore) : column);
        }

        return new ColumnSummary(
            records.size(), columns.size(), numericNamed.size(),
            List.copyOf(numericNamed.subList(0, Math.min(NUMERIC_PREVIEW, numericNamed.size()))),
            List.copyOf(named), prefixes.mostCommon(TOP_PREFIXES)
        );
    }

    /**
     * Keys of a record given as {@code [[key, value], ...]}; empty when the payload has any other shape.
     */
    static Optional<List<String>> pairKeys(JsonNode payload) {
        if (payload == null || !payload.isArray()) {
            return Optional.empty();
        }
        List<String> keys = new ArrayList<>();
        for (JsonNode pair : payload) {
            if (!pair.isArray() || pair.size() != 2 || pair.get(0).isContainerNode()) {
                return Optional.empty();
            }
            keys.add(SampleValues.display(pair.get(0)));
        }
        return Optional.of(keys);
    }

    static boolean isNumeric(String column) {
        try {
            new BigDecimal(column.trim());
            return !column.isBlank();
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public record ColumnSummary(
        int recordsSampled,
        int totalColumns,
        int numericNamedCount,
        List<String> numericNamedPreview,
        List<String> namedColumns,
        List<Map.Entry<String, Long>> topPrefixes
    ) {

        public void print(PrintStream out, String sourceName, int maxColumnsPrint) {
            out.println("=== " + sourceName + " ===");
            out.println("Rows sampled: " + recordsSampled);
            out.println("Total columns: " + totalColumns);
            out.println("Numeric-named columns (count): " + numericNamedCount);
            if (numericNamedCount > 0) {
                out.println("Numeric-named preview: " + numericNamedPreview);
            }

            out.println("Top string-column prefixes (prefix,count):");
            topPrefixes.forEach(e -> out.println("  " + e.getKey() + ": " + e.getValue()));

            if (namedColumns.size() <= maxColumnsPrint) {
                out.println("String columns:");
                namedColumns.forEach(c -> out.println("  " + c));
            } else {
                out.println("String columns: " + namedColumns.size() + " total; first 80:");
                namedColumns.subList(0, Math.min(80, namedColumns.size())).forEach(c -> out.println("  " + c));
                out.println("...");
                namedColumns.subList(Math.max(0, namedColumns.size() - 20), namedColumns.size()).forEach(c -> out.println("  " + c));
            }
        }
    }
}
