package edu.harvard.hms.dbmi.avillach.idmap.etl.sample.inspect;

import com.fasterxml.jackson.databind.JsonNode;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleRecord;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleRecordReader;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleValues;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Samples the head of a sample corpus and reports on its record layout: record kinds, the union
 * of keys, identifier and pathogenicity values, embedding containers and missing values per key.
 *
 * <p>Usage: {@code SampleSchemaInspector --path <file> [--max-rows 500] [--id-samples 10] [--pathogenicity-samples 20]}</p>
 */
public class SampleSchemaInspector {

    static final String ID_FIELD = "ID";
    static final String PATHOGENICITY_FIELD = "Pathogenicity";
    static final String EMBEDDING_FIELD = "Embedding";
    static final String EMBEDDING_LAYER = "36";

    public static void main(String[] args) throws IOException {
        InspectorArguments arguments;
        try {
            arguments = new InspectorArguments(args);
            arguments.requiredPath("path");
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: SampleSchemaInspector --path <file> [--max-rows 500] [--id-samples 10] [--pathogenicity-samples 20]");
            System.exit(1);
            return;
        }
        SchemaReport report = new SampleSchemaInspector().inspect(arguments.requiredPath("path"), arguments.intValue("max-rows", 500));
        report.print(System.out, arguments.intValue("id-samples", 10), arguments.intValue("pathogenicity-samples", 20));
    }

    public SchemaReport inspect(Path samplePath, int maxRows) throws IOException {
        SchemaReport report = new SchemaReport(samplePath.getFileName().toString());
        try (SampleRecordReader reader = new SampleRecordReader(samplePath)) {
            while (report.recordsSampled < maxRows) {
                Optional<SampleRecord> next = reader.next();
                if (next.isEmpty()) {
                    break;
                }
                report.accept(next.get());
            }
        }
        return report;
    }

    public static class SchemaReport {

        private final String sourceName;
        private int recordsSampled = 0;
        private final Tally recordTypes = new Tally();
        private final SortedSet<String> keys = new TreeSet<>();
        private final List<JsonNode> pathogenicityValues = new ArrayList<>();
        private final List<JsonNode> idValues = new ArrayList<>();
        private final Tally embeddingTypes = new Tally();
        private final Tally embeddingKeys = new Tally();
        private final Tally embeddingLayerShapes = new Tally();
        private final Tally missingCounts = new Tally();

        SchemaReport(String sourceName) {
            this.sourceName = sourceName;
        }

        void accept(SampleRecord record) {
            recordsSampled++;
            recordTypes.add(record.payloadType());
            if (!record.isStructured()) {
                return;
            }
            keys.addAll(record.fields().keySet());
            record.field(PATHOGENICITY_FIELD).ifPresent(pathogenicityValues::add);
            record.field(ID_FIELD).ifPresent(idValues::add);
            record.field(EMBEDDING_FIELD).ifPresent(this::acceptEmbedding);
            record.fields().forEach((key, value) -> {
                if (SampleValues.isMissing(value)) {
                    missingCounts.add(key);
                }
            });
        }

        private void acceptEmbedding(JsonNode embedding) {
            embeddingTypes.add(SampleValues.typeName(embedding));
            if (!embedding.isObject()) {
                return;
            }
            Iterator<String> names = embedding.fieldNames();
            while (names.hasNext()) {
                embeddingKeys.add(names.next());
            }
            if (embedding.has(EMBEDDING_LAYER)) {
                embeddingLayerShapes.add(SampleValues.shape(embedding.get(EMBEDDING_LAYER)).orElse("<no-shape>"));
            }
        }

        public int getRecordsSampled() {
            return recordsSampled;
        }

        public long getRecordTypeCount(String payloadType) {
            return recordTypes.get(payloadType);
        }

        public SortedSet<String> getKeys() {
            return Collections.unmodifiableSortedSet(keys);
        }

        public List<JsonNode> getIdValues() {
            return Collections.unmodifiableList(idValues);
        }

        public List<JsonNode> getPathogenicityValues() {
            return Collections.unmodifiableList(pathogenicityValues);
        }

        public long getMissingCount(String key) {
            return missingCounts.get(key);
        }

        public long getEmbeddingKeyCount(String key) {
            return embeddingKeys.get(key);
        }

        public long getEmbeddingLayerShapeCount(String shape) {
            return embeddingLayerShapes.get(shape);
        }

        public void print(PrintStream out, int idSamples, int pathogenicitySamples) {
            out.println("=== " + sourceName + " ===");
            out.println("Rows sampled: " + recordsSampled);
            out.println("Row types (count):");
            printTally(out, recordTypes.mostCommon(), "  ");

            if (!keys.isEmpty()) {
                out.println();
                out.println("Union of keys (" + keys.size() + "):");
                keys.forEach(k -> out.println("  " + k));
            }

            if (!pathogenicityValues.isEmpty()) {
                Tally values = new Tally();
                Tally types = new Tally();
                pathogenicityValues.forEach(v -> {
                    values.add(SampleValues.display(v));
                    types.add(SampleValues.typeName(v));
                });
                out.println();
                out.println(PATHOGENICITY_FIELD + ":");
                out.println("  Value types:");
                printTally(out, types.mostCommon(), "    ");
                out.println("  Unique values (top 30):");
                printTally(out, values.mostCommon(30), "    ");
                printSamples(out, pathogenicityValues, pathogenicitySamples);
            }

            if (!idValues.isEmpty()) {
                Tally types = new Tally();
                idValues.forEach(v -> types.add(SampleValues.typeName(v)));
                out.println();
                out.println(ID_FIELD + ":");
                out.println("  Value types:");
                printTally(out, types.mostCommon(), "    ");
                printSamples(out, idValues, idSamples);
            }

            if (!embeddingTypes.isEmpty()) {
                out.println();
                out.println(EMBEDDING_FIELD + ":");
                out.println("  Container types:");
                printTally(out, embeddingTypes.mostCommon(), "    ");
                if (!embeddingKeys.isEmpty()) {
                    out.println("  Keys (key,count):");
                    printTally(out, embeddingKeys.mostCommon(), "    ");
                }
                if (!embeddingLayerShapes.isEmpty()) {
                    out.println("  Shapes for " + EMBEDDING_FIELD + "['" + EMBEDDING_LAYER + "']:");
                    printTally(out, embeddingLayerShapes.mostCommon(), "    ");
                }
            }

            if (!missingCounts.isEmpty()) {
                out.println();
                out.println("Missing values (null/NaN) per key (top 30):");
                printTally(out, missingCounts.mostCommon(30), "  ");
            }
        }

        private static void printSamples(PrintStream out, List<JsonNode> values, int limit) {
            int shown = Math.min(limit, values.size());
            out.println("  Samples (first " + shown + "):");
            for (JsonNode value : values.subList(0, shown)) {
                out.println("    " + value);
            }
        }

        private static void printTally(PrintStream out, List<Map.Entry<String, Long>> entries, String indent) {
            entries.forEach(e -> out.println(indent + e.getKey() + ": " + e.getValue()));
        }
    }
}
