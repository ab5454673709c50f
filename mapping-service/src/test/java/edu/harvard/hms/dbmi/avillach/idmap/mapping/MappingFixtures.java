package edu.harvard.hms.dbmi.avillach.idmap.mapping;

import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleRecordWriter;
import edu.harvard.hms.dbmi.avillach.idmap.mapping.config.MappingConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

public final class MappingFixtures {

    public static final String HEADER = String.join(
        "\t", "#AlleleID", "Type", "VariationID", "Assembly", "Chromosome", "PositionVCF", "ReferenceAlleleVCF", "AlternateAlleleVCF"
    );

    private MappingFixtures() {
    }

    public static Path sampleCorpus(Path dir, List<Map<String, Object>> records) throws IOException {
        Path target = dir.resolve("samples.frames");
        try (SampleRecordWriter writer = new SampleRecordWriter(target)) {
            for (Map<String, Object> record : records) {
                writer.write(record);
            }
        }
        return target;
    }

    public static Path referenceCorpus(Path dir, List<String> rows) throws IOException {
        Path target = dir.resolve("variant_summary.txt.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
            out.write((HEADER + "\n").getBytes(StandardCharsets.UTF_8));
            for (String row : rows) {
                out.write((row + "\n").getBytes(StandardCharsets.UTF_8));
            }
        }
        return target;
    }

    public static String row(String variationId, String assembly, String chromosome, String position, String ref, String alt) {
        return String.join("\t", "1", "single nucleotide variant", variationId, assembly, chromosome, position, ref, alt);
    }

    public static MappingConfig config(Path samples, Path reference, Path outputDir) {
        MappingConfig config = new MappingConfig();
        config.setSamplePath(samples.toString());
        config.setReferencePath(reference.toString());
        config.setOutputPath(outputDir.resolve("unique.tsv").toString());
        config.setAmbiguousOutputPath(outputDir.resolve("ambiguous.tsv").toString());
        return config;
    }
}
