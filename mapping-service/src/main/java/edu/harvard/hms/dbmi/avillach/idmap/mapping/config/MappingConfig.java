package edu.harvard.hms.dbmi.avillach.idmap.mapping.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the variant ID mapper.
 *
 * Uses Spring Boot property binding with fail-fast validation.
 * All properties use the "idmap.*" prefix.
 */
@ConfigurationProperties(prefix = "idmap")
@Validated
public class MappingConfig {
    private static final Logger log = LoggerFactory.getLogger(MappingConfig.class);

    private String samplePath = "data/samples/esm2_selected_features.frames";
    private String referencePath = "data/clinvar/variant_summary.txt.gz";
    private String outputPath = "data/processed/pickle_id_to_chrposrefalt.tsv";
    private String ambiguousOutputPath = "data/processed/pickle_id_to_chrposrefalt_ambiguous.tsv";

    // empty = keep every assembly, otherwise matched exactly as written
    private String assembly = "GRCh38";
    // raise (e.g. 100000000) for a full coverage mapping
    private int maxIds = 50000;
    private String idField = "ID";

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        List<String> errors = new ArrayList<>();

        if (isBlank(samplePath)) {
            errors.add("idmap.sample-path is required");
        }
        if (isBlank(referencePath)) {
            errors.add("idmap.reference-path is required");
        }
        if (isBlank(outputPath)) {
            errors.add("idmap.output-path is required");
        }
        if (isBlank(ambiguousOutputPath)) {
            errors.add("idmap.ambiguous-output-path is required");
        }
        if (isBlank(idField)) {
            errors.add("idmap.id-field is required");
        }
        if (maxIds <= 0) {
            errors.add("idmap.max-ids must be positive, was " + maxIds);
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Missing or invalid configuration properties:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        if (!Files.isRegularFile(Path.of(samplePath))) {
            errors.add("Sample corpus not found: " + samplePath);
        }
        if (!Files.isRegularFile(Path.of(referencePath))) {
            errors.add("Reference corpus not found: " + referencePath);
        }
        if (Path.of(outputPath).toAbsolutePath().equals(Path.of(ambiguousOutputPath).toAbsolutePath())) {
            errors.add("idmap.output-path and idmap.ambiguous-output-path must differ: " + outputPath);
        }
        for (String output : List.of(outputPath, ambiguousOutputPath)) {
            Path parent = Path.of(output).toAbsolutePath().getParent();
            try {
                Files.createDirectories(parent);
                if (!Files.isWritable(parent)) {
                    errors.add("Output directory is not writable: " + parent);
                }
            } catch (Exception e) {
                errors.add("Cannot create output directory: " + parent + " - " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Sample corpus: {}", samplePath);
        log.info("Reference corpus: {}", referencePath);
        log.info("Unique mappings output: {}", outputPath);
        log.info("Ambiguous mappings output: {}", ambiguousOutputPath);
        log.info("Assembly: {}", assembly == null || assembly.isEmpty() ? "(any - assembly filter disabled)" : "[" + assembly + "]");
        log.info("Max IDs: {}", maxIds);
        log.info("ID field: {}", idField);
        log.info("================================");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getSamplePath() {
        return samplePath;
    }

    public void setSamplePath(String samplePath) {
        this.samplePath = samplePath;
    }

    public String getReferencePath() {
        return referencePath;
    }

    public void setReferencePath(String referencePath) {
        this.referencePath = referencePath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public String getAmbiguousOutputPath() {
        return ambiguousOutputPath;
    }

    public void setAmbiguousOutputPath(String ambiguousOutputPath) {
        this.ambiguousOutputPath = ambiguousOutputPath;
    }

    public String getAssembly() {
        return assembly;
    }

    public void setAssembly(String assembly) {
        this.assembly = assembly;
    }

    public int getMaxIds() {
        return maxIds;
    }

    public void setMaxIds(int maxIds) {
        this.maxIds = maxIds;
    }

    public String getIdField() {
        return idField;
    }

    public void setIdField(String idField) {
        this.idField = idField;
    }
}
