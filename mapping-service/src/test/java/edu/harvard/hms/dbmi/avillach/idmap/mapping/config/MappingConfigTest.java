package edu.harvard.hms.dbmi.avillach.idmap.mapping.config;

import edu.harvard.hms.dbmi.avillach.idmap.mapping.MappingFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MappingConfigTest {

    @TempDir
    Path tempDir;

    private Path samples;
    private Path reference;

    @BeforeEach
    void setUp() throws IOException {
        samples = MappingFixtures.sampleCorpus(tempDir, List.of(Map.of("ID", 1)));
        reference = MappingFixtures.referenceCorpus(tempDir, List.of());
    }

    @Test
    void defaultsMatchTheStandardLayout() {
        MappingConfig config = new MappingConfig();

        assertEquals("GRCh38", config.getAssembly());
        assertEquals(50000, config.getMaxIds());
        assertEquals("ID", config.getIdField());
        assertEquals("data/clinvar/variant_summary.txt.gz", config.getReferencePath());
        assertEquals("data/processed/pickle_id_to_chrposrefalt.tsv", config.getOutputPath());
    }

    @Test
    void validConfigurationCreatesOutputDirectories() {
        MappingConfig config = MappingFixtures.config(samples, reference, tempDir.resolve("nested/out"));

        assertDoesNotThrow(config::validateAndLog);
        assertTrue(Files.isDirectory(tempDir.resolve("nested/out")));
    }

    @Test
    void missingInputsAreReportedTogether() {
        MappingConfig config = MappingFixtures.config(tempDir.resolve("absent.frames"), tempDir.resolve("absent.gz"), tempDir);

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("Sample corpus not found"));
        assertTrue(e.getMessage().contains("Reference corpus not found"));
    }

    @Test
    void nonPositiveMaxIdsIsRejected() {
        MappingConfig config = MappingFixtures.config(samples, reference, tempDir);
        config.setMaxIds(0);

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("idmap.max-ids"));
    }

    @Test
    void blankRequiredPropertiesAreRejected() {
        MappingConfig config = MappingFixtures.config(samples, reference, tempDir);
        config.setSamplePath(" ");
        config.setIdField("");

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("idmap.sample-path is required"));
        assertTrue(e.getMessage().contains("idmap.id-field is required"));
    }

    @Test
    void outputTablesMustDiffer() {
        MappingConfig config = MappingFixtures.config(samples, reference, tempDir);
        config.setAmbiguousOutputPath(config.getOutputPath());

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);
        assertTrue(e.getMessage().contains("must differ"));
    }
}
