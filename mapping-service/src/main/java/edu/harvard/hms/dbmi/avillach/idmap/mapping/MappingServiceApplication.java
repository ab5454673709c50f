package edu.harvard.hms.dbmi.avillach.idmap.mapping;

import edu.harvard.hms.dbmi.avillach.idmap.mapping.config.MappingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.time.Duration;
import java.time.Instant;

/**
 * Maps sample corpus variant identifiers to ClinVar chr_pos_ref_alt coordinates.
 *
 * Run with:
 * java -jar mapping-service.jar \
 *   --idmap.sample-path=/path/to/esm2_selected_features.frames \
 *   --idmap.reference-path=/path/to/variant_summary.txt.gz \
 *   --idmap.output-path=/path/to/pickle_id_to_chrposrefalt.tsv \
 *   --idmap.ambiguous-output-path=/path/to/pickle_id_to_chrposrefalt_ambiguous.tsv \
 *   --idmap.assembly=GRCh38
 *
 * For a full coverage mapping of every identifier in the sample corpus add --idmap.max-ids=100000000.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("edu.harvard.hms.dbmi.avillach.idmap.mapping.config")
public class MappingServiceApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(MappingServiceApplication.class);

    private final MappingConfig config;

    public MappingServiceApplication(MappingConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(MappingServiceApplication.class);
        app.run(args);
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting variant ID mapping");
        Instant startTime = Instant.now();

        MappingReport report = new VariantIdMappingPipeline(config).run();
        report.print(System.out);

        log.info("=== MAPPING COMPLETE ===");
        report.rejections().forEach((reason, count) -> log.info("Rejected ({}): {}", reason.getDescription(), count));
        log.info("Ambiguous identifiers: {}", report.ambiguousIdentifiers());
        log.info("Duration: {} seconds", Duration.between(startTime, Instant.now()).toSeconds());
    }
}
