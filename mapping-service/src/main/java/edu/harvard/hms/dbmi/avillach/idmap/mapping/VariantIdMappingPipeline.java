package edu.harvard.hms.dbmi.avillach.idmap.mapping;

import edu.harvard.hms.dbmi.avillach.idmap.etl.output.TsvMappingSink;
import edu.harvard.hms.dbmi.avillach.idmap.etl.reference.ReferenceRowFilter;
import edu.harvard.hms.dbmi.avillach.idmap.etl.reference.ReferenceScanner;
import edu.harvard.hms.dbmi.avillach.idmap.etl.reference.ScanResult;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.ResolutionStats;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.VariantIdResolver;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.CollectedIdentifiers;
import edu.harvard.hms.dbmi.avillach.idmap.etl.sample.SampleIdentifierCollector;
import edu.harvard.hms.dbmi.avillach.idmap.mapping.config.MappingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the three mapping phases in order: collect wanted identifiers from the sample corpus,
 * scan the reference corpus once, then write the unique and ambiguous tables.
 *
 * <p>Any I/O failure aborts the run. Output files already opened are left as they are; a
 * rerun with the same inputs rewrites them from scratch.</p>
 */
public class VariantIdMappingPipeline {
    private static final Logger log = LoggerFactory.getLogger(VariantIdMappingPipeline.class);

    private final MappingConfig config;

    public VariantIdMappingPipeline(MappingConfig config) {
        this.config = config;
    }

    public MappingReport run() throws IOException {
        Path samplePath = Path.of(config.getSamplePath());
        Path referencePath = Path.of(config.getReferencePath());
        Path uniquePath = Path.of(config.getOutputPath());
        Path ambiguousPath = Path.of(config.getAmbiguousOutputPath());

        log.info("Collecting up to {} identifiers from {}", config.getMaxIds(), samplePath);
        CollectedIdentifiers identifiers = new SampleIdentifierCollector(config.getIdField()).collect(samplePath, config.getMaxIds());

        ReferenceRowFilter filter = new ReferenceRowFilter(identifiers.identifiers(), config.getAssembly());
        ScanResult scan = new ReferenceScanner(filter).scan(referencePath);

        ResolutionStats resolution;
        try (TsvMappingSink sink = new TsvMappingSink(uniquePath, ambiguousPath)) {
            resolution = new VariantIdResolver().resolve(scan.candidates(), sink);
        }

        int unresolved = identifiers.size() - scan.candidates().size();
        if (unresolved > 0) {
            log.info("{} collected identifiers had no surviving reference candidate", unresolved);
        }

        return new MappingReport(
            samplePath,
            identifiers.size(),
            scan.stats().getRowsScanned(),
            scan.stats().getRowsKept(),
            scan.stats().getRejections(),
            resolution.uniqueWritten(),
            uniquePath,
            resolution.ambiguousWritten(),
            resolution.ambiguousIdentifiers(),
            ambiguousPath
        );
    }
}
