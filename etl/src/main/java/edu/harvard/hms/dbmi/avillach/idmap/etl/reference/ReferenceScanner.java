package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.CandidateIndex;
import edu.harvard.hms.dbmi.avillach.idmap.data.variant.ReferenceRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Streams a gzip compressed, tab delimited reference corpus once and collects candidate
 * coordinates for wanted identifiers.
 *
 * <p>Only the reduced {@link CandidateIndex} is held in memory. Lines are split on tabs alone,
 * quote characters are ordinary data.</p>
 */
public class ReferenceScanner {

    private static final CSVFormat REFERENCE_FORMAT = CSVFormat.DEFAULT.builder()
        .setDelimiter('\t')
        // ClinVar fields may open with a quote character that is never closed
        .setQuote(null)
        .setHeader()
        .setSkipHeaderRecord(true)
        .setAllowMissingColumnNames(true)
        .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
        .setIgnoreEmptyLines(true)
        .build();

    private static final long PROGRESS_INTERVAL = 1_000_000L;

    private final Logger log;
    private final ReferenceRowFilter filter;

    public ReferenceScanner(ReferenceRowFilter filter) {
        this(filter, LoggerFactory.getLogger(ReferenceScanner.class));
    }

    // For testing only
    public ReferenceScanner(ReferenceRowFilter filter, Logger log) {
        this.filter = filter;
        this.log = log;
    }

    public ScanResult scan(Path referencePath) throws IOException {
        log.info("Scanning reference corpus {}", referencePath);
        try (Reader reader = new BufferedReader(
            new InputStreamReader(new GZIPInputStream(Files.newInputStream(referencePath)), StandardCharsets.UTF_8)
        )) {
            return scan(reader);
        }
    }

    public ScanResult scan(Reader reader) throws IOException {
        CandidateIndex candidates = new CandidateIndex();
        ScanStats stats = new ScanStats();

        try (CSVParser parser = REFERENCE_FORMAT.parse(reader)) {
            for (String column : ReferenceColumns.REQUIRED) {
                if (!parser.getHeaderMap().containsKey(column)) {
                    log.warn("Reference corpus has no {} column, every wanted row will be rejected", column);
                }
            }
            for (CSVRecord record : parser) {
                RowVerdict verdict = filter.evaluate(toRow(record));
                stats.record(verdict);
                if (verdict.isKept()) {
                    candidates.register(verdict.variationId(), verdict.coordinates());
                } else if (verdict.outcome() == RowVerdict.Outcome.REJECTED) {
                    log.debug("Rejected reference record {} ({}): {}", record.getRecordNumber(), verdict.variationId(), verdict.reason());
                }
                if (stats.getRowsScanned() % PROGRESS_INTERVAL == 0) {
                    log.info("Scanned {} reference rows, kept {}", stats.getRowsScanned(), stats.getRowsKept());
                }
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        log.info(
            "Finished reference scan: {} rows scanned, {} kept, {} rejected, {} identifiers with candidates",
            stats.getRowsScanned(), stats.getRowsKept(), stats.getRowsRejected(), candidates.size()
        );
        stats.getRejections().forEach((reason, count) -> log.info("  {}: {}", reason, count));
        return new ScanResult(candidates, stats);
    }

    private static ReferenceRow toRow(CSVRecord record) {
        return new ReferenceRow(
            record.getRecordNumber(),
            value(record, ReferenceColumns.VARIATION_ID),
            value(record, ReferenceColumns.ASSEMBLY),
            value(record, ReferenceColumns.CHROMOSOME),
            value(record, ReferenceColumns.POSITION),
            value(record, ReferenceColumns.REFERENCE_ALLELE),
            value(record, ReferenceColumns.ALTERNATE_ALLELE)
        );
    }

    private static String value(CSVRecord record, String column) {
        return record.isMapped(column) && record.isSet(column) ? record.get(column) : null;
    }
}
