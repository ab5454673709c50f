package edu.harvard.hms.dbmi.avillach.idmap.etl.output;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.AmbiguousMapping;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.MappingSink;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.UniqueMapping;
import edu.harvard.hms.dbmi.avillach.idmap.exception.MappingException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the unique and ambiguous mapping tables as tab separated files.
 *
 * <p>Both files are truncated and their headers written when the sink is opened. Rows are
 * streamed as they arrive; nothing is rolled back if the run fails part way.</p>
 */
public class TsvMappingSink implements MappingSink, Closeable {

    private static final Logger log = LoggerFactory.getLogger(TsvMappingSink.class);

    public static final List<String> UNIQUE_HEADER = List.of(
        "pickle_ID", "Chromosome", "PositionVCF", "ReferenceAlleleVCF", "AlternateAlleleVCF", "chr_pos_ref_alt"
    );
    public static final List<String> AMBIGUOUS_HEADER = List.of(
        "pickle_ID", "Chromosome", "PositionVCF", "ReferenceAlleleVCF", "AlternateAlleleVCF", "chr_pos_ref_alt", "n_candidates"
    );

    private static final CSVFormat TSV_FORMAT = CSVFormat.DEFAULT.builder()
        .setDelimiter('\t')
        .setRecordSeparator("\r\n")
        .build();

    private final CSVPrinter uniquePrinter;
    private final CSVPrinter ambiguousPrinter;
    private boolean closed = false;

    public TsvMappingSink(Path uniquePath, Path ambiguousPath) throws IOException {
        this(uniquePath, ambiguousPath, TsvMappingSink::open);
    }

    // For testing only
    TsvMappingSink(Path uniquePath, Path ambiguousPath, TableOpener opener) throws IOException {
        Writer uniqueOut = opener.open(uniquePath);
        Writer ambiguousOut;
        try {
            ambiguousOut = opener.open(ambiguousPath);
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(uniqueOut, e);
            throw e;
        }
        this.uniquePrinter = new CSVPrinter(uniqueOut, TSV_FORMAT);
        this.ambiguousPrinter = new CSVPrinter(ambiguousOut, TSV_FORMAT);
        try {
            writeHeaders();
        } catch (IOException e) {
            closeAfterFailure(this, e);
            throw e;
        }
        log.info("Writing unique mappings to {} and ambiguous mappings to {}", uniquePath, ambiguousPath);
    }

    public TsvMappingSink(Appendable uniqueOut, Appendable ambiguousOut) throws IOException {
        this.uniquePrinter = new CSVPrinter(uniqueOut, TSV_FORMAT);
        this.ambiguousPrinter = new CSVPrinter(ambiguousOut, TSV_FORMAT);
        writeHeaders();
    }

    @FunctionalInterface
    interface TableOpener {
        Writer open(Path path) throws IOException;
    }

    private static Writer open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    private static void closeAfterFailure(Closeable opened, Exception failure) {
        try {
            opened.close();
        } catch (IOException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }

    private void writeHeaders() throws IOException {
        uniquePrinter.printRecord(UNIQUE_HEADER);
        ambiguousPrinter.printRecord(AMBIGUOUS_HEADER);
    }

    @Override
    public void writeUnique(UniqueMapping mapping) throws IOException {
        checkOpen();
        VariantCoordinates c = mapping.coordinates();
        uniquePrinter.printRecord(
            mapping.variationId(), c.chromosome(), c.position(), c.referenceAllele(), c.alternateAllele(), c.key()
        );
    }

    @Override
    public void writeAmbiguous(AmbiguousMapping mapping) throws IOException {
        checkOpen();
        VariantCoordinates c = mapping.coordinates();
        ambiguousPrinter.printRecord(
            mapping.variationId(), c.chromosome(), c.position(), c.referenceAllele(), c.alternateAllele(), c.key(),
            mapping.candidateCount()
        );
    }

    private void checkOpen() {
        if (closed) {
            throw new MappingException("Mapping tables are already closed");
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            uniquePrinter.close(true);
        } finally {
            ambiguousPrinter.close(true);
        }
    }
}
