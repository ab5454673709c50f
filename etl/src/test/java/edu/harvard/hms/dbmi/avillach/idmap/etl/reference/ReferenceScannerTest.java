package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.CandidateIndex;
import edu.harvard.hms.dbmi.avillach.idmap.data.variant.CandidateSet;
import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReferenceScannerTest {

    private static final Set<Integer> WANTED = Set.of(10, 20, 30, 40, 50, 70, 80);

    @Test
    void scan_sampleSummary(@TempDir Path dir) throws IOException {
        Path reference = ReferenceFixtures.gzipResource(ReferenceFixtures.SAMPLE_SUMMARY, dir);

        ScanResult result = new ReferenceScanner(new ReferenceRowFilter(WANTED, "GRCh38")).scan(reference);

        ScanStats stats = result.stats();
        assertEquals(11, stats.getRowsScanned());
        assertEquals(5, stats.getRowsKept());
        assertEquals(1, stats.getRowsUnwanted());
        assertEquals(5, stats.getRowsRejected());
        assertEquals(1, stats.getRejections(RejectionReason.INVALID_VARIATION_ID));
        assertEquals(1, stats.getRejections(RejectionReason.ASSEMBLY_MISMATCH));
        assertEquals(1, stats.getRejections(RejectionReason.MISSING_FIELD));
        assertEquals(1, stats.getRejections(RejectionReason.NON_NUMERIC_POSITION));
        assertEquals(1, stats.getRejections(RejectionReason.NOT_SNV));

        CandidateIndex candidates = result.candidates();
        assertEquals(3, candidates.size());
        CandidateSet ten = candidates.get(10).orElseThrow();
        assertEquals(new VariantCoordinates("1", "12345", "A", "G"), ten.onlyCandidate());
        CandidateSet twenty = candidates.get(20).orElseThrow();
        assertEquals(
            List.of("2_1000_C_T", "2_1001_C_T"),
            twenty.candidates().stream().map(VariantCoordinates::key).toList()
        );
        assertEquals("X_500_T_C", candidates.get(50).orElseThrow().onlyCandidate().key());
        assertTrue(candidates.get(30).isEmpty());
        assertTrue(candidates.get(40).isEmpty());
        assertTrue(candidates.get(60).isEmpty(), "unwanted identifiers never get candidates");
    }

    @Test
    void scan_withoutAssemblyFilterKeepsOtherBuilds(@TempDir Path dir) throws IOException {
        Path reference = ReferenceFixtures.gzipResource(ReferenceFixtures.SAMPLE_SUMMARY, dir);

        ScanResult result = new ReferenceScanner(new ReferenceRowFilter(WANTED, "")).scan(reference);

        assertEquals(6, result.stats().getRowsKept());
        assertEquals(2, result.candidates().get(10).orElseThrow().size());
    }

    @Test
    void scan_isIndependentOfRowOrder() throws IOException {
        List<String> rows = new ArrayList<>(List.of(
            ReferenceFixtures.row("10", "GRCh38", "1", "100", "A", "G"),
            ReferenceFixtures.row("10", "GRCh38", "1", "100", "a", "g"),
            ReferenceFixtures.row("20", "GRCh38", "2", "200", "C", "T"),
            ReferenceFixtures.row("20", "GRCh38", "2", "201", "C", "T"),
            ReferenceFixtures.row("20", "GRCh37", "2", "150", "C", "T"),
            ReferenceFixtures.row("30", "GRCh38", "3", "300", "GA", "T"),
            ReferenceFixtures.row("30", "", "3", "301", "G", "T")
        ));
        ReferenceRowFilter filter = new ReferenceRowFilter(Set.of(10, 20, 30), "GRCh38");
        List<String> expected = describe(new ReferenceScanner(filter).scan(reader(rows)).candidates());

        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(rows, random);
            assertEquals(expected, describe(new ReferenceScanner(filter).scan(reader(rows)).candidates()));
        }
    }

    @Test
    void scan_quotesAreData() throws IOException {
        List<String> rows = List.of(
            String.join("\t", "1", "10", "GRCh38", "1", "100", "A", "G", "\"unterminated"),
            ReferenceFixtures.row("20", "GRCh38", "2", "200", "C", "T")
        );

        ScanResult result = new ReferenceScanner(new ReferenceRowFilter(Set.of(10, 20), "GRCh38")).scan(reader(rows));

        assertEquals(2, result.stats().getRowsScanned());
        assertEquals(2, result.stats().getRowsKept());
    }

    @Test
    void scan_missingColumnRejectsRowsAndWarns() throws IOException {
        Logger mockLogger = mock(Logger.class);
        String header = String.join("\t", "VariationID", "Assembly", "Chromosome", "PositionVCF", "ReferenceAlleleVCF");
        String line = String.join("\t", "10", "GRCh38", "1", "100", "A");

        ScanResult result = new ReferenceScanner(new ReferenceRowFilter(Set.of(10), "GRCh38"), mockLogger)
            .scan(new StringReader(header + "\n" + line + "\n"));

        assertEquals(1, result.stats().getRejections(RejectionReason.MISSING_FIELD));
        assertTrue(result.candidates().isEmpty());
        verify(mockLogger).warn(anyString(), eq(ReferenceColumns.ALTERNATE_ALLELE));
    }

    @Test
    void scan_shortLineReadsAsAbsentValues() throws IOException {
        String shortLine = String.join("\t", "1", "10", "GRCh38", "1");

        ScanResult result = new ReferenceScanner(new ReferenceRowFilter(Set.of(10), "GRCh38"))
            .scan(new StringReader(ReferenceFixtures.HEADER + "\n" + shortLine + "\n"));

        assertEquals(1, result.stats().getRowsScanned());
        assertEquals(1, result.stats().getRejections(RejectionReason.MISSING_FIELD));
    }

    @Test
    void scan_emptyCorpus(@TempDir Path dir) throws IOException {
        Path reference = ReferenceFixtures.gzipLines(dir, "empty.txt.gz", List.of(ReferenceFixtures.HEADER));

        ScanResult result = new ReferenceScanner(new ReferenceRowFilter(Set.of(10), "GRCh38")).scan(reference);

        assertEquals(0, result.stats().getRowsScanned());
        assertTrue(result.candidates().isEmpty());
    }

    @Test
    void scan_notGzipIsAnError(@TempDir Path dir) throws IOException {
        Path plain = dir.resolve("variant_summary.txt.gz");
        Files.writeString(plain, ReferenceFixtures.HEADER + "\n", StandardCharsets.UTF_8);

        ReferenceScanner scanner = new ReferenceScanner(new ReferenceRowFilter(Set.of(10), "GRCh38"));

        assertThrows(IOException.class, () -> scanner.scan(plain));
    }

    @Test
    void scan_missingFileIsAnError(@TempDir Path dir) {
        ReferenceScanner scanner = new ReferenceScanner(new ReferenceRowFilter(Set.of(10), "GRCh38"));

        assertThrows(IOException.class, () -> scanner.scan(dir.resolve("nope.txt.gz")));
    }

    private static StringReader reader(List<String> rows) {
        return new StringReader(ReferenceFixtures.HEADER + "\n" + String.join("\n", rows) + "\n");
    }

    private static List<String> describe(CandidateIndex index) {
        return index.inIdentifierOrder().stream().map(CandidateSet::toString).toList();
    }
}
