package edu.harvard.hms.dbmi.avillach.idmap.etl.output;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.AmbiguousMapping;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.UniqueMapping;
import edu.harvard.hms.dbmi.avillach.idmap.exception.MappingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TsvMappingSinkTest {

    private static final VariantCoordinates COORDS = new VariantCoordinates("1", "12345", "A", "G");

    @Test
    void writesHeadersAndRows() throws IOException {
        StringWriter unique = new StringWriter();
        StringWriter ambiguous = new StringWriter();

        try (TsvMappingSink sink = new TsvMappingSink(unique, ambiguous)) {
            sink.writeUnique(new UniqueMapping(10, COORDS));
            sink.writeAmbiguous(new AmbiguousMapping(20, new VariantCoordinates("2", "1000", "C", "T"), 2));
        }

        assertEquals(
            "pickle_ID\tChromosome\tPositionVCF\tReferenceAlleleVCF\tAlternateAlleleVCF\tchr_pos_ref_alt\r\n"
                + "10\t1\t12345\tA\tG\t1_12345_A_G\r\n",
            unique.toString()
        );
        assertEquals(
            "pickle_ID\tChromosome\tPositionVCF\tReferenceAlleleVCF\tAlternateAlleleVCF\tchr_pos_ref_alt\tn_candidates\r\n"
                + "20\t2\t1000\tC\tT\t2_1000_C_T\t2\r\n",
            ambiguous.toString()
        );
    }

    @Test
    void emptyTablesStillHaveHeaders() throws IOException {
        StringWriter unique = new StringWriter();
        StringWriter ambiguous = new StringWriter();

        new TsvMappingSink(unique, ambiguous).close();

        assertTrue(unique.toString().startsWith("pickle_ID\t"));
        assertTrue(ambiguous.toString().endsWith("n_candidates\r\n"));
    }

    @Test
    void createsParentDirectoriesAndTruncates(@TempDir Path dir) throws IOException {
        Path uniquePath = dir.resolve("processed/nested/unique.tsv");
        Path ambiguousPath = dir.resolve("processed/ambiguous.tsv");

        try (TsvMappingSink sink = new TsvMappingSink(uniquePath, ambiguousPath)) {
            sink.writeUnique(new UniqueMapping(10, COORDS));
            sink.writeUnique(new UniqueMapping(11, COORDS));
        }
        try (TsvMappingSink sink = new TsvMappingSink(uniquePath, ambiguousPath)) {
            sink.writeUnique(new UniqueMapping(12, COORDS));
        }

        assertEquals(2, Files.readAllLines(uniquePath).size());
        assertTrue(Files.readString(uniquePath).contains("12\t1\t12345"));
        assertEquals(1, Files.readAllLines(ambiguousPath).size());
    }

    @Test
    void writingAfterCloseFails() throws IOException {
        TsvMappingSink sink = new TsvMappingSink(new StringWriter(), new StringWriter());
        sink.close();
        sink.close();

        assertThrows(MappingException.class, () -> sink.writeUnique(new UniqueMapping(10, COORDS)));
        assertThrows(MappingException.class, () -> sink.writeAmbiguous(new AmbiguousMapping(10, COORDS, 2)));
    }

    @Test
    void failingToOpenAmbiguousTableClosesUniqueTable(@TempDir Path dir) throws IOException {
        Writer uniqueOut = mock(Writer.class);
        Path uniquePath = dir.resolve("unique.tsv");
        Path ambiguousPath = dir.resolve("ambiguous.tsv");

        IOException e = assertThrows(IOException.class, () -> new TsvMappingSink(uniquePath, ambiguousPath, path -> {
            if (path.equals(uniquePath)) {
                return uniqueOut;
            }
            throw new FileSystemException(path.toString(), null, "Is a directory");
        }));

        assertTrue(e.getMessage().contains("ambiguous.tsv"));
        verify(uniqueOut).close();
    }

    @Test
    void ambiguousPathThatIsADirectoryFailsToOpen(@TempDir Path dir) throws IOException {
        Path ambiguousPath = Files.createDirectory(dir.resolve("ambiguous.tsv"));

        assertThrows(IOException.class, () -> new TsvMappingSink(dir.resolve("unique.tsv"), ambiguousPath));
        assertTrue(Files.isDirectory(ambiguousPath));
    }
}
