package edu.harvard.hms.dbmi.avillach.idmap.mapping;

import edu.harvard.hms.dbmi.avillach.idmap.etl.reference.RejectionReason;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;

/**
 * Counts reported at the end of a mapping run.
 */
public record MappingReport(
    Path samplePath,
    int identifiersCollected,
    long referenceRowsScanned,
    long referenceRowsKept,
    Map<RejectionReason, Long> rejections,
    long uniqueWritten,
    Path uniquePath,
    long ambiguousWritten,
    long ambiguousIdentifiers,
    Path ambiguousPath
) {

    public MappingReport {
        rejections = Map.copyOf(rejections);
    }

    public void print(PrintStream out) {
        out.println("Collected " + identifiersCollected + " unique IDs from " + samplePath);
        out.println("ClinVar rows scanned: " + referenceRowsScanned);
        out.println("ClinVar rows kept after filters: " + referenceRowsKept);
        out.println("Unique mappings written: " + uniqueWritten + " -> " + uniquePath);
        out.println("Ambiguous rows written: " + ambiguousWritten + " -> " + ambiguousPath);
    }
}
