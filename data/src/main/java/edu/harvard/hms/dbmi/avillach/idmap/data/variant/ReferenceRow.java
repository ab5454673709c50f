package edu.harvard.hms.dbmi.avillach.idmap.data.variant;

/**
 * One line of the reference corpus, restricted to the columns the mapper reads.
 *
 * <p>Values are raw text as found in the file. A column absent from the file, or a line too
 * short to reach it, is represented as {@code null}.</p>
 */
public record ReferenceRow(
    long recordNumber,
    String variationId,
    String assembly,
    String chromosome,
    String position,
    String referenceAllele,
    String alternateAllele
) {
}
