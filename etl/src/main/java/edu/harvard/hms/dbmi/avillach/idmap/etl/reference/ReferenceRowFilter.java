package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import com.google.common.collect.ImmutableSet;
import edu.harvard.hms.dbmi.avillach.idmap.data.variant.ReferenceRow;
import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;

import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a reference row yields candidate coordinates for a wanted identifier.
 *
 * <p>Checks run in a fixed order and stop at the first failure:</p>
 * <ol>
 *   <li>VariationID parses as an integer</li>
 *   <li>the identifier is wanted (otherwise the row is simply not examined)</li>
 *   <li>the assembly matches, when a filter is configured and the row names an assembly</li>
 *   <li>chromosome, position, reference and alternate allele are all present</li>
 *   <li>the position is all decimal digits</li>
 *   <li>both alleles are a single A, C, G or T</li>
 * </ol>
 *
 * <p>The decision depends only on the row, so the order in which rows are seen never changes the outcome.</p>
 */
public class ReferenceRowFilter {

    private static final Set<String> SNV_BASES = ImmutableSet.of("A", "C", "G", "T");

    private final Set<Integer> wantedIds;
    private final String assembly;
    private final MissingValueDetector missingValues;

    /**
     * @param wantedIds identifiers to keep rows for
     * @param assembly  required assembly compared as given, or null/empty to accept any
     */
    public ReferenceRowFilter(Set<Integer> wantedIds, String assembly) {
        this(wantedIds, assembly, new MissingValueDetector());
    }

    public ReferenceRowFilter(Set<Integer> wantedIds, String assembly, MissingValueDetector missingValues) {
        this.wantedIds = ImmutableSet.copyOf(wantedIds);
        this.assembly = assembly == null ? "" : assembly;
        this.missingValues = missingValues;
    }

    public RowVerdict evaluate(ReferenceRow row) {
        Integer variationId = parseVariationId(row.variationId());
        if (variationId == null) {
            return RowVerdict.rejected(null, RejectionReason.INVALID_VARIATION_ID);
        }
        if (!wantedIds.contains(variationId)) {
            return RowVerdict.unwanted(variationId);
        }

        // A row that does not name its assembly is accepted even when a filter is set.
        String rowAssembly = trim(row.assembly());
        if (!assembly.isEmpty() && !rowAssembly.isEmpty() && !rowAssembly.equals(assembly)) {
            return RowVerdict.rejected(variationId, RejectionReason.ASSEMBLY_MISMATCH);
        }

        String chromosome = trim(row.chromosome());
        String position = trim(row.position());
        String ref = trim(row.referenceAllele());
        String alt = trim(row.alternateAllele());
        if (missingValues.anyMissing(row.chromosome(), row.position(), row.referenceAllele(), row.alternateAllele())) {
            return RowVerdict.rejected(variationId, RejectionReason.MISSING_FIELD);
        }
        if (!isDecimalDigits(position)) {
            return RowVerdict.rejected(variationId, RejectionReason.NON_NUMERIC_POSITION);
        }
        if (!isSnvAllele(ref) || !isSnvAllele(alt)) {
            return RowVerdict.rejected(variationId, RejectionReason.NOT_SNV);
        }
        return RowVerdict.kept(variationId, VariantCoordinates.of(chromosome, position, ref, alt));
    }

    public String getAssembly() {
        return assembly;
    }

    static Integer parseVariationId(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean isDecimalDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    static boolean isSnvAllele(String allele) {
        return allele.length() == 1 && SNV_BASES.contains(allele.toUpperCase(Locale.ROOT));
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
