package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import java.util.List;

/**
 * Column names read from ClinVar's {@code variant_summary.txt.gz}.
 */
public final class ReferenceColumns {

    public static final String VARIATION_ID = "VariationID";
    public static final String ASSEMBLY = "Assembly";
    public static final String CHROMOSOME = "Chromosome";
    public static final String POSITION = "PositionVCF";
    public static final String REFERENCE_ALLELE = "ReferenceAlleleVCF";
    public static final String ALTERNATE_ALLELE = "AlternateAlleleVCF";

    public static final List<String> REQUIRED = List.of(
        VARIATION_ID, ASSEMBLY, CHROMOSOME, POSITION, REFERENCE_ALLELE, ALTERNATE_ALLELE
    );

    private ReferenceColumns() {
    }
}
