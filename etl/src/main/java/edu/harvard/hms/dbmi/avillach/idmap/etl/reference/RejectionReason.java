package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

/**
 * Why a reference row for a wanted identifier was not turned into a candidate.
 * Declared in the order the filters run.
 */
public enum RejectionReason {
    INVALID_VARIATION_ID("VariationID missing or not an integer"),
    ASSEMBLY_MISMATCH("Assembly differs from the configured assembly"),
    MISSING_FIELD("Chromosome, position or allele missing"),
    NON_NUMERIC_POSITION("PositionVCF is not all decimal digits"),
    NOT_SNV("Reference or alternate allele is not a single A, C, G or T");

    private final String description;

    RejectionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
