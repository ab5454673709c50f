package edu.harvard.hms.dbmi.avillach.idmap.data.variant;

import com.google.common.base.Joiner;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonical location of a single-nucleotide variant.
 *
 * <p>Alleles are held in upper case. Two coordinates are equal when all four fields are
 * equal as strings, which is also the case exactly when their {@link #key()} values are equal.</p>
 */
public record VariantCoordinates(String chromosome, String position, String referenceAllele, String alternateAllele) {

    public static final char KEY_SEPARATOR = '_';
    private static final Joiner KEY_JOINER = Joiner.on(KEY_SEPARATOR);

    public VariantCoordinates {
        Objects.requireNonNull(chromosome, "chromosome");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(referenceAllele, "referenceAllele");
        Objects.requireNonNull(alternateAllele, "alternateAllele");
    }

    /**
     * Builds coordinates from already validated fields, upper-casing the alleles.
     */
    public static VariantCoordinates of(String chromosome, String position, String referenceAllele, String alternateAllele) {
        return new VariantCoordinates(
            chromosome, position, referenceAllele.toUpperCase(Locale.ROOT), alternateAllele.toUpperCase(Locale.ROOT)
        );
    }

    /**
     * @return the composite {@code chrom_pos_ref_alt} key
     */
    public String key() {
        return KEY_JOINER.join(chromosome, position, referenceAllele, alternateAllele);
    }

    @Override
    public String toString() {
        return key();
    }
}
