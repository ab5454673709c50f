package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;

/**
 * Result of running one reference row through {@link ReferenceRowFilter}.
 *
 * <p>{@code coordinates} is set only for kept rows and {@code reason} only for rejected rows.
 * {@code variationId} is null when the identifier itself could not be parsed.</p>
 */
public record RowVerdict(Outcome outcome, Integer variationId, VariantCoordinates coordinates, RejectionReason reason) {

    public enum Outcome {
        KEPT,
        UNWANTED,
        REJECTED
    }

    static RowVerdict kept(int variationId, VariantCoordinates coordinates) {
        return new RowVerdict(Outcome.KEPT, variationId, coordinates, null);
    }

    static RowVerdict unwanted(int variationId) {
        return new RowVerdict(Outcome.UNWANTED, variationId, null, null);
    }

    static RowVerdict rejected(Integer variationId, RejectionReason reason) {
        return new RowVerdict(Outcome.REJECTED, variationId, null, reason);
    }

    public boolean isKept() {
        return outcome == Outcome.KEPT;
    }
}
