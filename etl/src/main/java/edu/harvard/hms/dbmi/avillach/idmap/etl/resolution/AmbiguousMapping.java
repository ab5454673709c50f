package edu.harvard.hms.dbmi.avillach.idmap.etl.resolution;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;

/**
 * One of several coordinates an identifier resolved to.
 *
 * @param candidateCount how many distinct coordinates the identifier has in total
 */
public record AmbiguousMapping(int variationId, VariantCoordinates coordinates, int candidateCount) {

    public String key() {
        return coordinates.key();
    }
}
