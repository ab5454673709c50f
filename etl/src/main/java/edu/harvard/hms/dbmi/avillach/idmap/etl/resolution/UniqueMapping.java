package edu.harvard.hms.dbmi.avillach.idmap.etl.resolution;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;

/**
 * An identifier that resolved to exactly one coordinate.
 */
public record UniqueMapping(int variationId, VariantCoordinates coordinates) {

    public String key() {
        return coordinates.key();
    }
}
