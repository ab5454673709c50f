package edu.harvard.hms.dbmi.avillach.idmap.etl.resolution;

import java.io.IOException;

/**
 * Receives resolved mappings in output order.
 */
public interface MappingSink {

    void writeUnique(UniqueMapping mapping) throws IOException;

    void writeAmbiguous(AmbiguousMapping mapping) throws IOException;
}
