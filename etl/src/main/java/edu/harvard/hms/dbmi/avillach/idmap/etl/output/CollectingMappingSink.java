package edu.harvard.hms.dbmi.avillach.idmap.etl.output;

import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.AmbiguousMapping;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.MappingSink;
import edu.harvard.hms.dbmi.avillach.idmap.etl.resolution.UniqueMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps mappings in memory, in the order they were written.
 */
public class CollectingMappingSink implements MappingSink {

    private final List<UniqueMapping> unique = new ArrayList<>();
    private final List<AmbiguousMapping> ambiguous = new ArrayList<>();

    @Override
    public void writeUnique(UniqueMapping mapping) {
        unique.add(mapping);
    }

    @Override
    public void writeAmbiguous(AmbiguousMapping mapping) {
        ambiguous.add(mapping);
    }

    public List<UniqueMapping> getUnique() {
        return Collections.unmodifiableList(unique);
    }

    public List<AmbiguousMapping> getAmbiguous() {
        return Collections.unmodifiableList(ambiguous);
    }
}
