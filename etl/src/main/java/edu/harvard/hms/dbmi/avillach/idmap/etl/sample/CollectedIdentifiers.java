package edu.harvard.hms.dbmi.avillach.idmap.etl.sample;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Identifiers gathered from a sample corpus along with how many records were looked at.
 *
 * @param identifiers       distinct identifiers, read-only
 * @param recordsRead       frames consumed before collection stopped
 * @param malformedRecords  frames that were not key/value mappings
 * @param skippedRecords    mappings without a usable identifier
 */
public record CollectedIdentifiers(Set<Integer> identifiers, long recordsRead, long malformedRecords, long skippedRecords) {

    public CollectedIdentifiers {
        identifiers = ImmutableSet.copyOf(identifiers);
    }

    public int size() {
        return identifiers.size();
    }

    public boolean contains(int identifier) {
        return identifiers.contains(identifier);
    }
}
