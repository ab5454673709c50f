package edu.harvard.hms.dbmi.avillach.idmap.etl.resolution;

/**
 * @param uniqueWritten        rows written to the unique table, one per identifier
 * @param ambiguousWritten     rows written to the ambiguous table
 * @param ambiguousIdentifiers distinct identifiers behind the ambiguous rows
 */
public record ResolutionStats(long uniqueWritten, long ambiguousWritten, long ambiguousIdentifiers) {
}
