package edu.harvard.hms.dbmi.avillach.idmap.etl.sample;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One frame of a sample corpus, either a key/value mapping or something that is not.
 *
 * <p>Malformed records carry no fields, only the decoded payload (null when the frame was not JSON)
 * and a short name for its kind so callers can report on it. They are never an error.</p>
 */
public record SampleRecord(long index, Kind kind, String payloadType, Map<String, JsonNode> fields, JsonNode payload) {

    public enum Kind {
        STRUCTURED,
        MALFORMED
    }

    public static SampleRecord structured(long index, Map<String, JsonNode> fields, JsonNode payload) {
        return new SampleRecord(
            index, Kind.STRUCTURED, "object", Collections.unmodifiableMap(new LinkedHashMap<>(fields)), payload
        );
    }

    public static SampleRecord malformed(long index, String payloadType, JsonNode payload) {
        return new SampleRecord(index, Kind.MALFORMED, payloadType, Map.of(), payload);
    }

    public boolean isStructured() {
        return kind == Kind.STRUCTURED;
    }

    public Optional<JsonNode> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }
}
