package edu.harvard.hms.dbmi.avillach.idmap.etl.sample;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Optional;

/**
 * Describes decoded sample values for reporting.
 */
public final class SampleValues {

    private SampleValues() {
    }

    public static String typeName(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "null";
        }
        if (value.isIntegralNumber()) {
            return "integer";
        }
        if (value.isNumber()) {
            return "float";
        }
        if (value.isTextual()) {
            return "string";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        if (value.isObject()) {
            return "object";
        }
        if (value.isArray()) {
            return "array";
        }
        return value.getNodeType().name().toLowerCase();
    }

    /**
     * @return true for JSON null and for a NaN number
     */
    public static boolean isMissing(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        return value.isFloatingPointNumber() && Double.isNaN(value.doubleValue());
    }

    /**
     * @return the text of a string value, the JSON rendering of anything else
     */
    public static String display(JsonNode value) {
        if (value == null) {
            return "null";
        }
        return value.isTextual() ? value.textValue() : value.toString();
    }

    /**
     * Dimensions of a rectangular nested array, e.g. {@code (2, 1280)}. Sizes are taken from the
     * first element at each level.
     */
    public static Optional<String> shape(JsonNode value) {
        if (value == null || !value.isArray()) {
            return Optional.empty();
        }
        List<Integer> dims = Lists.newArrayList();
        JsonNode level = value;
        while (level != null && level.isArray()) {
            dims.add(level.size());
            level = level.size() > 0 ? level.get(0) : null;
        }
        String joined = Joiner.on(", ").join(dims);
        return Optional.of(dims.size() == 1 ? "(" + joined + ",)" : "(" + joined + ")");
    }
}
