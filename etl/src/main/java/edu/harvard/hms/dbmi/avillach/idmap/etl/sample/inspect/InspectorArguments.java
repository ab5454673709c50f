package edu.harvard.hms.dbmi.avillach.idmap.etl.sample.inspect;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Parses {@code --name value} and {@code --name=value} command line options.
 */
class InspectorArguments {

    private final Map<String, String> values = new HashMap<>();

    InspectorArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument " + arg);
            }
            String name = arg.substring(2);
            int eq = name.indexOf('=');
            if (eq >= 0) {
                values.put(name.substring(0, eq), name.substring(eq + 1));
            } else if (i + 1 < args.length) {
                values.put(name, args[++i]);
            } else {
                throw new IllegalArgumentException("Missing value for --" + name);
            }
        }
    }

    Path requiredPath(String name) {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return Path.of(value);
    }

    int intValue(String name, int defaultValue) {
        String value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for --" + name + ": " + value, e);
        }
    }
}
