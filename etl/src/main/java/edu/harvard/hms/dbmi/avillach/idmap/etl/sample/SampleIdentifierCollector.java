package edu.harvard.hms.dbmi.avillach.idmap.etl.sample;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Builds the set of variation identifiers to resolve from a sample corpus.
 */
public class SampleIdentifierCollector {

    private static final Logger log = LoggerFactory.getLogger(SampleIdentifierCollector.class);

    public static final String DEFAULT_ID_FIELD = "ID";

    private final String idField;

    public SampleIdentifierCollector() {
        this(DEFAULT_ID_FIELD);
    }

    public SampleIdentifierCollector(String idField) {
        this.idField = idField;
    }

    /**
     * Reads records until {@code maxIds} distinct identifiers are held or the corpus ends.
     */
    public CollectedIdentifiers collect(Path samplePath, int maxIds) throws IOException {
        try (SampleRecordReader reader = new SampleRecordReader(samplePath)) {
            return collect(reader, maxIds);
        }
    }

    public CollectedIdentifiers collect(SampleRecordReader reader, int maxIds) throws IOException {
        Set<Integer> identifiers = new HashSet<>();
        long recordsRead = 0;
        long malformed = 0;
        long skipped = 0;

        while (identifiers.size() < maxIds) {
            Optional<SampleRecord> next = reader.next();
            if (next.isEmpty()) {
                break;
            }
            SampleRecord record = next.get();
            recordsRead++;
            if (!record.isStructured()) {
                malformed++;
                continue;
            }
            OptionalInt id = record.field(idField).map(SampleIdentifierCollector::coerceIdentifier).orElse(OptionalInt.empty());
            if (id.isEmpty()) {
                log.debug("Record {} has no usable {} field", record.index(), idField);
                skipped++;
                continue;
            }
            identifiers.add(id.getAsInt());
        }

        log.info(
            "Read {} sample records: {} distinct identifiers, {} malformed records, {} records without a usable {}",
            recordsRead, identifiers.size(), malformed, skipped, idField
        );
        return new CollectedIdentifiers(identifiers, recordsRead, malformed, skipped);
    }

    /**
     * Coerces a JSON value to a non-negative {@code int} identifier.
     *
     * <p>Integral numbers are taken as is, finite floating point numbers are truncated toward zero,
     * text is trimmed and parsed as a base 10 integer, and booleans count as 1 and 0. Anything else,
     * and anything negative or outside the {@code int} range, yields empty.</p>
     */
    public static OptionalInt coerceIdentifier(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return OptionalInt.empty();
        }
        long candidate;
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                return OptionalInt.empty();
            }
            candidate = value.longValue();
        } else if (value.isFloatingPointNumber()) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return OptionalInt.empty();
            }
            BigDecimal truncated = value.decimalValue().setScale(0, RoundingMode.DOWN);
            if (truncated.signum() < 0 || truncated.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
                return OptionalInt.empty();
            }
            candidate = truncated.longValue();
        } else if (value.isBoolean()) {
            candidate = value.booleanValue() ? 1 : 0;
        } else if (value.isTextual()) {
            try {
                candidate = Long.parseLong(value.textValue().trim());
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        } else {
            return OptionalInt.empty();
        }
        if (candidate < 0 || candidate > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) candidate);
    }
}
