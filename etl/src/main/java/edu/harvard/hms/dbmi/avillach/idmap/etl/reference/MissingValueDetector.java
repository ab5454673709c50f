package edu.harvard.hms.dbmi.avillach.idmap.etl.reference;

import java.util.Locale;
import java.util.Set;

/**
 * Detects placeholder text standing in for an absent reference value.
 *
 * <p>A value is missing when it is {@code null}, empty after trimming, or one of the sentinels
 * below in any letter case:</p>
 * <ul>
 *   <li>"na" (R-style)</li>
 *   <li>"n/a"</li>
 *   <li>"nan" (pandas NaN string)</li>
 *   <li>"none" (Python None string)</li>
 * </ul>
 *
 * <p>ClinVar writes {@code na} for positions and alleles it cannot express in VCF form, which is
 * by far the most common case.</p>
 */
public class MissingValueDetector {

    private static final Set<String> DEFAULT_MISSING_SENTINELS = Set.of(
        "",
        "na",
        "n/a",
        "nan",
        "none"
    );

    private final Set<String> sentinels;

    public MissingValueDetector() {
        this.sentinels = DEFAULT_MISSING_SENTINELS;
    }

    /**
     * @param customSentinels lowercase sentinels to use instead of the defaults
     */
    public MissingValueDetector(Set<String> customSentinels) {
        this.sentinels = customSentinels != null ? customSentinels : DEFAULT_MISSING_SENTINELS;
    }

    public boolean isMissing(String value) {
        if (value == null) {
            return true;
        }
        return sentinels.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    public boolean anyMissing(String... values) {
        for (String value : values) {
            if (isMissing(value)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getSentinels() {
        return Set.copyOf(sentinels);
    }
}
