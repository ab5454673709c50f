package edu.harvard.hms.dbmi.avillach.idmap.etl.sample.inspect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Occurrence counter that ranks by count and breaks ties by first appearance.
 */
class Tally {

    private final Map<String, Long> counts = new LinkedHashMap<>();

    void add(String value) {
        counts.merge(value, 1L, Long::sum);
    }

    long get(String value) {
        return counts.getOrDefault(value, 0L);
    }

    boolean isEmpty() {
        return counts.isEmpty();
    }

    List<Map.Entry<String, Long>> mostCommon() {
        return mostCommon(Integer.MAX_VALUE);
    }

    List<Map.Entry<String, Long>> mostCommon(int limit) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        return List.copyOf(entries.subList(0, Math.min(limit, entries.size())));
    }
}
