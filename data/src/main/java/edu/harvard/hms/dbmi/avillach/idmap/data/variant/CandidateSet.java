package edu.harvard.hms.dbmi.avillach.idmap.data.variant;

import static com.google.common.base.Preconditions.checkState;

import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Distinct coordinates observed for one variation identifier, keyed by {@link VariantCoordinates#key()}.
 *
 * <p>Iteration is in lexical key order. Adding coordinates that are already present is a no-op,
 * so repeated reference rows collapse to a single candidate.</p>
 */
public class CandidateSet {

    private final int variationId;
    private final NavigableMap<String, VariantCoordinates> candidates = new TreeMap<>();

    public CandidateSet(int variationId) {
        this.variationId = variationId;
    }

    public int getVariationId() {
        return variationId;
    }

    /**
     * @return true if the coordinates were not already a candidate
     */
    public boolean add(VariantCoordinates coordinates) {
        return candidates.putIfAbsent(coordinates.key(), coordinates) == null;
    }

    public void addAll(CandidateSet other) {
        other.candidates.values().forEach(this::add);
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public boolean isUnique() {
        return candidates.size() == 1;
    }

    public boolean isAmbiguous() {
        return candidates.size() > 1;
    }

    /**
     * @return the single candidate of a unique set
     * @throws IllegalStateException if the set does not hold exactly one candidate
     */
    public VariantCoordinates onlyCandidate() {
        checkState(isUnique(), "Variation %s has %s candidates, expected exactly one", variationId, candidates.size());
        return candidates.firstEntry().getValue();
    }

    /**
     * @return the candidates in lexical key order, read-only
     */
    public Collection<VariantCoordinates> candidates() {
        return Collections.unmodifiableCollection(candidates.values());
    }

    @Override
    public String toString() {
        return "CandidateSet{" + variationId + "=" + candidates.keySet() + "}";
    }
}
