package edu.harvard.hms.dbmi.avillach.idmap.data.variant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Candidate coordinates for every variation identifier that matched at least one accepted reference row.
 *
 * <p>Entries only ever grow while the reference corpus is scanned. Identifiers without a surviving
 * candidate have no entry at all.</p>
 */
public class CandidateIndex {

    private final Map<Integer, CandidateSet> candidatesById = new HashMap<>();

    /**
     * Registers coordinates for a variation identifier.
     *
     * @return true if the coordinates were new for that identifier
     */
    public boolean register(int variationId, VariantCoordinates coordinates) {
        return candidatesById.computeIfAbsent(variationId, CandidateSet::new).add(coordinates);
    }

    public Optional<CandidateSet> get(int variationId) {
        return Optional.ofNullable(candidatesById.get(variationId));
    }

    public int size() {
        return candidatesById.size();
    }

    public boolean isEmpty() {
        return candidatesById.isEmpty();
    }

    /**
     * @return the candidate sets ordered by ascending variation identifier
     */
    public List<CandidateSet> inIdentifierOrder() {
        List<Integer> ids = new ArrayList<>(candidatesById.keySet());
        Collections.sort(ids);
        List<CandidateSet> ordered = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            ordered.add(candidatesById.get(id));
        }
        return ordered;
    }

    /**
     * Folds another index into this one. For each identifier the result holds the union of both
     * candidate sets, so indexes built from disjoint slices of the reference corpus can be combined.
     */
    public CandidateIndex merge(CandidateIndex other) {
        other.candidatesById.forEach(
            (id, candidates) -> candidatesById.computeIfAbsent(id, CandidateSet::new).addAll(candidates)
        );
        return this;
    }
}
