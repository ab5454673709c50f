package edu.harvard.hms.dbmi.avillach.idmap.etl.resolution;

import edu.harvard.hms.dbmi.avillach.idmap.data.variant.CandidateIndex;
import edu.harvard.hms.dbmi.avillach.idmap.data.variant.CandidateSet;
import edu.harvard.hms.dbmi.avillach.idmap.data.variant.VariantCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Splits a completed {@link CandidateIndex} into unique and ambiguous mappings.
 *
 * <p>Identifiers are visited in ascending order and the candidates of an ambiguous identifier in
 * lexical key order, so the same index always produces the same output. Identifiers without
 * candidates are never in the index and produce nothing.</p>
 */
public class VariantIdResolver {

    private static final Logger log = LoggerFactory.getLogger(VariantIdResolver.class);

    public ResolutionStats resolve(CandidateIndex index, MappingSink sink) throws IOException {
        long unique = 0;
        long ambiguousRows = 0;
        long ambiguousIds = 0;

        for (CandidateSet candidates : index.inIdentifierOrder()) {
            if (candidates.isUnique()) {
                sink.writeUnique(new UniqueMapping(candidates.getVariationId(), candidates.onlyCandidate()));
                unique++;
            } else if (candidates.isAmbiguous()) {
                int count = candidates.size();
                for (VariantCoordinates coordinates : candidates.candidates()) {
                    sink.writeAmbiguous(new AmbiguousMapping(candidates.getVariationId(), coordinates, count));
                    ambiguousRows++;
                }
                ambiguousIds++;
            }
        }

        log.info("Resolved {} identifiers uniquely, {} ambiguously ({} rows)", unique, ambiguousIds, ambiguousRows);
        return new ResolutionStats(unique, ambiguousRows, ambiguousIds);
    }
}
