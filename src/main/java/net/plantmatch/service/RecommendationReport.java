package net.plantmatch.service;

import net.plantmatch.domain.recommendation.MatchResult;
import net.plantmatch.domain.recommendation.RecommendationBatch;
import net.plantmatch.domain.recommendation.SearchCriteria;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one recommendation request, ready for presentation.
 *
 * @param batch ranked results and catalog warnings
 * @param normalizationWarnings problems found while reading the request
 * @param criteria the brief actually scored
 * @param catalogSize number of catalog entries considered
 * @param catalogVersion fingerprint of the catalog scored against
 */
public record RecommendationReport(RecommendationBatch batch,
                                   List<String> normalizationWarnings,
                                   SearchCriteria criteria,
                                   int catalogSize,
                                   String catalogVersion) {

    public RecommendationReport {
        normalizationWarnings = List.copyOf(normalizationWarnings);
    }

    public List<MatchResult> results() {
        return batch.results();
    }

    /**
     * Request warnings first, then catalog warnings.
     */
    public List<String> warnings() {
        List<String> warnings = new ArrayList<>(normalizationWarnings);
        warnings.addAll(batch.warnings());
        return List.copyOf(warnings);
    }
}
