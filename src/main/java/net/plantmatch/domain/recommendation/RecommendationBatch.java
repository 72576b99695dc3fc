package net.plantmatch.domain.recommendation;

import java.util.List;

/**
 * Everything one ranking pass produced.
 *
 * @param results ranked results, best first, at most the requested limit
 * @param warnings catalog-level problems such as skipped entries
 * @param evaluatedCount number of catalog entries actually scored
 */
public record RecommendationBatch(List<MatchResult> results, List<String> warnings, int evaluatedCount) {

    public RecommendationBatch {
        results = List.copyOf(results);
        warnings = List.copyOf(warnings);
    }

    public static RecommendationBatch empty() {
        return new RecommendationBatch(List.of(), List.of(), 0);
    }
}
