package net.plantmatch.domain.recommendation;

import java.util.List;

/**
 * Sub-score of one category for one plant, with the explanations that produced it.
 *
 * @param category the category scored
 * @param score unweighted mean of the category's attribute scores, in {@code [0,1]}
 * @param matchedAttributes labels of well-matched attributes, in attribute order
 * @param warnings incomplete-data and concern messages, in attribute order
 */
public record CategoryScore(ScoringCategory category,
                            double score,
                            List<String> matchedAttributes,
                            List<String> warnings) {

    public CategoryScore {
        matchedAttributes = List.copyOf(matchedAttributes);
        warnings = List.copyOf(warnings);
    }
}
