package net.plantmatch.domain.recommendation;

import net.plantmatch.model.PlantRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One ranked plant with its weighted total and the explanation behind it.
 *
 * @param plant the catalog entry
 * @param totalScore weighted mean of the category scores, in {@code [0,1]}
 * @param categoryScores category key to sub-score, in category order
 * @param matchedAttributes labels of well-matched attributes
 * @param warnings incomplete-data and concern messages
 */
public record MatchResult(PlantRecord plant,
                          double totalScore,
                          Map<String, Double> categoryScores,
                          List<String> matchedAttributes,
                          List<String> warnings) {

    public MatchResult {
        categoryScores = Collections.unmodifiableMap(new LinkedHashMap<>(categoryScores));
        matchedAttributes = List.copyOf(matchedAttributes);
        warnings = List.copyOf(warnings);
    }
}
