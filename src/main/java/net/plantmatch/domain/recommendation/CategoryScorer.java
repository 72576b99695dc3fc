package net.plantmatch.domain.recommendation;

import net.plantmatch.model.PlantRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates attribute matches into the five category sub-scores.
 *
 * <p>Each category score is the plain mean of its attribute scores, so an attribute
 * without a preference or without catalog data pulls the category towards 1.0.</p>
 */
public class CategoryScorer {

    private final MatchingPolicy policy;
    private final Map<PlantAttribute, AttributeRule<?, ?>> rules;

    public CategoryScorer(MatchingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.rules = AttributeRules.forPolicy(policy);
    }

    public CategoryScore score(SearchCriteria criteria, PlantRecord plant, ScoringCategory category) {
        List<PlantAttribute> attributes = category.attributes();
        List<String> matched = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        double sum = 0.0;

        for (PlantAttribute attribute : attributes) {
            AttributeEvaluation evaluation = evaluate(criteria, plant, attribute);
            sum += evaluation.score();
            if (evaluation.incomplete()) {
                warnings.add("Incomplete data for " + attribute.fieldName());
            } else if (evaluation.evaluated()) {
                if (evaluation.score() >= policy.matchThreshold()) {
                    matched.add(matchLabel(evaluation));
                } else if (evaluation.score() < policy.concernThreshold()) {
                    warnings.add(concernLabel(evaluation));
                }
            }
        }

        double mean = attributes.isEmpty() ? AttributeMatcher.NEUTRAL : sum / attributes.size();
        return new CategoryScore(category, mean, matched, warnings);
    }

    /**
     * Scores every category in reporting order.
     */
    public Map<ScoringCategory, CategoryScore> scoreAll(SearchCriteria criteria, PlantRecord plant) {
        Map<ScoringCategory, CategoryScore> scores = new EnumMap<>(ScoringCategory.class);
        for (ScoringCategory category : ScoringCategory.values()) {
            scores.put(category, score(criteria, plant, category));
        }
        return scores;
    }

    AttributeEvaluation evaluate(SearchCriteria criteria, PlantRecord plant, PlantAttribute attribute) {
        return rules.get(attribute).evaluate(criteria, plant);
    }

    private static String matchLabel(AttributeEvaluation evaluation) {
        PlantAttribute attribute = evaluation.attribute();
        if (attribute.isFlag()) {
            return attribute.matchPhrase();
        }
        return attribute.matchPhrase() + " (" + evaluation.plantValue() + ")";
    }

    private static String concernLabel(AttributeEvaluation evaluation) {
        PlantAttribute attribute = evaluation.attribute();
        if (attribute.isFlag()) {
            return attribute.concernPhrase();
        }
        return attribute.concernPhrase() + ": plant " + evaluation.plantValue()
            + ", requested " + evaluation.requestedValue();
    }
}
