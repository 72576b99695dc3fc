package net.plantmatch.domain.recommendation;

import java.util.EnumMap;
import java.util.Map;

/**
 * Relative importance of each scoring category.
 *
 * <p>Weights need not sum to one; the engine scores with {@link #normalizedWeightOf}. Negative
 * values are representable so that request validation can reject them explicitly.</p>
 */
public record CategoryWeights(double environmental,
                              double design,
                              double maintenance,
                              double special,
                              double context) {

    public static final CategoryWeights DEFAULT = new CategoryWeights(0.30, 0.25, 0.20, 0.15, 0.10);

    public double weightOf(ScoringCategory category) {
        return switch (category) {
            case ENVIRONMENTAL -> environmental;
            case DESIGN -> design;
            case MAINTENANCE -> maintenance;
            case SPECIAL -> special;
            case CONTEXT -> context;
        };
    }

    public double total() {
        return environmental + design + maintenance + special + context;
    }

    /**
     * Share of the total carried by one category, or {@code 0} when every weight is zero.
     * Weights are rescaled by the largest one first, so huge finite weights cannot overflow
     * the sum.
     */
    public double normalizedWeightOf(ScoringCategory category) {
        double largest = 0.0;
        for (ScoringCategory each : ScoringCategory.values()) {
            largest = Math.max(largest, weightOf(each));
        }
        if (!(largest > 0.0) || Double.isInfinite(largest)) {
            return 0.0;
        }
        double rescaledTotal = 0.0;
        for (ScoringCategory each : ScoringCategory.values()) {
            rescaledTotal += Math.max(0.0, weightOf(each)) / largest;
        }
        return Math.max(0.0, weightOf(category)) / largest / rescaledTotal;
    }

    public CategoryWeights with(ScoringCategory category, double weight) {
        Map<ScoringCategory, Double> values = asMap();
        values.put(category, weight);
        return fromMap(values);
    }

    private Map<ScoringCategory, Double> asMap() {
        Map<ScoringCategory, Double> values = new EnumMap<>(ScoringCategory.class);
        for (ScoringCategory category : ScoringCategory.values()) {
            values.put(category, weightOf(category));
        }
        return values;
    }

    private static CategoryWeights fromMap(Map<ScoringCategory, Double> values) {
        return new CategoryWeights(
            values.get(ScoringCategory.ENVIRONMENTAL),
            values.get(ScoringCategory.DESIGN),
            values.get(ScoringCategory.MAINTENANCE),
            values.get(ScoringCategory.SPECIAL),
            values.get(ScoringCategory.CONTEXT));
    }
}
