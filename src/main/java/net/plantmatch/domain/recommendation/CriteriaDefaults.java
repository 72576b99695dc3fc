package net.plantmatch.domain.recommendation;

/**
 * Values a brief falls back to when the request leaves them out.
 *
 * @param weights category weights
 * @param resultLimit number of results returned
 * @param maxResultLimit larger requested limits are clamped to this
 * @param minScore results scoring below this are dropped
 */
public record CriteriaDefaults(CategoryWeights weights, int resultLimit, int maxResultLimit, double minScore) {

    public static final int MAX_RESULT_LIMIT = 100;

    public CriteriaDefaults {
        if (weights == null) {
            weights = CategoryWeights.DEFAULT;
        }
        if (resultLimit < 1 || maxResultLimit < resultLimit) {
            throw new IllegalArgumentException(
                "Result limits must satisfy 1 <= default <= max: " + resultLimit + ", " + maxResultLimit);
        }
    }

    public static CriteriaDefaults standard() {
        return new CriteriaDefaults(CategoryWeights.DEFAULT, SearchCriteria.DEFAULT_RESULT_LIMIT, MAX_RESULT_LIMIT, 0.0);
    }
}
