package net.plantmatch.service;

import net.plantmatch.domain.recommendation.SearchCriteria;

/**
 * Cached batches are only reused for the same brief against the same catalog content.
 */
public record RecommendationCacheKey(SearchCriteria criteria, String catalogVersion) {
}
