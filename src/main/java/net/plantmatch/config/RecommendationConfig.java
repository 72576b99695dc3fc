package net.plantmatch.config;

import com.github.benmanes.caffeine.cache.Cache;
import net.plantmatch.domain.recommendation.CategoryScorer;
import net.plantmatch.domain.recommendation.CriteriaNormalizer;
import net.plantmatch.domain.recommendation.MatchingPolicy;
import net.plantmatch.domain.recommendation.RecommendationBatch;
import net.plantmatch.domain.recommendation.RecommendationEngine;
import net.plantmatch.service.RecommendationCacheKey;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free scoring core from {@link RecommendationProperties}.
 */
@Configuration
public class RecommendationConfig {

    @Bean
    public MatchingPolicy matchingPolicy(RecommendationProperties properties) {
        return properties.toMatchingPolicy();
    }

    @Bean
    public CategoryScorer categoryScorer(MatchingPolicy matchingPolicy) {
        return new CategoryScorer(matchingPolicy);
    }

    @Bean
    public RecommendationEngine recommendationEngine(CategoryScorer categoryScorer) {
        return new RecommendationEngine(categoryScorer);
    }

    @Bean
    public CriteriaNormalizer criteriaNormalizer(RecommendationProperties properties) {
        return new CriteriaNormalizer(properties.toCriteriaDefaults());
    }

    @Bean
    public Cache<RecommendationCacheKey, RecommendationBatch> recommendationCache(CacheFactory cacheFactory,
                                                                                 RecommendationProperties properties) {
        return cacheFactory.createCache("recommendations", properties.getCacheMaxSize(), properties.getCacheTtl());
    }
}
