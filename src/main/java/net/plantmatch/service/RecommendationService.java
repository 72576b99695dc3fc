/**
 * Entry point for plant recommendations: normalizes a raw request, ranks the current
 * catalog and caches the ranked batch.
 *
 * <p>Batches are cached per {@link RecommendationCacheKey}, i.e. per brief and catalog
 * version. Caffeine computes each key at most once at a time, so concurrent identical
 * requests share a single scoring pass. Large catalogs are scored in parallel.</p>
 */
package net.plantmatch.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import net.plantmatch.config.RecommendationProperties;
import net.plantmatch.domain.recommendation.CriteriaDefaults;
import net.plantmatch.domain.recommendation.CriteriaNormalizer;
import net.plantmatch.domain.recommendation.NormalizedCriteria;
import net.plantmatch.domain.recommendation.RecommendationBatch;
import net.plantmatch.domain.recommendation.RecommendationEngine;
import net.plantmatch.domain.recommendation.ScoringCategory;
import net.plantmatch.domain.recommendation.SearchCriteria;
import net.plantmatch.model.BloomColor;
import net.plantmatch.model.BloomSeason;
import net.plantmatch.model.CareLevel;
import net.plantmatch.model.CostTier;
import net.plantmatch.model.Labeled;
import net.plantmatch.model.MoistureLevel;
import net.plantmatch.model.PlantRecord;
import net.plantmatch.model.SoilType;
import net.plantmatch.model.SunExposure;
import net.plantmatch.model.ZoneRange;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

@Service
@Slf4j
public class RecommendationService {

    private static final List<String> RESISTANCE_LEVELS = List.of("low", "medium", "high");

    private final CriteriaNormalizer normalizer;
    private final RecommendationEngine engine;
    private final PlantCatalogProvider catalogProvider;
    private final Cache<RecommendationCacheKey, RecommendationBatch> cache;
    private final int parallelThreshold;
    private final Scheduler scoringScheduler;

    public RecommendationService(CriteriaNormalizer normalizer,
                                 RecommendationEngine engine,
                                 PlantCatalogProvider catalogProvider,
                                 Cache<RecommendationCacheKey, RecommendationBatch> recommendationCache,
                                 RecommendationProperties properties) {
        this.normalizer = normalizer;
        this.engine = engine;
        this.catalogProvider = catalogProvider;
        this.cache = recommendationCache;
        this.parallelThreshold = properties.getParallelThreshold();
        this.scoringScheduler = Schedulers.parallel();
    }

    /**
     * Normalizes {@code rawCriteria} and ranks the current catalog against it.
     *
     * @throws net.plantmatch.exception.InvalidCriteriaException if the brief cannot be ranked
     * @throws net.plantmatch.exception.CatalogLoadException if the catalog cannot be read
     */
    public RecommendationReport recommend(Map<String, ?> rawCriteria) {
        return recommend(normalizer.normalize(rawCriteria));
    }

    public RecommendationReport recommend(NormalizedCriteria normalized) {
        SearchCriteria criteria = Objects.requireNonNull(normalized, "normalized").criteria();
        // Reject bad briefs before touching the catalog or the cache.
        engine.validate(criteria);

        PlantCatalog catalog = catalogProvider.currentCatalog();
        RecommendationCacheKey key = new RecommendationCacheKey(criteria, catalog.version());
        RecommendationBatch batch = cache.get(key, ignored -> rank(criteria, catalog));

        return new RecommendationReport(batch, normalized.warnings(), criteria, catalog.size(), catalog.version());
    }

    /**
     * Runs {@link #recommend(Map)} off the caller's thread.
     */
    public Mono<RecommendationReport> recommendAsync(Map<String, ?> rawCriteria) {
        return Mono.fromCallable(() -> recommend(rawCriteria))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public NormalizedCriteria normalize(Map<String, ?> rawCriteria) {
        return normalizer.normalize(rawCriteria);
    }

    /**
     * Selectable values for each criterion plus the zone span found in the catalog.
     */
    public CriteriaOptions criteriaOptions() {
        CriteriaDefaults defaults = normalizer.defaults();
        Map<String, Double> weights = new LinkedHashMap<>();
        for (ScoringCategory category : ScoringCategory.values()) {
            weights.put(category.key(), defaults.weights().weightOf(category));
        }

        return new CriteriaOptions(
            IntStream.rangeClosed(ZoneRange.LOWEST_ZONE, ZoneRange.HIGHEST_ZONE).boxed().toList(),
            catalogZoneSpan(catalogProvider.currentCatalog()),
            labels(SunExposure.values()),
            labels(SoilType.values()),
            labels(MoistureLevel.values()),
            labels(BloomColor.values()),
            labels(BloomSeason.values()),
            labels(CareLevel.values()),
            Arrays.stream(CostTier.values())
                .map(tier -> tier.getLabel() + " (" + tier.getPriceBand() + ")")
                .toList(),
            RESISTANCE_LEVELS,
            weights,
            defaults.resultLimit(),
            defaults.maxResultLimit());
    }

    /**
     * Re-reads the catalog and drops every cached batch.
     */
    public PlantCatalog reloadCatalog() {
        PlantCatalog reloaded = catalogProvider.reload();
        evictAll();
        return reloaded;
    }

    public void evictAll() {
        long cached = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Evicted {} cached recommendation batches", cached);
    }

    private RecommendationBatch rank(SearchCriteria criteria, PlantCatalog catalog) {
        log.debug("Recommendation cache miss; ranking {} plants (catalog {})", catalog.size(), catalog.version());
        if (catalog.size() >= parallelThreshold) {
            return engine.rankParallel(criteria, catalog.plants(), scoringScheduler).block();
        }
        return engine.rank(criteria, catalog.plants());
    }

    private static List<Integer> catalogZoneSpan(PlantCatalog catalog) {
        int coldest = Integer.MAX_VALUE;
        int warmest = Integer.MIN_VALUE;
        for (PlantRecord plant : catalog.plants()) {
            ZoneRange zone = plant.getHardinessZone();
            if (zone != null) {
                coldest = Math.min(coldest, zone.minZone());
                warmest = Math.max(warmest, zone.maxZone());
            }
        }
        return coldest > warmest ? List.of() : List.of(coldest, warmest);
    }

    private static List<String> labels(Labeled[] values) {
        return Arrays.stream(values).map(Labeled::getLabel).toList();
    }
}
