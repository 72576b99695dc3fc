package net.plantmatch.domain.recommendation;

import lombok.extern.slf4j.Slf4j;
import net.plantmatch.exception.InvalidCriteriaException;
import net.plantmatch.model.PlantRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Scores a plant catalog against one brief and keeps the best matches.
 *
 * <p>Ranking is deterministic: total score descending, then plant name ignoring case,
 * then id. Only the current top-N results are held, so the catalog may be any
 * {@link Iterable}, including a lazily read one. The engine does no I/O and never
 * mutates its inputs.</p>
 */
@Slf4j
public class RecommendationEngine {

    public static final Comparator<MatchResult> RANKING = Comparator
        .comparingDouble(MatchResult::totalScore).reversed()
        .thenComparing(result -> result.plant().getName(), String.CASE_INSENSITIVE_ORDER)
        .thenComparing(result -> result.plant().getId());

    private final CategoryScorer scorer;

    public RecommendationEngine(CategoryScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    /**
     * Ranked results only; see {@link #rank(SearchCriteria, Iterable)} for batch warnings.
     *
     * @throws InvalidCriteriaException before any scoring when the brief is unusable
     */
    public List<MatchResult> recommend(SearchCriteria criteria, Iterable<PlantRecord> catalog) {
        return rank(criteria, catalog).results();
    }

    /**
     * Scores every usable entry, drops those below the minimum score and keeps the top results.
     * Null entries and entries without an id or name are skipped with a batch warning.
     *
     * @throws InvalidCriteriaException before any scoring when the brief is unusable
     */
    public RecommendationBatch rank(SearchCriteria criteria, Iterable<PlantRecord> catalog) {
        validate(criteria);
        TopResults top = new TopResults(criteria);
        if (catalog != null) {
            int position = 0;
            for (PlantRecord plant : catalog) {
                top.offer(position++, plant, isRankable(plant) ? score(criteria, plant) : null);
            }
        }
        return top.toBatch();
    }

    /**
     * Same outcome as {@link #rank(SearchCriteria, Iterable)}, with plants scored in
     * parallel on {@code scheduler} and merged back in catalog order.
     */
    public Mono<RecommendationBatch> rankParallel(SearchCriteria criteria,
                                                  List<PlantRecord> catalog,
                                                  Scheduler scheduler) {
        try {
            validate(criteria);
        } catch (InvalidCriteriaException ex) {
            return Mono.error(ex);
        }
        if (catalog == null || catalog.isEmpty()) {
            return Mono.just(RecommendationBatch.empty());
        }
        return Flux.range(0, catalog.size())
            .parallel()
            .runOn(scheduler)
            .map(position -> scoreAt(criteria, catalog, position))
            .sequential()
            .collectSortedList(Comparator.comparingInt(PositionedScore::position))
            .map(scored -> {
                TopResults top = new TopResults(criteria);
                for (PositionedScore entry : scored) {
                    top.offer(entry.position(), catalog.get(entry.position()), entry.result());
                }
                return top.toBatch();
            });
    }

    /**
     * Scores one plant without validating the brief or applying the minimum score.
     */
    public MatchResult score(SearchCriteria criteria, PlantRecord plant) {
        CategoryWeights weights = weightsOf(criteria);
        Map<ScoringCategory, CategoryScore> categories = scorer.scoreAll(criteria, plant);

        Map<String, Double> categoryScores = new LinkedHashMap<>();
        List<String> matched = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        double total = 0.0;
        for (CategoryScore categoryScore : categories.values()) {
            categoryScores.put(categoryScore.category().key(), categoryScore.score());
            matched.addAll(categoryScore.matchedAttributes());
            warnings.addAll(categoryScore.warnings());
            total += categoryScore.score() * weights.normalizedWeightOf(categoryScore.category());
        }

        // All-zero weights leave every normalized weight at 0, hence a total of 0.
        total = Double.isNaN(total) ? 0.0 : Math.max(0.0, Math.min(1.0, total));
        return new MatchResult(plant, total, categoryScores, matched, warnings);
    }

    /**
     * Rejects briefs that cannot be ranked: a result limit below one, a minimum score
     * outside {@code [0,1]}, or a negative or non-finite category weight.
     */
    public void validate(SearchCriteria criteria) {
        if (criteria == null) {
            throw new InvalidCriteriaException("criteria must not be null");
        }
        List<String> violations = new ArrayList<>();
        if (criteria.getResultLimit() < 1) {
            violations.add("resultLimit must be at least 1 but was " + criteria.getResultLimit());
        }
        double minScore = criteria.getMinScore();
        if (!Double.isFinite(minScore) || minScore < 0.0 || minScore > 1.0) {
            violations.add("minScore must be within [0,1] but was " + minScore);
        }
        CategoryWeights weights = weightsOf(criteria);
        for (ScoringCategory category : ScoringCategory.values()) {
            double weight = weights.weightOf(category);
            if (!Double.isFinite(weight) || weight < 0.0) {
                violations.add("weight for " + category.key() + " must be a non-negative number but was " + weight);
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidCriteriaException(violations);
        }
    }

    private PositionedScore scoreAt(SearchCriteria criteria, List<PlantRecord> catalog, int position) {
        PlantRecord plant = catalog.get(position);
        return new PositionedScore(position, isRankable(plant) ? score(criteria, plant) : null);
    }

    private static boolean isRankable(PlantRecord plant) {
        return plant != null && plant.hasIdentity();
    }

    private static CategoryWeights weightsOf(SearchCriteria criteria) {
        return criteria.getCategoryWeights() != null ? criteria.getCategoryWeights() : CategoryWeights.DEFAULT;
    }

    private record PositionedScore(int position, MatchResult result) {
    }

    /**
     * Bounded accumulator: the heap head is the weakest result kept so far.
     */
    private static final class TopResults {
        private final int limit;
        private final double minScore;
        private final PriorityQueue<MatchResult> heap;
        private final List<String> warnings = new ArrayList<>();
        private int evaluated;

        TopResults(SearchCriteria criteria) {
            this.limit = criteria.getResultLimit();
            this.minScore = criteria.getMinScore();
            this.heap = new PriorityQueue<>(Math.min(limit, 1024) + 1, RANKING.reversed());
        }

        void offer(int position, PlantRecord plant, MatchResult result) {
            if (result == null) {
                String reason = plant == null ? "null record" : "missing id or name";
                warnings.add("Skipped catalog entry at position " + position + ": " + reason);
                log.debug("Skipping catalog entry at position {}: {}", position, reason);
                return;
            }
            evaluated++;
            if (result.totalScore() < minScore) {
                return;
            }
            heap.offer(result);
            if (heap.size() > limit) {
                heap.poll();
            }
        }

        RecommendationBatch toBatch() {
            List<MatchResult> ranked = new ArrayList<>(heap);
            ranked.sort(RANKING);
            log.debug("Ranked {} catalog entries into {} results ({} skipped)", evaluated, ranked.size(), warnings.size());
            return new RecommendationBatch(ranked, warnings, evaluated);
        }
    }
}
