package net.plantmatch.config;

import jakarta.annotation.PostConstruct;
import net.plantmatch.domain.recommendation.CategoryWeights;
import net.plantmatch.domain.recommendation.CriteriaDefaults;
import net.plantmatch.domain.recommendation.MatchingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Strongly typed configuration for plant scoring, request defaults and result caching.
 */
@Component
@ConfigurationProperties(prefix = "recommendation")
public class RecommendationProperties {

    /**
     * Category weights applied when a request does not send its own.
     */
    private Weights weights = new Weights();

    /**
     * Number of results returned when a request does not say.
     */
    private int defaultResultLimit = 10;

    /**
     * Requested limits above this are clamped.
     */
    private int maxResultLimit = 100;

    /**
     * Results scoring below this are dropped unless the request says otherwise.
     */
    private double defaultMinScore = 0.0;

    /**
     * Attribute scores at or above this are reported as matched attributes.
     */
    private double matchThreshold = 0.8;

    /**
     * Attribute scores below this produce a concern warning.
     */
    private double concernThreshold = 0.5;

    /**
     * Score given when a required flag is missing on the plant.
     */
    private double booleanFloor = 0.3;

    /**
     * Score of two ranges that touch without overlapping.
     */
    private double rangeContactScore = 0.5;

    private double heightToleranceCm = 50.0;

    private double widthToleranceCm = 50.0;

    private double phTolerance = 0.5;

    /**
     * Zone gap at which the hardiness score reaches zero.
     */
    private int maxZoneDistance = 3;

    private int cacheMaxSize = 500;

    private Duration cacheTtl = Duration.ofMinutes(30);

    /**
     * Catalogs with at least this many entries are scored in parallel.
     */
    private int parallelThreshold = 5000;

    /**
     * Spring resource location of the JSON plant catalog.
     */
    private String catalogLocation = "classpath:catalog/plants.json";

    @PostConstruct
    void validate() {
        Assert.isTrue(defaultResultLimit >= 1, "recommendation.default-result-limit must be at least 1");
        Assert.isTrue(maxResultLimit >= defaultResultLimit,
                "recommendation.max-result-limit must not be below recommendation.default-result-limit");
        Assert.isTrue(defaultMinScore >= 0.0 && defaultMinScore <= 1.0,
                "recommendation.default-min-score must be within [0,1]");
        Assert.isTrue(cacheMaxSize > 0, "recommendation.cache-max-size must be positive");
        Assert.isTrue(!cacheTtl.isNegative() && !cacheTtl.isZero(), "recommendation.cache-ttl must be positive");
        Assert.isTrue(parallelThreshold >= 1, "recommendation.parallel-threshold must be at least 1");
        Assert.isTrue(StringUtils.hasText(catalogLocation), "recommendation.catalog-location must be set");
        weights.validate();
        // MatchingPolicy rejects out-of-range thresholds and tolerances.
        toMatchingPolicy();
    }

    public MatchingPolicy toMatchingPolicy() {
        return new MatchingPolicy(matchThreshold, concernThreshold, booleanFloor, rangeContactScore,
                heightToleranceCm, widthToleranceCm, phTolerance, maxZoneDistance);
    }

    public CriteriaDefaults toCriteriaDefaults() {
        return new CriteriaDefaults(weights.toCategoryWeights(), defaultResultLimit, maxResultLimit, defaultMinScore);
    }

    /**
     * Default weight per scoring category; they need not sum to one.
     */
    public static class Weights {
        private double environmental = 0.30;
        private double design = 0.25;
        private double maintenance = 0.20;
        private double special = 0.15;
        private double context = 0.10;

        void validate() {
            CategoryWeights weights = toCategoryWeights();
            for (double weight : new double[] {environmental, design, maintenance, special, context}) {
                Assert.isTrue(Double.isFinite(weight) && weight >= 0.0,
                        "recommendation.weights.* must be non-negative numbers");
            }
            Assert.isTrue(weights.total() > 0.0, "recommendation.weights must not all be zero");
        }

        public CategoryWeights toCategoryWeights() {
            return new CategoryWeights(environmental, design, maintenance, special, context);
        }

        public double getEnvironmental() {
            return environmental;
        }

        public void setEnvironmental(double environmental) {
            this.environmental = environmental;
        }

        public double getDesign() {
            return design;
        }

        public void setDesign(double design) {
            this.design = design;
        }

        public double getMaintenance() {
            return maintenance;
        }

        public void setMaintenance(double maintenance) {
            this.maintenance = maintenance;
        }

        public double getSpecial() {
            return special;
        }

        public void setSpecial(double special) {
            this.special = special;
        }

        public double getContext() {
            return context;
        }

        public void setContext(double context) {
            this.context = context;
        }
    }

    public Weights getWeights() {
        return weights;
    }

    public void setWeights(Weights weights) {
        this.weights = weights != null ? weights : new Weights();
    }

    public int getDefaultResultLimit() {
        return defaultResultLimit;
    }

    public void setDefaultResultLimit(int defaultResultLimit) {
        this.defaultResultLimit = defaultResultLimit;
    }

    public int getMaxResultLimit() {
        return maxResultLimit;
    }

    public void setMaxResultLimit(int maxResultLimit) {
        this.maxResultLimit = maxResultLimit;
    }

    public double getDefaultMinScore() {
        return defaultMinScore;
    }

    public void setDefaultMinScore(double defaultMinScore) {
        this.defaultMinScore = defaultMinScore;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public double getConcernThreshold() {
        return concernThreshold;
    }

    public void setConcernThreshold(double concernThreshold) {
        this.concernThreshold = concernThreshold;
    }

    public double getBooleanFloor() {
        return booleanFloor;
    }

    public void setBooleanFloor(double booleanFloor) {
        this.booleanFloor = booleanFloor;
    }

    public double getRangeContactScore() {
        return rangeContactScore;
    }

    public void setRangeContactScore(double rangeContactScore) {
        this.rangeContactScore = rangeContactScore;
    }

    public double getHeightToleranceCm() {
        return heightToleranceCm;
    }

    public void setHeightToleranceCm(double heightToleranceCm) {
        this.heightToleranceCm = heightToleranceCm;
    }

    public double getWidthToleranceCm() {
        return widthToleranceCm;
    }

    public void setWidthToleranceCm(double widthToleranceCm) {
        this.widthToleranceCm = widthToleranceCm;
    }

    public double getPhTolerance() {
        return phTolerance;
    }

    public void setPhTolerance(double phTolerance) {
        this.phTolerance = phTolerance;
    }

    public int getMaxZoneDistance() {
        return maxZoneDistance;
    }

    public void setMaxZoneDistance(int maxZoneDistance) {
        this.maxZoneDistance = maxZoneDistance;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public void setCacheMaxSize(int cacheMaxSize) {
        this.cacheMaxSize = cacheMaxSize;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl != null ? cacheTtl : Duration.ofMinutes(30);
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public String getCatalogLocation() {
        return catalogLocation;
    }

    public void setCatalogLocation(String catalogLocation) {
        this.catalogLocation = catalogLocation;
    }
}
