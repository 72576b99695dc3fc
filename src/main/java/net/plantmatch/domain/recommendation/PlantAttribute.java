package net.plantmatch.domain.recommendation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Every scored plant attribute with its category and the phrases used in explanations.
 *
 * <p>Boolean attributes carry a complete phrase ("Deer resistant"); the others are
 * followed by the plant's value in parentheses.</p>
 */
public enum PlantAttribute {
    HARDINESS_ZONE(ScoringCategory.ENVIRONMENTAL, "hardinessZone", "Compatible hardiness zone", "Hardiness zone concern"),
    SUN_EXPOSURE(ScoringCategory.ENVIRONMENTAL, "sunExposure", "Suitable sun exposure", "Sun exposure concern"),
    SOIL_TYPE(ScoringCategory.ENVIRONMENTAL, "soilType", "Compatible soil type", "Soil type concern"),
    SOIL_PH(ScoringCategory.ENVIRONMENTAL, "soilPh", "Compatible pH", "pH concern"),
    MOISTURE_NEED(ScoringCategory.ENVIRONMENTAL, "moistureNeed", "Compatible water needs", "Water needs mismatch"),

    HEIGHT_RANGE(ScoringCategory.DESIGN, "heightRange", "Suitable height", "Height difference"),
    WIDTH_RANGE(ScoringCategory.DESIGN, "widthRange", "Suitable width", "Width difference"),
    BLOOM_COLOR(ScoringCategory.DESIGN, "bloomColor", "Matching color preference", "Bloom color differs"),
    BLOOM_SEASON(ScoringCategory.DESIGN, "bloomSeason", "Blooms in desired season", "Bloom season differs"),

    CARE_LEVEL(ScoringCategory.MAINTENANCE, "careLevel", "Suitable maintenance level", "Maintenance mismatch"),
    COST_TIER(ScoringCategory.MAINTENANCE, "costTier", "Within budget", "Price concern"),
    PEST_RESISTANCE(ScoringCategory.MAINTENANCE, "pestResistance", "Good pest resistance", "Limited pest resistance"),
    DISEASE_RESISTANCE(ScoringCategory.MAINTENANCE, "diseaseResistance", "Good disease resistance", "Limited disease resistance"),

    NATIVE_SPECIES(ScoringCategory.SPECIAL, "isNative", "Native plant species", "Not a native species"),
    WILDLIFE_VALUE(ScoringCategory.SPECIAL, "wildlifeValue", "Good wildlife value", "Limited wildlife value"),
    DEER_RESISTANT(ScoringCategory.SPECIAL, "deerResistant", "Deer resistant", "Not deer resistant"),
    POLLINATOR_FRIENDLY(ScoringCategory.SPECIAL, "pollinatorFriendly", "Pollinator friendly", "Limited pollinator value"),

    SUITABLE_FOR_CONTAINER(ScoringCategory.CONTEXT, "suitableForContainer", "Suitable for containers", "May not be ideal for containers"),
    SUITABLE_FOR_SCREENING(ScoringCategory.CONTEXT, "suitableForScreening", "Good for screening", "Not suited to screening"),
    SUITABLE_FOR_HEDGING(ScoringCategory.CONTEXT, "suitableForHedging", "Suitable for hedging", "Not suited to hedging"),
    SUITABLE_FOR_GROUNDCOVER(ScoringCategory.CONTEXT, "suitableForGroundcover", "Good groundcover option", "Not a groundcover"),
    SLOPE_TOLERANT(ScoringCategory.CONTEXT, "slopeTolerant", "Suitable for slopes", "Not suited to slopes");

    private static final Set<PlantAttribute> FLAGS = EnumSet.of(
        NATIVE_SPECIES, DEER_RESISTANT, POLLINATOR_FRIENDLY,
        SUITABLE_FOR_CONTAINER, SUITABLE_FOR_SCREENING, SUITABLE_FOR_HEDGING,
        SUITABLE_FOR_GROUNDCOVER, SLOPE_TOLERANT);

    private final ScoringCategory category;
    private final String fieldName;
    private final String matchPhrase;
    private final String concernPhrase;

    PlantAttribute(ScoringCategory category, String fieldName, String matchPhrase, String concernPhrase) {
        this.category = category;
        this.fieldName = fieldName;
        this.matchPhrase = matchPhrase;
        this.concernPhrase = concernPhrase;
    }

    public ScoringCategory category() {
        return category;
    }

    /**
     * Name of the attribute as it appears in request payloads and warnings.
     */
    public String fieldName() {
        return fieldName;
    }

    public String matchPhrase() {
        return matchPhrase;
    }

    public String concernPhrase() {
        return concernPhrase;
    }

    /**
     * Whether the attribute is a yes/no flag, whose phrases stand on their own.
     */
    public boolean isFlag() {
        return FLAGS.contains(this);
    }
}
