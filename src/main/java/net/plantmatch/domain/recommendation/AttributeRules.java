package net.plantmatch.domain.recommendation;

import net.plantmatch.model.Labeled;
import net.plantmatch.model.PlantRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The attribute table: which accessor and which matcher each {@link PlantAttribute} uses.
 */
final class AttributeRules {

    private AttributeRules() {
    }

    static Map<PlantAttribute, AttributeRule<?, ?>> forPolicy(MatchingPolicy policy) {
        Map<PlantAttribute, AttributeRule<?, ?>> rules = new EnumMap<>(PlantAttribute.class);

        put(rules, new AttributeRule<>(PlantAttribute.HARDINESS_ZONE,
            SearchCriteria::getHardinessZone, PlantRecord::getHardinessZone,
            (c, p) -> AttributeMatcher.zoneRange(c, p, policy.maxZoneDistance()), AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.SUN_EXPOSURE,
            SearchCriteria::getSunExposure, PlantRecord::getSunExposure,
            AttributeMatcher::categorical, AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.SOIL_TYPE,
            SearchCriteria::getSoilType, PlantRecord::getSoilType,
            AttributeMatcher::categorical, AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.SOIL_PH,
            SearchCriteria::getSoilPh, PlantRecord::getSoilPh,
            (c, p) -> AttributeMatcher.rangeOverlap(c, p, policy.rangeContactScore(), policy.phTolerance()),
            AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.MOISTURE_NEED,
            SearchCriteria::getMoistureNeed, PlantRecord::getMoistureNeed,
            AttributeMatcher::ordinal, AttributeRules::display));

        put(rules, new AttributeRule<>(PlantAttribute.HEIGHT_RANGE,
            SearchCriteria::getHeightRange, PlantRecord::getHeightRange,
            (c, p) -> AttributeMatcher.rangeOverlap(c, p, policy.rangeContactScore(), policy.heightToleranceCm()),
            AttributeRules::displayCentimetres));
        put(rules, new AttributeRule<>(PlantAttribute.WIDTH_RANGE,
            SearchCriteria::getWidthRange, PlantRecord::getWidthRange,
            (c, p) -> AttributeMatcher.rangeOverlap(c, p, policy.rangeContactScore(), policy.widthToleranceCm()),
            AttributeRules::displayCentimetres));
        put(rules, new AttributeRule<>(PlantAttribute.BLOOM_COLOR,
            SearchCriteria::getBloomColor, PlantRecord::getBloomColor,
            AttributeMatcher::categorical, AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.BLOOM_SEASON,
            SearchCriteria::getBloomSeason, PlantRecord::getBloomSeason,
            AttributeMatcher::categorical, AttributeRules::display));

        put(rules, new AttributeRule<>(PlantAttribute.CARE_LEVEL,
            SearchCriteria::getCareLevel, PlantRecord::getCareLevel,
            AttributeMatcher::ordinal, AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.COST_TIER,
            SearchCriteria::getCostTier, PlantRecord::getCostTier,
            AttributeMatcher::ordinal, AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.PEST_RESISTANCE,
            SearchCriteria::getPestResistance, PlantRecord::getPestResistance,
            AttributeMatcher::minimumLevel, AttributeRules::display));
        put(rules, new AttributeRule<>(PlantAttribute.DISEASE_RESISTANCE,
            SearchCriteria::getDiseaseResistance, PlantRecord::getDiseaseResistance,
            AttributeMatcher::minimumLevel, AttributeRules::display));

        putFlag(rules, policy, PlantAttribute.NATIVE_SPECIES,
            SearchCriteria::getNativeSpecies, PlantRecord::getNativeSpecies);
        put(rules, new AttributeRule<>(PlantAttribute.WILDLIFE_VALUE,
            SearchCriteria::getWildlifeValue, PlantRecord::getWildlifeValue,
            AttributeMatcher::minimumLevel, AttributeRules::display));
        putFlag(rules, policy, PlantAttribute.DEER_RESISTANT,
            SearchCriteria::getDeerResistant, PlantRecord::getDeerResistant);
        putFlag(rules, policy, PlantAttribute.POLLINATOR_FRIENDLY,
            SearchCriteria::getPollinatorFriendly, PlantRecord::getPollinatorFriendly);

        putFlag(rules, policy, PlantAttribute.SUITABLE_FOR_CONTAINER,
            SearchCriteria::getSuitableForContainer, PlantRecord::getSuitableForContainer);
        putFlag(rules, policy, PlantAttribute.SUITABLE_FOR_SCREENING,
            SearchCriteria::getSuitableForScreening, PlantRecord::getSuitableForScreening);
        putFlag(rules, policy, PlantAttribute.SUITABLE_FOR_HEDGING,
            SearchCriteria::getSuitableForHedging, PlantRecord::getSuitableForHedging);
        putFlag(rules, policy, PlantAttribute.SUITABLE_FOR_GROUNDCOVER,
            SearchCriteria::getSuitableForGroundcover, PlantRecord::getSuitableForGroundcover);
        putFlag(rules, policy, PlantAttribute.SLOPE_TOLERANT,
            SearchCriteria::getSlopeTolerant, PlantRecord::getSlopeTolerant);

        if (rules.size() != PlantAttribute.values().length) {
            throw new IllegalStateException("Attribute table is missing entries: " + rules.keySet());
        }
        return rules;
    }

    /**
     * Display form used in explanations: labels for vocabulary, trimmed decimals for levels.
     */
    static String display(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                .sorted(Comparator.comparingInt(AttributeRules::declarationOrder))
                .map(AttributeRules::display)
                .collect(Collectors.joining(", "));
        }
        if (value instanceof Labeled labeled) {
            return labeled.getLabel();
        }
        if (value instanceof Double number) {
            return String.format(Locale.ROOT, "%.2f", number).replaceAll("0+$", "").replaceAll("\\.$", "");
        }
        if (value instanceof Boolean flag) {
            return flag ? "yes" : "no";
        }
        return value.toString();
    }

    private static String displayCentimetres(Object value) {
        return value == null ? null : value + " cm";
    }

    private static int declarationOrder(Object value) {
        return value instanceof Enum<?> constant ? constant.ordinal() : 0;
    }

    private static void putFlag(Map<PlantAttribute, AttributeRule<?, ?>> rules,
                                MatchingPolicy policy,
                                PlantAttribute attribute,
                                Function<SearchCriteria, Boolean> criterionValue,
                                Function<PlantRecord, Boolean> plantValue) {
        put(rules, new AttributeRule<>(attribute, criterionValue, plantValue,
            (c, p) -> AttributeMatcher.booleanPreference(c, p, policy.booleanFloor()), AttributeRules::display));
    }

    private static void put(Map<PlantAttribute, AttributeRule<?, ?>> rules, AttributeRule<?, ?> rule) {
        rules.put(rule.attribute(), rule);
    }
}
