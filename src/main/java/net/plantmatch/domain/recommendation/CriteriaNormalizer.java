package net.plantmatch.domain.recommendation;

import lombok.extern.slf4j.Slf4j;
import net.plantmatch.model.BloomColor;
import net.plantmatch.model.BloomSeason;
import net.plantmatch.model.CareLevel;
import net.plantmatch.model.CostTier;
import net.plantmatch.model.MoistureLevel;
import net.plantmatch.model.NumericRange;
import net.plantmatch.model.SoilType;
import net.plantmatch.model.SunExposure;
import net.plantmatch.model.ZoneRange;
import net.plantmatch.util.SafeNumberParser;
import net.plantmatch.util.ValidationUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw request map into a typed {@link SearchCriteria}.
 *
 * <p>Accepts JSON-typed values as well as the all-string values of query parameters,
 * keys in camelCase or snake_case, and the field names of the legacy form. Nothing here
 * throws: values that cannot be read are dropped with a warning and unknown keys are
 * ignored. Negative weights and non-positive limits are kept as given so that the
 * engine can reject them.</p>
 */
@Slf4j
public class CriteriaNormalizer {

    private static final Pattern ZONE_PATTERN = Pattern.compile("^(\\d{1,2})\\s*[ab]?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ZONE_SPAN_PATTERN =
        Pattern.compile("^(\\d{1,2})\\s*[ab]?\\s*(?:-|to|\\.\\.)\\s*(\\d{1,2})\\s*[ab]?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RANGE_PATTERN =
        Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(?:-|to|\\.\\.)\\s*(\\d+(?:\\.\\d+)?)$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Double> LEVEL_WORDS = Map.of(
        "low", 0.25,
        "medium", 0.5,
        "moderate", 0.5,
        "high", 0.75
    );

    static final double WILDLIFE_FRIENDLY_MINIMUM = 0.5;

    private enum Criterion {
        HARDINESS_ZONE("hardinessZone", "zone"),
        SUN_EXPOSURE("sunExposure", "sun"),
        SOIL_TYPE("soilType", "soil"),
        SOIL_PH("soilPh", "ph"),
        SOIL_PH_MIN("soilPhMin", "phMin"),
        SOIL_PH_MAX("soilPhMax", "phMax"),
        MOISTURE_NEED("moistureNeed", "moistureLevel", "moisture", "waterNeeds"),
        HEIGHT_RANGE("heightRange", "desiredHeight", "height"),
        HEIGHT_MIN("heightMin", "desiredHeightMin", "heightRangeMin"),
        HEIGHT_MAX("heightMax", "desiredHeightMax", "heightRangeMax"),
        WIDTH_RANGE("widthRange", "desiredWidth", "width"),
        WIDTH_MIN("widthMin", "desiredWidthMin", "widthRangeMin"),
        WIDTH_MAX("widthMax", "desiredWidthMax", "widthRangeMax"),
        BLOOM_COLOR("bloomColor", "bloomColors", "colorPreferences", "colors"),
        BLOOM_SEASON("bloomSeason", "bloomSeasons", "bloomTime"),
        CARE_LEVEL("careLevel", "maintenanceLevel", "maintenance"),
        COST_TIER("costTier", "budgetRange", "budget"),
        PEST_RESISTANCE("pestResistance"),
        DISEASE_RESISTANCE("diseaseResistance"),
        NATIVE_SPECIES("isNative", "nativeSpecies", "nativePreference", "native"),
        WILDLIFE_VALUE("wildlifeValue"),
        WILDLIFE_FRIENDLY("wildlifeFriendly"),
        DEER_RESISTANT("deerResistant", "deerResistantRequired"),
        POLLINATOR_FRIENDLY("pollinatorFriendly", "pollinatorFriendlyRequired"),
        SUITABLE_FOR_CONTAINER("suitableForContainer", "containerPlanting", "container"),
        SUITABLE_FOR_SCREENING("suitableForScreening", "screeningPurpose", "screening"),
        SUITABLE_FOR_HEDGING("suitableForHedging", "hedgingPurpose", "hedging"),
        SUITABLE_FOR_GROUNDCOVER("suitableForGroundcover", "groundcoverPurpose", "groundcover"),
        SLOPE_TOLERANT("slopeTolerant", "slopePlanting", "slope"),
        CATEGORY_WEIGHTS("categoryWeights", "weights"),
        RESULT_LIMIT("resultLimit", "maxResults", "limit"),
        MIN_SCORE("minScore");

        private static final Map<String, Criterion> BY_KEY = new HashMap<>();

        static {
            for (Criterion criterion : values()) {
                for (String alias : criterion.aliases) {
                    BY_KEY.put(canonicalKey(alias), criterion);
                }
            }
        }

        private final List<String> aliases;

        Criterion(String... aliases) {
            this.aliases = Arrays.asList(aliases);
        }

        String displayName() {
            return aliases.get(0);
        }

        static Optional<Criterion> fromKey(String rawKey) {
            return Optional.ofNullable(BY_KEY.get(canonicalKey(rawKey)));
        }
    }

    private final CriteriaDefaults defaults;

    public CriteriaNormalizer(CriteriaDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public CriteriaDefaults defaults() {
        return defaults;
    }

    /**
     * Reads every recognised key of {@code rawInput}; a {@code null} or empty map yields a brief
     * with defaults only.
     */
    public NormalizedCriteria normalize(Map<String, ?> rawInput) {
        Session session = new Session();
        if (!ValidationUtils.isNullOrEmpty(rawInput)) {
            rawInput.forEach((key, value) -> {
                if (key != null && value != null) {
                    session.accept(key, value);
                }
            });
        }
        NormalizedCriteria normalized = session.finish();
        if (!normalized.warnings().isEmpty()) {
            log.debug("Normalized criteria with {} warnings: {}", normalized.warnings().size(), normalized.warnings());
        }
        return normalized;
    }

    static String canonicalKey(String rawKey) {
        return rawKey.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9.]", "");
    }

    /**
     * Mutable state of one normalization call.
     */
    private final class Session {
        private final SearchCriteria.SearchCriteriaBuilder builder = SearchCriteria.builder()
            .categoryWeights(defaults.weights())
            .resultLimit(defaults.resultLimit())
            .minScore(defaults.minScore());
        private final List<String> warnings = new ArrayList<>();
        private final Map<ScoringCategory, Double> weightOverrides = new EnumMap<>(ScoringCategory.class);
        private final Map<Criterion, Double> bounds = new EnumMap<>(Criterion.class);
        private Double wildlifeValue;
        private boolean wildlifeFriendly;

        void accept(String key, Object value) {
            Optional<Criterion> criterion = Criterion.fromKey(key);
            if (criterion.isPresent()) {
                apply(criterion.get(), value);
                return;
            }
            acceptWeightKey(key, value);
        }

        private void apply(Criterion criterion, Object value) {
            String name = criterion.displayName();
            switch (criterion) {
                case HARDINESS_ZONE -> builder.hardinessZone(zone(name, value));
                case SUN_EXPOSURE -> builder.sunExposure(enumSet(name, value, SunExposure.class, SunExposure::fromLabel));
                case SOIL_TYPE -> builder.soilType(enumSet(name, value, SoilType.class, SoilType::fromLabel));
                case SOIL_PH -> builder.soilPh(range(name, value));
                case MOISTURE_NEED -> builder.moistureNeed(single(name, value, MoistureLevel::fromLabel));
                case HEIGHT_RANGE -> builder.heightRange(range(name, value));
                case WIDTH_RANGE -> builder.widthRange(range(name, value));
                case SOIL_PH_MIN, SOIL_PH_MAX, HEIGHT_MIN, HEIGHT_MAX, WIDTH_MIN, WIDTH_MAX -> bound(criterion, value);
                case BLOOM_COLOR -> builder.bloomColor(enumSet(name, value, BloomColor.class, BloomColor::fromLabel));
                case BLOOM_SEASON -> builder.bloomSeason(enumSet(name, value, BloomSeason.class, BloomSeason::fromLabel));
                case CARE_LEVEL -> builder.careLevel(single(name, value, CareLevel::fromLabel));
                case COST_TIER -> builder.costTier(single(name, value, CostTier::fromLabel));
                case PEST_RESISTANCE -> builder.pestResistance(level(name, value));
                case DISEASE_RESISTANCE -> builder.diseaseResistance(level(name, value));
                case WILDLIFE_VALUE -> wildlifeValue = level(name, value);
                case WILDLIFE_FRIENDLY -> wildlifeFriendly = Boolean.TRUE.equals(flag(name, value));
                case NATIVE_SPECIES -> builder.nativeSpecies(flag(name, value));
                case DEER_RESISTANT -> builder.deerResistant(flag(name, value));
                case POLLINATOR_FRIENDLY -> builder.pollinatorFriendly(flag(name, value));
                case SUITABLE_FOR_CONTAINER -> builder.suitableForContainer(flag(name, value));
                case SUITABLE_FOR_SCREENING -> builder.suitableForScreening(flag(name, value));
                case SUITABLE_FOR_HEDGING -> builder.suitableForHedging(flag(name, value));
                case SUITABLE_FOR_GROUNDCOVER -> builder.suitableForGroundcover(flag(name, value));
                case SLOPE_TOLERANT -> builder.slopeTolerant(flag(name, value));
                case CATEGORY_WEIGHTS -> weights(name, value);
                case RESULT_LIMIT -> resultLimit(name, value);
                case MIN_SCORE -> minScore(name, value);
            }
        }

        /**
         * Flat weight keys such as {@code weights.design} or {@code designWeight}, as sent in query strings.
         */
        private void acceptWeightKey(String key, Object value) {
            String canonical = canonicalKey(key);
            String categoryKey = null;
            if (canonical.startsWith("weights.")) {
                categoryKey = canonical.substring("weights.".length());
            } else if (canonical.startsWith("categoryweights.")) {
                categoryKey = canonical.substring("categoryweights.".length());
            } else if (canonical.endsWith("weight")) {
                categoryKey = canonical.substring(0, canonical.length() - "weight".length());
            }
            if (categoryKey == null) {
                return;
            }
            Optional<ScoringCategory> category = ScoringCategory.fromKey(categoryKey);
            if (category.isEmpty()) {
                return;
            }
            weight(category.get(), value);
        }

        NormalizedCriteria finish() {
            applyBounds(Criterion.SOIL_PH_MIN, Criterion.SOIL_PH_MAX, "soilPh", builder::soilPh);
            applyBounds(Criterion.HEIGHT_MIN, Criterion.HEIGHT_MAX, "heightRange", builder::heightRange);
            applyBounds(Criterion.WIDTH_MIN, Criterion.WIDTH_MAX, "widthRange", builder::widthRange);

            if (wildlifeValue != null) {
                builder.wildlifeValue(wildlifeValue);
            } else if (wildlifeFriendly) {
                builder.wildlifeValue(WILDLIFE_FRIENDLY_MINIMUM);
            }

            if (!weightOverrides.isEmpty()) {
                CategoryWeights weights = defaults.weights();
                for (Map.Entry<ScoringCategory, Double> override : weightOverrides.entrySet()) {
                    weights = weights.with(override.getKey(), override.getValue());
                }
                builder.categoryWeights(weights);
            }
            return new NormalizedCriteria(builder.build(), warnings);
        }

        // Paired bounds override a range given in the same request; a lone bound becomes a point.
        private void applyBounds(Criterion minKey, Criterion maxKey, String name,
                                 Consumer<NumericRange> target) {
            Double min = bounds.get(minKey);
            Double max = bounds.get(maxKey);
            if (min == null && max == null) {
                return;
            }
            double low = min != null ? min : max;
            double high = max != null ? max : min;
            target.accept(orderedRange(name, low, high));
        }

        private void bound(Criterion criterion, Object value) {
            Double number = number(value);
            if (number == null || number < 0.0) {
                warn(criterion.displayName(), value);
                return;
            }
            bounds.put(criterion, number);
        }

        private ZoneRange zone(String name, Object value) {
            Integer[] span = zoneSpan(value);
            if (span == null) {
                warn(name, value);
                return null;
            }
            int min = span[0];
            int max = span[1];
            if (min > max) {
                warnings.add("Swapped reversed " + name + " " + min + "-" + max);
                int swap = min;
                min = max;
                max = swap;
            }
            if (min < ZoneRange.LOWEST_ZONE || max > ZoneRange.HIGHEST_ZONE) {
                warnings.add("Ignored " + name + ": zones must fall within "
                    + ZoneRange.LOWEST_ZONE + "-" + ZoneRange.HIGHEST_ZONE + " but got " + min + "-" + max);
                return null;
            }
            return ZoneRange.of(min, max);
        }

        private Integer[] zoneSpan(Object value) {
            if (value instanceof Number number) {
                double raw = number.doubleValue();
                return raw == Math.rint(raw) ? new Integer[] {(int) raw, (int) raw} : null;
            }
            if (value instanceof Collection<?> values) {
                List<?> items = new ArrayList<>(values);
                if (items.size() == 1) {
                    return zoneSpan(items.get(0));
                }
                if (items.size() != 2) {
                    return null;
                }
                Integer[] low = zoneSpan(items.get(0));
                Integer[] high = zoneSpan(items.get(1));
                return low == null || high == null ? null : new Integer[] {low[0], high[0]};
            }
            if (value instanceof Map<?, ?> map) {
                Integer[] low = map.get("min") == null ? null : zoneSpan(map.get("min"));
                Integer[] high = map.get("max") == null ? null : zoneSpan(map.get("max"));
                if (low == null && high == null) {
                    return null;
                }
                return new Integer[] {(low != null ? low : high)[0], (high != null ? high : low)[0]};
            }
            if (value instanceof String text) {
                String trimmed = text.trim();
                Matcher single = ZONE_PATTERN.matcher(trimmed);
                if (single.matches()) {
                    int zone = Integer.parseInt(single.group(1));
                    return new Integer[] {zone, zone};
                }
                Matcher span = ZONE_SPAN_PATTERN.matcher(trimmed);
                if (span.matches()) {
                    return new Integer[] {Integer.parseInt(span.group(1)), Integer.parseInt(span.group(2))};
                }
            }
            return null;
        }

        private NumericRange range(String name, Object value) {
            double[] bounds = rangeBounds(value);
            if (bounds == null || bounds[0] < 0.0 || bounds[1] < 0.0) {
                warn(name, value);
                return null;
            }
            return orderedRange(name, bounds[0], bounds[1]);
        }

        private double[] rangeBounds(Object value) {
            if (value instanceof Collection<?> values) {
                List<?> items = new ArrayList<>(values);
                if (items.size() == 1) {
                    return rangeBounds(items.get(0));
                }
                if (items.size() != 2) {
                    return null;
                }
                Double low = number(items.get(0));
                Double high = number(items.get(1));
                return low == null || high == null ? null : new double[] {low, high};
            }
            if (value instanceof Map<?, ?> map) {
                Double low = number(map.get("min"));
                Double high = number(map.get("max"));
                if (low == null && high == null) {
                    return null;
                }
                return new double[] {low != null ? low : high, high != null ? high : low};
            }
            if (value instanceof String text) {
                Matcher matcher = RANGE_PATTERN.matcher(text.trim());
                if (matcher.matches()) {
                    return new double[] {Double.parseDouble(matcher.group(1)), Double.parseDouble(matcher.group(2))};
                }
            }
            Double single = number(value);
            return single == null ? null : new double[] {single, single};
        }

        private NumericRange orderedRange(String name, double low, double high) {
            if (low > high) {
                NumericRange swapped = NumericRange.of(high, low);
                warnings.add("Swapped reversed " + name + " to " + swapped);
                return swapped;
            }
            return NumericRange.of(low, high);
        }

        private <E extends Enum<E>> Set<E> enumSet(String name, Object value, Class<E> type,
                                                   Function<String, Optional<E>> parser) {
            EnumSet<E> parsed = EnumSet.noneOf(type);
            for (Object item : items(value)) {
                String text = text(item);
                Optional<E> constant = text == null ? Optional.empty() : parser.apply(text);
                if (constant.isPresent()) {
                    parsed.add(constant.get());
                } else {
                    warn(name, item);
                }
            }
            return parsed.isEmpty() ? null : Collections.unmodifiableSet(parsed);
        }

        private <E extends Enum<E>> E single(String name, Object value, Function<String, Optional<E>> parser) {
            List<Object> items = items(value);
            if (items.size() != 1) {
                warn(name, value);
                return null;
            }
            String text = text(items.get(0));
            Optional<E> constant = text == null ? Optional.empty() : parser.apply(text);
            if (constant.isEmpty()) {
                warn(name, value);
                return null;
            }
            return constant.get();
        }

        private Double level(String name, Object value) {
            Double level = null;
            if (value instanceof String text && LEVEL_WORDS.containsKey(text.trim().toLowerCase(Locale.ROOT))) {
                level = LEVEL_WORDS.get(text.trim().toLowerCase(Locale.ROOT));
            } else {
                Double number = number(value);
                if (number != null && ValidationUtils.isUnitInterval(number)) {
                    level = number;
                }
            }
            if (level == null) {
                warn(name, value);
            }
            return level;
        }

        private Boolean flag(String name, Object value) {
            if (value instanceof Boolean bool) {
                return bool;
            }
            if (value instanceof Number number) {
                return number.doubleValue() != 0.0;
            }
            Boolean parsed = value instanceof String text ? SafeNumberParser.parseBooleanOrNull(text) : null;
            if (parsed == null) {
                warn(name, value);
            }
            return parsed;
        }

        private void weights(String name, Object value) {
            if (!(value instanceof Map<?, ?> map)) {
                warn(name, value);
                return;
            }
            map.forEach((rawCategory, weight) -> {
                Optional<ScoringCategory> category = rawCategory == null
                    ? Optional.empty()
                    : ScoringCategory.fromKey(rawCategory.toString());
                if (category.isEmpty()) {
                    warnings.add("Ignored unknown weight category '" + rawCategory + "'");
                    return;
                }
                weight(category.get(), weight);
            });
        }

        private void weight(ScoringCategory category, Object value) {
            Double weight = number(value);
            if (weight == null) {
                warn("weights." + category.key(), value);
                return;
            }
            weightOverrides.put(category, weight);
        }

        private void resultLimit(String name, Object value) {
            Double number = number(value);
            if (number == null || number != Math.rint(number)) {
                warn(name, value);
                return;
            }
            long limit = number.longValue();
            if (limit > defaults.maxResultLimit()) {
                warnings.add("Clamped " + name + " " + limit + " to the maximum of " + defaults.maxResultLimit());
                limit = defaults.maxResultLimit();
            }
            builder.resultLimit((int) Math.max(limit, Integer.MIN_VALUE));
        }

        private void minScore(String name, Object value) {
            Double number = number(value);
            if (number == null) {
                warn(name, value);
                return;
            }
            builder.minScore(number);
        }

        private Double number(Object value) {
            if (value instanceof Number number) {
                double raw = number.doubleValue();
                return Double.isFinite(raw) ? raw : null;
            }
            if (value instanceof String text) {
                return SafeNumberParser.parseDoubleOrNull(text);
            }
            if (value instanceof Collection<?> values && values.size() == 1) {
                return number(values.iterator().next());
            }
            return null;
        }

        private List<Object> items(Object value) {
            List<Object> items = new ArrayList<>();
            if (value instanceof Collection<?> values) {
                for (Object item : values) {
                    items.addAll(items(item));
                }
            } else if (value instanceof String text && text.contains(",")) {
                for (String part : text.split(",")) {
                    if (!part.isBlank()) {
                        items.add(part.trim());
                    }
                }
            } else if (value != null) {
                items.add(value);
            }
            return items;
        }

        private String text(Object value) {
            if (value instanceof String text) {
                return text.isBlank() ? null : text;
            }
            return null;
        }

        private void warn(String name, Object value) {
            warnings.add("Ignored " + name + ": unrecognised value '" + value + "'");
        }
    }
}
