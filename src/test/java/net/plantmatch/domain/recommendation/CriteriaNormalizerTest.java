package net.plantmatch.domain.recommendation;

import net.plantmatch.model.BloomColor;
import net.plantmatch.model.CareLevel;
import net.plantmatch.model.CostTier;
import net.plantmatch.model.MoistureLevel;
import net.plantmatch.model.NumericRange;
import net.plantmatch.model.SunExposure;
import net.plantmatch.model.ZoneRange;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CriteriaNormalizerTest {

    private final CriteriaNormalizer normalizer = new CriteriaNormalizer(CriteriaDefaults.standard());

    @Test
    void should_ApplyDefaults_When_InputIsEmptyOrNull() {
        NormalizedCriteria fromNull = normalizer.normalize(null);
        NormalizedCriteria fromEmpty = normalizer.normalize(Map.of());

        assertThat(fromNull.criteria()).isEqualTo(SearchCriteria.empty());
        assertThat(fromEmpty.criteria()).isEqualTo(SearchCriteria.empty());
        assertThat(fromNull.warnings()).isEmpty();
    }

    @Test
    void should_ReadTypedValues_When_PayloadUsesJsonTypes() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("hardinessZone", "5-7");
        raw.put("sunExposure", List.of("Full Sun", "partial shade"));
        raw.put("moistureLevel", "moist");
        raw.put("heightRange", Map.of("min", 30, "max", 60));
        raw.put("colorPreferences", "purple, blue");
        raw.put("maintenanceLevel", "easy");
        raw.put("budgetRange", "medium");
        raw.put("pestResistance", "high");
        raw.put("nativePreference", true);
        raw.put("deer_resistant_required", "yes");

        NormalizedCriteria normalized = normalizer.normalize(raw);
        SearchCriteria criteria = normalized.criteria();

        assertThat(normalized.warnings()).isEmpty();
        assertThat(criteria.getHardinessZone()).isEqualTo(ZoneRange.of(5, 7));
        assertThat(criteria.getSunExposure()).containsExactlyInAnyOrder(SunExposure.FULL_SUN, SunExposure.PARTIAL_SUN);
        assertThat(criteria.getMoistureNeed()).isEqualTo(MoistureLevel.MOIST);
        assertThat(criteria.getHeightRange()).isEqualTo(NumericRange.of(30, 60));
        assertThat(criteria.getBloomColor()).containsExactlyInAnyOrder(BloomColor.PURPLE, BloomColor.BLUE);
        assertThat(criteria.getCareLevel()).isEqualTo(CareLevel.LOW);
        assertThat(criteria.getCostTier()).isEqualTo(CostTier.MEDIUM);
        assertThat(criteria.getPestResistance()).isEqualTo(0.75);
        assertThat(criteria.getNativeSpecies()).isTrue();
        assertThat(criteria.getDeerResistant()).isTrue();
    }

    @Test
    void should_ParseSingleZoneWithSubzone_When_ZoneIsText() {
        SearchCriteria criteria = normalizer.normalize(Map.of("zone", "6a")).criteria();

        assertThat(criteria.getHardinessZone()).isEqualTo(ZoneRange.of(6, 6));
    }

    @Test
    void should_SwapAndWarn_When_RangeIsReversed() {
        NormalizedCriteria normalized = normalizer.normalize(Map.of("heightRange", List.of(60, 30)));

        assertThat(normalized.criteria().getHeightRange()).isEqualTo(NumericRange.of(30, 60));
        assertThat(normalized.warnings()).containsExactly("Swapped reversed heightRange to 30-60");
    }

    @Test
    void should_SwapAndWarn_When_ZoneSpanIsReversed() {
        NormalizedCriteria normalized = normalizer.normalize(Map.of("hardinessZone", "7-5"));

        assertThat(normalized.criteria().getHardinessZone()).isEqualTo(ZoneRange.of(5, 7));
        assertThat(normalized.warnings()).containsExactly("Swapped reversed hardinessZone 7-5");
    }

    @Test
    void should_DropZoneWithWarning_When_ZoneIsOffTheScale() {
        NormalizedCriteria normalized = normalizer.normalize(Map.of("hardinessZone", 15));

        assertThat(normalized.criteria().getHardinessZone()).isNull();
        assertThat(normalized.warnings())
            .containsExactly("Ignored hardinessZone: zones must fall within 1-13 but got 15-15");
    }

    @Test
    void should_BuildPointRange_When_OnlyOneBoundGiven() {
        SearchCriteria criteria = normalizer.normalize(Map.of("desiredHeightMin", "90")).criteria();

        assertThat(criteria.getHeightRange()).isEqualTo(NumericRange.point(90));
    }

    @Test
    void should_CombineBounds_When_MinAndMaxGivenSeparately() {
        SearchCriteria criteria = normalizer.normalize(Map.of("soilPhMin", 6.0, "soilPhMax", "7.5")).criteria();

        assertThat(criteria.getSoilPh()).isEqualTo(NumericRange.of(6.0, 7.5));
    }

    @Test
    void should_IgnoreValueWithWarning_When_VocabularyIsUnknown() {
        NormalizedCriteria normalized = normalizer.normalize(Map.of("sunExposure", List.of("full sun", "moonlight")));

        assertThat(normalized.criteria().getSunExposure()).containsExactly(SunExposure.FULL_SUN);
        assertThat(normalized.warnings()).containsExactly("Ignored sunExposure: unrecognised value 'moonlight'");
    }

    @Test
    void should_IgnoreUnknownKeysSilently_When_PayloadHasExtraFields() {
        NormalizedCriteria normalized = normalizer.normalize(Map.of("gardenName", "Back yard"));

        assertThat(normalized.criteria()).isEqualTo(SearchCriteria.empty());
        assertThat(normalized.warnings()).isEmpty();
    }

    @Test
    void should_OverrideOnlyGivenWeights_When_WeightsMapIsPartial() {
        Map<String, Object> weights = new LinkedHashMap<>();
        weights.put("design", 0.5);
        weights.put("aesthetics", 0.2);

        NormalizedCriteria normalized = normalizer.normalize(Map.of("weights", weights));
        CategoryWeights result = normalized.criteria().getCategoryWeights();

        assertThat(result).isEqualTo(CategoryWeights.DEFAULT.with(ScoringCategory.DESIGN, 0.5));
        assertThat(normalized.warnings()).containsExactly("Ignored unknown weight category 'aesthetics'");
    }

    @Test
    void should_ReadFlatWeightKeys_When_SentAsQueryParameters() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("weights.environmental", "0.6");
        raw.put("contextWeight", "0");

        CategoryWeights weights = normalizer.normalize(raw).criteria().getCategoryWeights();

        assertThat(weights.environmental()).isEqualTo(0.6);
        assertThat(weights.context()).isZero();
        assertThat(weights.design()).isEqualTo(CategoryWeights.DEFAULT.design());
    }

    @Test
    void should_KeepNegativeWeight_When_EngineMustRejectIt() {
        SearchCriteria criteria = normalizer.normalize(Map.of("weights", Map.of("special", -0.1))).criteria();

        assertThat(criteria.getCategoryWeights().special()).isEqualTo(-0.1);
    }

    @Test
    void should_ClampWithWarning_When_ResultLimitExceedsMaximum() {
        NormalizedCriteria normalized = normalizer.normalize(Map.of("maxResults", 500));

        assertThat(normalized.criteria().getResultLimit()).isEqualTo(CriteriaDefaults.MAX_RESULT_LIMIT);
        assertThat(normalized.warnings()).containsExactly("Clamped resultLimit 500 to the maximum of 100");
    }

    @Test
    void should_PassThroughNonPositiveLimit_When_EngineMustRejectIt() {
        assertThat(normalizer.normalize(Map.of("resultLimit", "0")).criteria().getResultLimit()).isZero();
    }

    @Test
    void should_TranslateWildlifeFriendly_When_NoExplicitWildlifeValue() {
        SearchCriteria criteria = normalizer.normalize(Map.of("wildlifeFriendly", "true")).criteria();

        assertThat(criteria.getWildlifeValue()).isEqualTo(CriteriaNormalizer.WILDLIFE_FRIENDLY_MINIMUM);
    }

    @Test
    void should_WarnAndDrop_When_LevelIsOutsideUnitInterval() {
        NormalizedCriteria normalized = normalizer.normalize(Map.of("diseaseResistance", 3));

        assertThat(normalized.criteria().getDiseaseResistance()).isNull();
        assertThat(normalized.warnings()).containsExactly("Ignored diseaseResistance: unrecognised value '3'");
    }

    @Test
    void should_ProduceEqualBriefs_When_SamePreferencesSpelledDifferently() {
        SearchCriteria fromJson = normalizer.normalize(Map.of("sunExposure", List.of("FULL_SUN"), "limit", 5)).criteria();
        SearchCriteria fromQuery = normalizer.normalize(Map.of("sun", "full sun", "result_limit", "5")).criteria();

        assertThat(fromQuery).isEqualTo(fromJson);
    }
}
