package net.plantmatch.application.recommendation;

import net.plantmatch.controller.dto.MatchResultDto;
import net.plantmatch.controller.dto.PlantDto;
import net.plantmatch.controller.dto.PlantRecommendationResponse;
import net.plantmatch.domain.recommendation.MatchResult;
import net.plantmatch.domain.recommendation.RecommendationBatch;
import net.plantmatch.domain.recommendation.SearchCriteria;
import net.plantmatch.model.CostTier;
import net.plantmatch.model.NumericRange;
import net.plantmatch.model.PlantFixtures;
import net.plantmatch.model.SunExposure;
import net.plantmatch.model.ZoneRange;
import net.plantmatch.service.RecommendationReport;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PlantRecommendationResponseUseCaseTest {

    private final PlantRecommendationResponseUseCase useCase = new PlantRecommendationResponseUseCase();

    @Test
    void should_RoundScoresToThreeDecimals_When_MappingResult() {
        Map<String, Double> categories = new LinkedHashMap<>();
        categories.put("environmental", 14.0 / 15.0);
        categories.put("design", 1.0);
        MatchResult result = new MatchResult(PlantFixtures.lavender(), 0.98765, categories,
            List.of("Deer resistant"), List.of());

        MatchResultDto dto = useCase.toMatchResultDto(result);

        assertThat(dto.totalScore()).isEqualTo(0.988);
        assertThat(dto.categoryScores()).containsExactly(Map.entry("environmental", 0.933), Map.entry("design", 1.0));
        assertThat(dto.matchedAttributes()).containsExactly("Deer resistant");
    }

    @Test
    void should_RenderLabelsAndRanges_When_MappingPlant() {
        PlantDto plant = useCase.toPlantDto(PlantFixtures.lavender());

        assertThat(plant.hardinessZone()).isEqualTo("5-8");
        assertThat(plant.sunExposure()).containsExactly("Full sun");
        assertThat(plant.soilType()).containsExactly("Sandy", "Chalky");
        assertThat(plant.bloomColor()).containsExactly("Purple", "Blue");
        assertThat(plant.heightRangeCm()).isEqualTo("30-60");
        assertThat(plant.moistureNeed()).isEqualTo("Dry");
        assertThat(plant.costTier()).isEqualTo("Low");
        assertThat(plant.nativeSpecies()).isFalse();
    }

    @Test
    void should_LeaveMissingAttributesNull_When_PlantIsSparse() {
        PlantDto plant = useCase.toPlantDto(PlantFixtures.plant("p1", "Sparse"));

        assertThat(plant.hardinessZone()).isNull();
        assertThat(plant.sunExposure()).isNull();
        assertThat(plant.heightRangeCm()).isNull();
    }

    @Test
    void should_SummarizeOnlyExpressedPreferences_When_BuildingCriteriaSummary() {
        SearchCriteria criteria = SearchCriteria.builder()
            .hardinessZone(ZoneRange.of(5, 7))
            .sunExposure(Set.of(SunExposure.SHADE, SunExposure.FULL_SUN))
            .heightRange(NumericRange.of(30, 60))
            .costTier(CostTier.MEDIUM)
            .pestResistance(0.75)
            .nativeSpecies(true)
            .deerResistant(false)
            .build();

        Map<String, String> summary = useCase.criteriaSummary(criteria);

        assertThat(summary).containsExactly(
            Map.entry("Hardiness Zone", "5-7"),
            Map.entry("Sun Exposure", "Full sun, Shade"),
            Map.entry("Desired Height", "30-60 cm"),
            Map.entry("Budget", "Medium ($25-150)"),
            Map.entry("Pest Resistance", "at least 0.75"),
            Map.entry("Native Preference", "Yes"));
    }

    @Test
    void should_CountEvaluatedPlantsAndMergeWarnings_When_MappingReport() {
        MatchResult result = new MatchResult(PlantFixtures.hosta(), 0.5, Map.of("environmental", 0.5),
            List.of(), List.of("Sun exposure concern: plant Partial sun, Shade, requested Full sun"));
        RecommendationBatch batch = new RecommendationBatch(List.of(result),
            List.of("Skipped catalog entry at position 3: null record"), 7);
        RecommendationReport report = new RecommendationReport(batch,
            List.of("Ignored soilType: unrecognised value 'gravel'"), SearchCriteria.empty(), 8, "abc123");

        PlantRecommendationResponse response = useCase.toResponse(report);

        assertThat(response.totalPlantsEvaluated()).isEqualTo(7);
        assertThat(response.recommendationsCount()).isEqualTo(1);
        assertThat(response.catalogVersion()).isEqualTo("abc123");
        assertThat(response.criteriaSummary()).isEmpty();
        assertThat(response.warnings()).containsExactly(
            "Ignored soilType: unrecognised value 'gravel'",
            "Skipped catalog entry at position 3: null record");
    }

    @Test
    void should_MapNonFiniteScoreToZero_When_Rounding() {
        assertThat(PlantRecommendationResponseUseCase.round(Double.NaN)).isZero();
        assertThat(PlantRecommendationResponseUseCase.round(0.1235)).isEqualTo(0.124);
    }
}
