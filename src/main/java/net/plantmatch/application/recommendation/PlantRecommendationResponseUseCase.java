package net.plantmatch.application.recommendation;

import net.plantmatch.controller.dto.MatchResultDto;
import net.plantmatch.controller.dto.PlantDto;
import net.plantmatch.controller.dto.PlantRecommendationResponse;
import net.plantmatch.domain.recommendation.MatchResult;
import net.plantmatch.domain.recommendation.SearchCriteria;
import net.plantmatch.model.CostTier;
import net.plantmatch.model.Labeled;
import net.plantmatch.model.NumericRange;
import net.plantmatch.model.PlantRecord;
import net.plantmatch.service.RecommendationReport;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps recommendation reports into stable API DTO responses.
 *
 * <p>Centralizes score rounding, plant rendering and the criteria summary so the
 * controller stays focused on HTTP concerns.</p>
 */
@Service
public class PlantRecommendationResponseUseCase {

    private static final int SCORE_SCALE = 3;

    public PlantRecommendationResponse toResponse(RecommendationReport report) {
        List<MatchResultDto> recommendations = new ArrayList<>(report.results().size());
        for (MatchResult result : report.results()) {
            recommendations.add(toMatchResultDto(result));
        }
        return new PlantRecommendationResponse(
            List.copyOf(recommendations),
            report.warnings(),
            criteriaSummary(report.criteria()),
            report.batch().evaluatedCount(),
            recommendations.size(),
            report.catalogVersion());
    }

    public MatchResultDto toMatchResultDto(MatchResult result) {
        Map<String, Double> categoryScores = new LinkedHashMap<>();
        result.categoryScores().forEach((category, score) -> categoryScores.put(category, round(score)));
        return new MatchResultDto(
            toPlantDto(result.plant()),
            round(result.totalScore()),
            categoryScores,
            result.matchedAttributes(),
            result.warnings());
    }

    public PlantDto toPlantDto(PlantRecord plant) {
        return new PlantDto(
            plant.getId(),
            plant.getName(),
            plant.getCommonName(),
            plant.getHardinessZone() != null ? plant.getHardinessZone().toString() : null,
            labels(plant.getSunExposure()),
            labels(plant.getSoilType()),
            plant.getSoilPh() != null ? plant.getSoilPh().toString() : null,
            label(plant.getMoistureNeed()),
            plant.getHeightRange() != null ? plant.getHeightRange().toString() : null,
            plant.getWidthRange() != null ? plant.getWidthRange().toString() : null,
            labels(plant.getBloomColor()),
            labels(plant.getBloomSeason()),
            label(plant.getCareLevel()),
            label(plant.getCostTier()),
            plant.getPestResistance(),
            plant.getDiseaseResistance(),
            plant.getNativeSpecies(),
            plant.getWildlifeValue(),
            plant.getDeerResistant(),
            plant.getPollinatorFriendly(),
            plant.getSuitableForContainer(),
            plant.getSuitableForScreening(),
            plant.getSuitableForHedging(),
            plant.getSuitableForGroundcover(),
            plant.getSlopeTolerant());
    }

    /**
     * Human-readable labels of the preferences a brief expresses, in form order.
     */
    public Map<String, String> criteriaSummary(SearchCriteria criteria) {
        Map<String, String> summary = new LinkedHashMap<>();
        if (criteria == null) {
            return summary;
        }
        putIfPresent(summary, "Hardiness Zone", criteria.getHardinessZone());
        putIfPresent(summary, "Sun Exposure", joinLabels(criteria.getSunExposure()));
        putIfPresent(summary, "Soil Type", joinLabels(criteria.getSoilType()));
        putIfPresent(summary, "Soil pH", criteria.getSoilPh());
        putIfPresent(summary, "Moisture", label(criteria.getMoistureNeed()));
        putIfPresent(summary, "Desired Height", centimetres(criteria.getHeightRange()));
        putIfPresent(summary, "Desired Width", centimetres(criteria.getWidthRange()));
        putIfPresent(summary, "Bloom Color", joinLabels(criteria.getBloomColor()));
        putIfPresent(summary, "Bloom Season", joinLabels(criteria.getBloomSeason()));
        putIfPresent(summary, "Maintenance Level", label(criteria.getCareLevel()));
        putIfPresent(summary, "Budget", budget(criteria.getCostTier()));
        putIfPresent(summary, "Pest Resistance", atLeast(criteria.getPestResistance()));
        putIfPresent(summary, "Disease Resistance", atLeast(criteria.getDiseaseResistance()));
        putFlag(summary, "Native Preference", criteria.getNativeSpecies());
        putIfPresent(summary, "Wildlife Friendly", atLeast(criteria.getWildlifeValue()));
        putFlag(summary, "Deer Resistant", criteria.getDeerResistant());
        putFlag(summary, "Pollinator Friendly", criteria.getPollinatorFriendly());
        putFlag(summary, "Container Planting", criteria.getSuitableForContainer());
        putFlag(summary, "Screening", criteria.getSuitableForScreening());
        putFlag(summary, "Hedging", criteria.getSuitableForHedging());
        putFlag(summary, "Groundcover", criteria.getSuitableForGroundcover());
        putFlag(summary, "Slope Planting", criteria.getSlopeTolerant());
        return summary;
    }

    static double round(double score) {
        if (!Double.isFinite(score)) {
            return 0.0;
        }
        return BigDecimal.valueOf(score).setScale(SCORE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private static void putIfPresent(Map<String, String> summary, String label, Object value) {
        if (value != null) {
            summary.put(label, value.toString());
        }
    }

    private static void putFlag(Map<String, String> summary, String label, Boolean flag) {
        if (Boolean.TRUE.equals(flag)) {
            summary.put(label, "Yes");
        }
    }

    private static String label(Labeled value) {
        return value != null ? value.getLabel() : null;
    }

    private static List<String> labels(Collection<? extends Enum<?>> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.stream()
            .sorted(Comparator.comparingInt(Enum::ordinal))
            .map(value -> value instanceof Labeled labeled ? labeled.getLabel() : value.name())
            .toList();
    }

    private static String joinLabels(Collection<? extends Enum<?>> values) {
        List<String> labels = labels(values);
        return labels == null ? null : labels.stream().collect(Collectors.joining(", "));
    }

    private static String centimetres(NumericRange range) {
        return range != null ? range + " cm" : null;
    }

    private static String budget(CostTier tier) {
        return tier != null ? tier.getLabel() + " (" + tier.getPriceBand() + ")" : null;
    }

    private static String atLeast(Double level) {
        return level != null ? String.format(Locale.ROOT, "at least %.2f", level) : null;
    }
}
