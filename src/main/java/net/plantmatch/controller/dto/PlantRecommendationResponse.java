package net.plantmatch.controller.dto;

import java.util.List;
import java.util.Map;

/**
 * Response body of the plant recommendation endpoints.
 *
 * @param recommendations ranked plants, best first
 * @param warnings request and catalog problems that did not stop the ranking
 * @param criteriaSummary human-readable label of every preference that was applied
 * @param totalPlantsEvaluated catalog entries scored
 * @param recommendationsCount size of {@code recommendations}
 * @param catalogVersion fingerprint of the catalog the ranking used
 */
public record PlantRecommendationResponse(List<MatchResultDto> recommendations,
                                          List<String> warnings,
                                          Map<String, String> criteriaSummary,
                                          int totalPlantsEvaluated,
                                          int recommendationsCount,
                                          String catalogVersion) {
}
