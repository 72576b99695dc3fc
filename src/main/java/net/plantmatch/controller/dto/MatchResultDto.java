package net.plantmatch.controller.dto;

import java.util.List;
import java.util.Map;

/**
 * One ranked plant; scores are rounded to three decimals.
 */
public record MatchResultDto(PlantDto plant,
                             double totalScore,
                             Map<String, Double> categoryScores,
                             List<String> matchedAttributes,
                             List<String> warnings) {
}
