package net.plantmatch.service;

import java.util.List;
import java.util.Map;

/**
 * Selectable values for every criterion, for building a request form.
 *
 * @param catalogZoneSpan coldest and warmest zone present in the catalog, empty when no plant has zone data
 * @param defaultWeights category key to default weight
 */
public record CriteriaOptions(List<Integer> hardinessZones,
                              List<Integer> catalogZoneSpan,
                              List<String> sunExposures,
                              List<String> soilTypes,
                              List<String> moistureLevels,
                              List<String> bloomColors,
                              List<String> bloomSeasons,
                              List<String> maintenanceLevels,
                              List<String> budgetRanges,
                              List<String> resistanceLevels,
                              Map<String, Double> defaultWeights,
                              int defaultResultLimit,
                              int maxResultLimit) {
}
