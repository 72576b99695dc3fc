package net.plantmatch.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * API view of a catalog plant. Enumerated values are rendered as their labels and
 * ranges as {@code "min-max"}; attributes the catalog lacks are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlantDto(String id,
                       String name,
                       String commonName,
                       String hardinessZone,
                       List<String> sunExposure,
                       List<String> soilType,
                       String soilPh,
                       String moistureNeed,
                       String heightRangeCm,
                       String widthRangeCm,
                       List<String> bloomColor,
                       List<String> bloomSeason,
                       String careLevel,
                       String costTier,
                       Double pestResistance,
                       Double diseaseResistance,
                       @JsonProperty("isNative") Boolean nativeSpecies,
                       Double wildlifeValue,
                       Boolean deerResistant,
                       Boolean pollinatorFriendly,
                       Boolean suitableForContainer,
                       Boolean suitableForScreening,
                       Boolean suitableForHedging,
                       Boolean suitableForGroundcover,
                       Boolean slopeTolerant) {
}
