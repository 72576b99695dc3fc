/**
 * Catalog entry describing one plant's growing conditions, appearance and uses.
 *
 * Features:
 * - Immutable; the recommendation core only ever reads it
 * - Every attribute is optional, {@code null} (or an empty set) means the catalog has no data
 * - Ranges enforce {@code min <= max} on construction
 * - Binds directly from catalog JSON through the Lombok builder
 */
package net.plantmatch.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.springframework.util.StringUtils;

import java.util.Set;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlantRecord {

    String id;
    String name;
    String commonName;

    // Environmental
    ZoneRange hardinessZone;
    Set<SunExposure> sunExposure;
    Set<SoilType> soilType;
    NumericRange soilPh;
    MoistureLevel moistureNeed;

    // Design, dimensions in centimetres
    NumericRange heightRange;
    NumericRange widthRange;
    Set<BloomColor> bloomColor;
    Set<BloomSeason> bloomSeason;

    // Maintenance, resistances on a 0..1 scale
    CareLevel careLevel;
    CostTier costTier;
    Double pestResistance;
    Double diseaseResistance;

    // Special
    @JsonProperty("isNative")
    @JsonAlias("nativeSpecies")
    Boolean nativeSpecies;
    Double wildlifeValue;
    Boolean deerResistant;
    Boolean pollinatorFriendly;

    // Project context
    Boolean suitableForContainer;
    Boolean suitableForScreening;
    Boolean suitableForHedging;
    Boolean suitableForGroundcover;
    Boolean slopeTolerant;

    /**
     * Whether the record carries the identity fields needed to rank and report it.
     */
    public boolean hasIdentity() {
        return StringUtils.hasText(id) && StringUtils.hasText(name);
    }
}
