/**
 * One garden-design brief, already normalized into typed values.
 *
 * Features:
 * - Mirrors the attribute shape of {@link net.plantmatch.model.PlantRecord}
 * - {@code null}, an empty set or {@code false} means "no preference"
 * - Value equality over every field, so it can key the result cache
 * - Resistance and wildlife values are desired minimums on a 0..1 scale
 */
package net.plantmatch.domain.recommendation;

import lombok.Builder;
import lombok.Value;
import net.plantmatch.model.BloomColor;
import net.plantmatch.model.BloomSeason;
import net.plantmatch.model.CareLevel;
import net.plantmatch.model.CostTier;
import net.plantmatch.model.MoistureLevel;
import net.plantmatch.model.NumericRange;
import net.plantmatch.model.SoilType;
import net.plantmatch.model.SunExposure;
import net.plantmatch.model.ZoneRange;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class SearchCriteria {

    public static final int DEFAULT_RESULT_LIMIT = 10;

    ZoneRange hardinessZone;
    Set<SunExposure> sunExposure;
    Set<SoilType> soilType;
    NumericRange soilPh;
    MoistureLevel moistureNeed;

    NumericRange heightRange;
    NumericRange widthRange;
    Set<BloomColor> bloomColor;
    Set<BloomSeason> bloomSeason;

    CareLevel careLevel;
    CostTier costTier;
    Double pestResistance;
    Double diseaseResistance;

    Boolean nativeSpecies;
    Double wildlifeValue;
    Boolean deerResistant;
    Boolean pollinatorFriendly;

    Boolean suitableForContainer;
    Boolean suitableForScreening;
    Boolean suitableForHedging;
    Boolean suitableForGroundcover;
    Boolean slopeTolerant;

    @Builder.Default
    CategoryWeights categoryWeights = CategoryWeights.DEFAULT;

    @Builder.Default
    int resultLimit = DEFAULT_RESULT_LIMIT;

    @Builder.Default
    double minScore = 0.0;

    /**
     * A brief with no preferences at all: every plant scores neutral.
     */
    public static SearchCriteria empty() {
        return SearchCriteria.builder().build();
    }
}
