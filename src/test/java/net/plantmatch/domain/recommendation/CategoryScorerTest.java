package net.plantmatch.domain.recommendation;

import net.plantmatch.model.MoistureLevel;
import net.plantmatch.model.NumericRange;
import net.plantmatch.model.PlantFixtures;
import net.plantmatch.model.PlantRecord;
import net.plantmatch.model.SunExposure;
import net.plantmatch.model.ZoneRange;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CategoryScorerTest {

    private final CategoryScorer scorer = new CategoryScorer(MatchingPolicy.defaults());

    @Test
    void should_ScoreEveryCategoryNeutral_When_BriefIsEmpty() {
        Map<ScoringCategory, CategoryScore> scores = scorer.scoreAll(SearchCriteria.empty(), PlantFixtures.lavender());

        assertThat(scores).hasSize(ScoringCategory.values().length);
        assertThat(scores.values()).allSatisfy(score -> {
            assertThat(score.score()).isEqualTo(1.0);
            assertThat(score.matchedAttributes()).isEmpty();
            assertThat(score.warnings()).isEmpty();
        });
    }

    @Test
    void should_ListMatchedAttributeWithPlantValue_When_ScoreMeetsThreshold() {
        SearchCriteria criteria = SearchCriteria.builder()
            .hardinessZone(ZoneRange.of(6, 7))
            .sunExposure(Set.of(SunExposure.FULL_SUN))
            .build();

        CategoryScore environmental = scorer.score(criteria, PlantFixtures.lavender(), ScoringCategory.ENVIRONMENTAL);

        assertThat(environmental.score()).isEqualTo(1.0);
        assertThat(environmental.matchedAttributes())
            .containsExactly("Compatible hardiness zone (5-8)", "Suitable sun exposure (Full sun)");
        assertThat(environmental.warnings()).isEmpty();
    }

    @Test
    void should_WarnWithBothValues_When_ScoreFallsBelowConcernThreshold() {
        SearchCriteria criteria = SearchCriteria.builder().moistureNeed(MoistureLevel.WET).build();

        CategoryScore environmental = scorer.score(criteria, PlantFixtures.lavender(), ScoringCategory.ENVIRONMENTAL);

        assertThat(environmental.score()).isCloseTo(0.8, within(1e-9));
        assertThat(environmental.warnings()).containsExactly("Water needs mismatch: plant Dry, requested Wet");
        assertThat(environmental.matchedAttributes()).isEmpty();
    }

    @Test
    void should_WarnAboutIncompleteData_When_PlantLacksRequestedAttribute() {
        SearchCriteria criteria = SearchCriteria.builder().hardinessZone(ZoneRange.of(5, 7)).build();
        PlantRecord unknownZone = PlantFixtures.plant("p1", "Unknown zone");

        CategoryScore environmental = scorer.score(criteria, unknownZone, ScoringCategory.ENVIRONMENTAL);

        assertThat(environmental.score()).isEqualTo(1.0);
        assertThat(environmental.warnings()).containsExactly("Incomplete data for hardinessZone");
        assertThat(environmental.matchedAttributes()).isEmpty();
    }

    @Test
    void should_ApplyBooleanFloor_When_RequiredFlagIsFalse() {
        SearchCriteria criteria = SearchCriteria.builder().deerResistant(true).build();

        CategoryScore special = scorer.score(criteria, PlantFixtures.hosta(), ScoringCategory.SPECIAL);

        assertThat(special.score()).isCloseTo(0.825, within(1e-9));
        assertThat(special.warnings()).containsExactly("Not deer resistant");
    }

    @Test
    void should_UseBarePhrase_When_FlagMatches() {
        SearchCriteria criteria = SearchCriteria.builder().deerResistant(true).pollinatorFriendly(true).build();

        CategoryScore special = scorer.score(criteria, PlantFixtures.lavender(), ScoringCategory.SPECIAL);

        assertThat(special.matchedAttributes()).containsExactly("Deer resistant", "Pollinator friendly");
    }

    @Test
    void should_IgnoreFalseFlag_When_BriefDoesNotCare() {
        SearchCriteria criteria = SearchCriteria.builder().deerResistant(false).build();

        CategoryScore special = scorer.score(criteria, PlantFixtures.hosta(), ScoringCategory.SPECIAL);

        assertThat(special.score()).isEqualTo(1.0);
        assertThat(special.warnings()).isEmpty();
        assertThat(special.matchedAttributes()).isEmpty();
    }

    @Test
    void should_RenderCentimetres_When_HeightMatches() {
        SearchCriteria criteria = SearchCriteria.builder().heightRange(NumericRange.of(30, 60)).build();

        CategoryScore design = scorer.score(criteria, PlantFixtures.lavender(), ScoringCategory.DESIGN);

        assertThat(design.matchedAttributes()).containsExactly("Suitable height (30-60 cm)");
    }

    @Test
    void should_TrimLevelDecimals_When_ResistanceMatches() {
        SearchCriteria criteria = SearchCriteria.builder().pestResistance(0.5).diseaseResistance(0.6).build();

        CategoryScore maintenance = scorer.score(criteria, PlantFixtures.lavender(), ScoringCategory.MAINTENANCE);

        assertThat(maintenance.matchedAttributes())
            .containsExactly("Good pest resistance (0.9)", "Good disease resistance (0.7)");
    }
}
