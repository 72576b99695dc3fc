package net.plantmatch.domain.recommendation;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CategoryWeightsTest {

    private static double normalizedSum(CategoryWeights weights) {
        return Arrays.stream(ScoringCategory.values()).mapToDouble(weights::normalizedWeightOf).sum();
    }

    @Test
    void should_MatchDefaultShares_When_WeightsAlreadySumToOne() {
        assertThat(CategoryWeights.DEFAULT.normalizedWeightOf(ScoringCategory.ENVIRONMENTAL)).isCloseTo(0.30, within(1e-12));
        assertThat(CategoryWeights.DEFAULT.normalizedWeightOf(ScoringCategory.CONTEXT)).isCloseTo(0.10, within(1e-12));
        assertThat(normalizedSum(CategoryWeights.DEFAULT)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void should_SumToOne_When_WeightsWouldOverflowADirectSum() {
        CategoryWeights huge = new CategoryWeights(Double.MAX_VALUE, Double.MAX_VALUE, 1e308, 0, 1);

        assertThat(normalizedSum(huge)).isCloseTo(1.0, within(1e-12));
        assertThat(huge.normalizedWeightOf(ScoringCategory.SPECIAL)).isZero();
    }

    @Test
    void should_ReturnZero_When_EveryWeightIsZero() {
        CategoryWeights none = new CategoryWeights(0, 0, 0, 0, 0);

        assertThat(normalizedSum(none)).isZero();
    }

    @Test
    void should_ReplaceOnlyOneCategory_When_WithIsCalled() {
        CategoryWeights changed = CategoryWeights.DEFAULT.with(ScoringCategory.DESIGN, 0.0);

        assertThat(changed.design()).isZero();
        assertThat(changed.environmental()).isEqualTo(0.30);
        assertThat(changed.context()).isEqualTo(0.10);
    }
}
