package net.plantmatch.util;

import net.plantmatch.model.CareLevel;
import net.plantmatch.model.CostTier;
import net.plantmatch.model.SoilType;
import net.plantmatch.model.SunExposure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EnumParsingUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {"Full Sun", "full-sun", "FULL_SUN", "  full sun ", "sun"})
    void should_ParseFullSun_When_LabelIsSpelledLoosely(String raw) {
        assertThat(SunExposure.fromLabel(raw)).contains(SunExposure.FULL_SUN);
    }

    @Test
    void should_ResolveAliases_When_LegacyNamesUsed() {
        assertThat(SunExposure.fromLabel("Partial Shade")).contains(SunExposure.PARTIAL_SUN);
        assertThat(SoilType.fromLabel("loam")).contains(SoilType.LOAMY);
        assertThat(CareLevel.fromLabel("easy")).contains(CareLevel.LOW);
        assertThat(CostTier.fromLabel("luxury")).contains(CostTier.PREMIUM);
    }

    @Test
    void should_ReturnEmpty_When_ValueUnknownOrBlank() {
        assertThat(SunExposure.fromLabel("moonlight")).isEmpty();
        assertThat(SunExposure.fromLabel("   ")).isEmpty();
        assertThat(SunExposure.fromLabel(null)).isEmpty();
    }

    @Test
    void should_AcceptConstantName_When_NoAliasMatches() {
        assertThat(EnumParsingUtils.parseLenient("very-high", CareLevel.class, Map.of())).isEmpty();
        assertThat(EnumParsingUtils.parseLenient("high", CareLevel.class, Map.of())).contains(CareLevel.HIGH);
    }

    @Test
    void should_PreferAlias_When_TokenIsAliased() {
        Map<String, CareLevel> aliases = Map.of("fussy", CareLevel.HIGH);

        assertThat(EnumParsingUtils.parseLenient(" Fussy ", CareLevel.class, aliases)).contains(CareLevel.HIGH);
    }

    @Test
    void should_CollapseSeparators_When_Normalizing() {
        assertThat(EnumParsingUtils.normalizeToken("  Partial -  Shade ")).isEqualTo("partial_shade");
    }
}
