package net.plantmatch;

import net.plantmatch.service.RecommendationReport;
import net.plantmatch.service.RecommendationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Application context smoke test
 *
 * Features:
 * - Verifies that the Spring context loads with the bundled configuration
 * - Ranks the bundled catalog end to end through the wired beans
 * - Covers the optional {@code .env} loading done before startup
 */
@SpringBootTest
class PlantRecommendationEngineApplicationTests {

    private static final String DOTENV_KEY = "PLANTMATCH_DOTENV_PROBE";

    @Autowired
    private RecommendationService recommendationService;

    @Test
    void contextLoads() {
        assertThat(recommendationService).isNotNull();
    }

    @Test
    void should_RankBundledCatalog_When_ContextIsWired() {
        RecommendationReport report = recommendationService.recommend(Map.of(
            "hardinessZone", "5-7",
            "sunExposure", "full sun",
            "resultLimit", 5));

        assertThat(report.batch().evaluatedCount()).isEqualTo(12);
        assertThat(report.results()).hasSize(5);
        assertThat(report.results().get(0).totalScore())
            .isGreaterThanOrEqualTo(report.results().get(4).totalScore());
        assertThat(report.catalogVersion()).hasSize(64);
    }

    @Test
    void should_CopyDotEnvEntries_When_FileExists(@TempDir Path directory) throws IOException {
        Path envFile = directory.resolve(".env");
        Files.writeString(envFile, DOTENV_KEY + "=from-dotenv\n");
        try {
            PlantRecommendationEngineApplication.loadDotEnvFile(envFile);

            assertThat(System.getProperty(DOTENV_KEY)).isEqualTo("from-dotenv");
        } finally {
            System.clearProperty(DOTENV_KEY);
        }
    }

    @Test
    void should_DoNothing_When_DotEnvFileIsMissing(@TempDir Path directory) {
        PlantRecommendationEngineApplication.loadDotEnvFile(directory.resolve(".env"));

        assertThat(System.getProperty(DOTENV_KEY)).isNull();
    }
}
