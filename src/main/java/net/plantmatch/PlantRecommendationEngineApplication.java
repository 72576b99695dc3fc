/**
 * Main application class for the plant recommendation service
 *
 * Features:
 * - Loads an optional {@code .env} file into system properties before Spring starts
 * - Entry point for Spring Boot application
 */
package net.plantmatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

@SpringBootApplication
public class PlantRecommendationEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(PlantRecommendationEngineApplication.class);

    public static void main(String[] args) {
        loadDotEnvFile(Path.of(".env"));
        SpringApplication.run(PlantRecommendationEngineApplication.class, args);
    }

    /**
     * Copies entries of {@code envFile} into system properties unless the environment already defines them.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            int applied = 0;
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null && System.getProperty(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                    applied++;
                }
            }
            log.info("Loaded {} properties from {}", applied, envFile);
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
