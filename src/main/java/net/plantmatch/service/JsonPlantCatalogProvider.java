package net.plantmatch.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import net.plantmatch.config.RecommendationProperties;
import net.plantmatch.exception.CatalogLoadException;
import net.plantmatch.model.PlantRecord;
import net.plantmatch.util.HashUtils;
import net.plantmatch.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the plant catalog from a JSON array resource, {@code classpath:catalog/plants.json} by default.
 *
 * <p>Rows that fail to bind (a reversed range, an unknown enum constant, a wrong type) are
 * skipped and logged; the rest of the catalog still loads. The version is the SHA-256 of
 * the resource bytes, so an unchanged file keeps its cached results across reloads.</p>
 */
@Component
public class JsonPlantCatalogProvider implements PlantCatalogProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonPlantCatalogProvider.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String location;

    private volatile PlantCatalog catalog;

    public JsonPlantCatalogProvider(ObjectMapper objectMapper,
                                    ResourceLoader resourceLoader,
                                    RecommendationProperties properties) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.location = properties.getCatalogLocation();
    }

    @Override
    public PlantCatalog currentCatalog() {
        PlantCatalog loaded = catalog;
        if (loaded != null) {
            return loaded;
        }
        synchronized (this) {
            if (catalog == null) {
                catalog = load();
            }
            return catalog;
        }
    }

    @Override
    public synchronized PlantCatalog reload() {
        catalog = load();
        return catalog;
    }

    private PlantCatalog load() {
        byte[] content = readResource();
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (IOException ex) {
            throw new CatalogLoadException(location, "invalid JSON", ex);
        }
        if (root == null || !root.isArray()) {
            throw new CatalogLoadException(location, "expected a JSON array of plants");
        }

        ObjectReader reader = objectMapper.readerFor(PlantRecord.class)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        List<PlantRecord> plants = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode row : root) {
            try {
                plants.add(reader.readValue(row));
            } catch (IOException | IllegalArgumentException ex) {
                LoggingUtils.warn(log, ex, "Skipping catalog row {} in {}: {}", index, location, ex.getMessage());
            }
            index++;
        }

        PlantCatalog loaded = new PlantCatalog(plants, fingerprint(content));
        log.info("Loaded plant catalog from {} ({} of {} rows, version {})",
            location, loaded.size(), root.size(), loaded.version());
        return loaded;
    }

    private byte[] readResource() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogLoadException(location, "resource not found");
        }
        try (InputStream in = resource.getInputStream()) {
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new CatalogLoadException(location, "unreadable resource", ex);
        }
    }

    private String fingerprint(byte[] content) {
        try {
            return HashUtils.sha256Hex(content);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
