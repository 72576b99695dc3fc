package net.plantmatch.service;

import net.plantmatch.model.PlantRecord;

import java.util.List;

/**
 * Immutable snapshot of the plant catalog.
 *
 * @param plants catalog entries in source order
 * @param version content fingerprint; changes whenever the catalog content changes
 */
public record PlantCatalog(List<PlantRecord> plants, String version) {

    public PlantCatalog {
        plants = List.copyOf(plants);
    }

    public int size() {
        return plants.size();
    }
}
