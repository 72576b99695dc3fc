package net.plantmatch.service;

/**
 * Read-only source of the plant catalog.
 */
public interface PlantCatalogProvider {

    /**
     * The catalog currently in effect, loading it on first use.
     *
     * @throws net.plantmatch.exception.CatalogLoadException if the catalog cannot be read
     */
    PlantCatalog currentCatalog();

    /**
     * Re-reads the catalog source and returns the fresh snapshot.
     */
    PlantCatalog reload();
}
