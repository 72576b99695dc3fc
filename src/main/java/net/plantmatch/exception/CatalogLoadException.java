package net.plantmatch.exception;

/**
 * The plant catalog resource could not be read or is not a JSON array.
 * RETRYABLE: Yes, once the resource is fixed and the catalog reloaded.
 */
public class CatalogLoadException extends RuntimeException {

    private final String location;

    public CatalogLoadException(String location, String message, Throwable cause) {
        super("Failed to load plant catalog from " + location + ": " + message, cause);
        this.location = location;
    }

    public CatalogLoadException(String location, String message) {
        this(location, message, null);
    }

    public String location() {
        return location;
    }
}
