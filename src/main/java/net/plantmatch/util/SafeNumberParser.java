package net.plantmatch.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Null-safe parsing of numbers and booleans arriving as strings, mostly from query parameters.
 *
 * Parse failures are logged at debug and reported as {@code null},
 * never as exceptions.
 */
@Slf4j
public final class SafeNumberParser {

    private SafeNumberParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Safely parses a string to a finite Double, returning null on failure.
     * {@code "NaN"} and {@code "Infinity"} are treated as failures.
     */
    public static Double parseDoubleOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (!Double.isFinite(parsed)) {
                log.debug("Ignoring non-finite number '{}'", value);
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.debug("Failed to parse double '{}': {}", value, e.getMessage());
            return null;
        }
    }

    /**
     * Parses the usual spellings of a boolean flag, returning null when the value is none of them.
     */
    public static Boolean parseBooleanOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "1", "yes", "y", "on" -> Boolean.TRUE;
            case "false", "0", "no", "n", "off" -> Boolean.FALSE;
            default -> {
                log.debug("Failed to parse boolean '{}'", value);
                yield null;
            }
        };
    }
}
