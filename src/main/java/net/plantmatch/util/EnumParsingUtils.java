package net.plantmatch.util;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared helper for safely parsing user-provided strings into enum values.
 */
public final class EnumParsingUtils {

    private EnumParsingUtils() {
        // Utility class
    }

    /**
     * Parses free-form labels such as {@code "Full Sun"}, {@code "full-sun"} or {@code "FULL_SUN"}.
     *
     * <p>The raw value is lower-cased and whitespace/hyphen runs collapse to underscores before
     * the alias table is consulted; the constant name itself is always accepted.</p>
     *
     * @param raw user supplied label
     * @param enumType target enum
     * @param aliases extra spellings keyed by their normalized token
     * @return the matching constant, or empty when nothing matches
     */
    public static <E extends Enum<E>> Optional<E> parseLenient(String raw,
                                                               Class<E> enumType,
                                                               Map<String, E> aliases) {
        if (raw == null) {
            return Optional.empty();
        }
        String token = normalizeToken(raw);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        E aliased = aliases.get(token);
        if (aliased != null) {
            return Optional.of(aliased);
        }
        try {
            return Optional.of(Enum.valueOf(enumType, token.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    static String normalizeToken(String raw) {
        return raw.trim()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[\\s\\-]+", "_");
    }
}
