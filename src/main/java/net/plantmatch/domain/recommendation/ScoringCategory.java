package net.plantmatch.domain.recommendation;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The five scoring categories a plant is judged on, in reporting order.
 */
public enum ScoringCategory {
    ENVIRONMENTAL("environmental"),
    DESIGN("design"),
    MAINTENANCE("maintenance"),
    SPECIAL("special"),
    CONTEXT("context");

    private final String key;

    ScoringCategory(String key) {
        this.key = key;
    }

    /**
     * Stable lower-case name used in request weights and response score maps.
     */
    public String key() {
        return key;
    }

    /**
     * Attributes aggregated into this category, in declaration order.
     */
    public List<PlantAttribute> attributes() {
        return Arrays.stream(PlantAttribute.values())
            .filter(attribute -> attribute.category() == this)
            .toList();
    }

    public static Optional<ScoringCategory> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(category -> category.key.equals(candidate))
            .findFirst();
    }
}
