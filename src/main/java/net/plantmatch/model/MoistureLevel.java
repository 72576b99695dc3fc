package net.plantmatch.model;

import net.plantmatch.util.EnumParsingUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Soil moisture a plant needs, ordered from driest to wettest.
 */
public enum MoistureLevel implements Labeled {
    DRY("Dry"),
    MOIST("Moist"),
    WET("Wet");

    private static final Map<String, MoistureLevel> ALIASES = Map.of(
        "low", DRY,
        "drought", DRY,
        "drought_tolerant", DRY,
        "medium", MOIST,
        "moderate", MOIST,
        "average", MOIST,
        "high", WET,
        "boggy", WET
    );

    private final String label;

    MoistureLevel(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static Optional<MoistureLevel> fromLabel(String raw) {
        return EnumParsingUtils.parseLenient(raw, MoistureLevel.class, ALIASES);
    }
}
