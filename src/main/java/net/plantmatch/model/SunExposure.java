package net.plantmatch.model;

import net.plantmatch.util.EnumParsingUtils;

import java.util.Map;
import java.util.Optional;

public enum SunExposure implements Labeled {
    FULL_SUN("Full sun"),
    PARTIAL_SUN("Partial sun"),
    SHADE("Shade");

    private static final Map<String, SunExposure> ALIASES = Map.of(
        "sun", FULL_SUN,
        "partial_shade", PARTIAL_SUN,
        "part_shade", PARTIAL_SUN,
        "part_sun", PARTIAL_SUN,
        "partial", PARTIAL_SUN,
        "full_shade", SHADE,
        "deep_shade", SHADE
    );

    private final String label;

    SunExposure(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static Optional<SunExposure> fromLabel(String raw) {
        return EnumParsingUtils.parseLenient(raw, SunExposure.class, ALIASES);
    }
}
