package net.plantmatch.model;

import net.plantmatch.util.EnumParsingUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Ongoing maintenance effort, ordered from least to most demanding.
 */
public enum CareLevel implements Labeled {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private static final Map<String, CareLevel> ALIASES = Map.of(
        "easy", LOW,
        "minimal", LOW,
        "moderate", MEDIUM,
        "average", MEDIUM,
        "intensive", HIGH,
        "regular", HIGH
    );

    private final String label;

    CareLevel(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static Optional<CareLevel> fromLabel(String raw) {
        return EnumParsingUtils.parseLenient(raw, CareLevel.class, ALIASES);
    }
}
