package net.plantmatch.model;

import net.plantmatch.util.EnumParsingUtils;

import java.util.Map;
import java.util.Optional;

public enum BloomColor implements Labeled {
    WHITE("White"),
    YELLOW("Yellow"),
    ORANGE("Orange"),
    RED("Red"),
    PINK("Pink"),
    PURPLE("Purple"),
    BLUE("Blue"),
    GREEN("Green");

    private static final Map<String, BloomColor> ALIASES = Map.of(
        "cream", WHITE,
        "gold", YELLOW,
        "crimson", RED,
        "magenta", PINK,
        "lavender", PURPLE,
        "violet", PURPLE,
        "lilac", PURPLE
    );

    private final String label;

    BloomColor(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static Optional<BloomColor> fromLabel(String raw) {
        return EnumParsingUtils.parseLenient(raw, BloomColor.class, ALIASES);
    }
}
