package net.plantmatch.model;

import net.plantmatch.util.EnumParsingUtils;

import java.util.Map;
import java.util.Optional;

public enum BloomSeason implements Labeled {
    SPRING("Spring"),
    SUMMER("Summer"),
    FALL("Fall"),
    WINTER("Winter");

    private static final Map<String, BloomSeason> ALIASES = Map.of(
        "autumn", FALL,
        "early_spring", SPRING,
        "late_spring", SPRING,
        "midsummer", SUMMER,
        "late_summer", SUMMER
    );

    private final String label;

    BloomSeason(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static Optional<BloomSeason> fromLabel(String raw) {
        return EnumParsingUtils.parseLenient(raw, BloomSeason.class, ALIASES);
    }
}
