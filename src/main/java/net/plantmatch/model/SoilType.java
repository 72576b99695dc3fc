package net.plantmatch.model;

import net.plantmatch.util.EnumParsingUtils;

import java.util.Map;
import java.util.Optional;

public enum SoilType implements Labeled {
    SANDY("Sandy"),
    LOAMY("Loamy"),
    CLAY("Clay"),
    SILTY("Silty"),
    CHALKY("Chalky"),
    PEATY("Peaty");

    private static final Map<String, SoilType> ALIASES = Map.of(
        "sand", SANDY,
        "loam", LOAMY,
        "clay_loam", CLAY,
        "silt", SILTY,
        "chalk", CHALKY,
        "limestone", CHALKY,
        "peat", PEATY
    );

    private final String label;

    SoilType(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public static Optional<SoilType> fromLabel(String raw) {
        return EnumParsingUtils.parseLenient(raw, SoilType.class, ALIASES);
    }
}
