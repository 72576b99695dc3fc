package net.plantmatch.model;

import net.plantmatch.util.EnumParsingUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Price band per plant, matching the budget ranges offered to clients.
 */
public enum CostTier implements Labeled {
    LOW("Low", "$0-50"),
    MEDIUM("Medium", "$25-150"),
    HIGH("High", "$100-500"),
    PREMIUM("Premium", "$300+");

    private static final Map<String, CostTier> ALIASES = Map.of(
        "budget", LOW,
        "cheap", LOW,
        "moderate", MEDIUM,
        "mid", MEDIUM,
        "expensive", HIGH,
        "luxury", PREMIUM
    );

    private final String label;
    private final String priceBand;

    CostTier(String label, String priceBand) {
        this.label = label;
        this.priceBand = priceBand;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public String getPriceBand() {
        return priceBand;
    }

    public static Optional<CostTier> fromLabel(String raw) {
        return EnumParsingUtils.parseLenient(raw, CostTier.class, ALIASES);
    }
}
