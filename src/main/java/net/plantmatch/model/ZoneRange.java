package net.plantmatch.model;

/**
 * Inclusive USDA hardiness zone span a plant tolerates, or a site brief asks for.
 *
 * @param minZone coldest zone, 1..13
 * @param maxZone warmest zone, 1..13, never below {@code minZone}
 */
public record ZoneRange(int minZone, int maxZone) {

    public static final int LOWEST_ZONE = 1;
    public static final int HIGHEST_ZONE = 13;

    public ZoneRange {
        if (minZone < LOWEST_ZONE || maxZone > HIGHEST_ZONE) {
            throw new IllegalArgumentException(
                "Hardiness zones must fall within " + LOWEST_ZONE + ".." + HIGHEST_ZONE + ": " + minZone + "-" + maxZone);
        }
        if (minZone > maxZone) {
            throw new IllegalArgumentException("Zone min " + minZone + " exceeds max " + maxZone);
        }
    }

    public static ZoneRange of(int minZone, int maxZone) {
        return new ZoneRange(minZone, maxZone);
    }

    /**
     * Number of zone steps separating two spans; zero when any zone is shared.
     */
    public int distanceTo(ZoneRange other) {
        if (other.minZone > maxZone) {
            return other.minZone - maxZone;
        }
        if (minZone > other.maxZone) {
            return minZone - other.maxZone;
        }
        return 0;
    }

    @Override
    public String toString() {
        return minZone == maxZone ? String.valueOf(minZone) : minZone + "-" + maxZone;
    }
}
