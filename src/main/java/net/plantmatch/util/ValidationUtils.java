package net.plantmatch.util;

import java.util.Collection;
import java.util.Map;

/**
 * Null/empty checks shared by the normalizer and the scorers.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean isNullOrEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    public static boolean isNullOrEmpty(Map<?, ?> map) {
        return map == null || map.isEmpty();
    }

    /**
     * Whether a finite number lies in the closed unit interval.
     */
    public static boolean isUnitInterval(double value) {
        return Double.isFinite(value) && value >= 0.0 && value <= 1.0;
    }

    public static double clampToUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
