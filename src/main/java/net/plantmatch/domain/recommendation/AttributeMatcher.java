package net.plantmatch.domain.recommendation;

import net.plantmatch.model.NumericRange;
import net.plantmatch.model.ZoneRange;
import net.plantmatch.util.ValidationUtils;

import java.util.Set;

/**
 * Compatibility functions between one criterion value and one plant value.
 *
 * <p>Every function is total: it never throws, always returns a value in {@code [0,1]},
 * and returns {@code 1.0} when either side is absent. Absence of a preference or of
 * catalog data is never a penalty.</p>
 */
public final class AttributeMatcher {

    static final double NEUTRAL = 1.0;

    private AttributeMatcher() {
    }

    /**
     * Full credit when the plant offers any of the requested values, none otherwise.
     * A brief listing several values names acceptable alternatives, not a combination.
     */
    public static <T> double categorical(Set<T> criterion, Set<T> plant) {
        if (ValidationUtils.isNullOrEmpty(criterion) || ValidationUtils.isNullOrEmpty(plant)) {
            return NEUTRAL;
        }
        return criterion.stream().anyMatch(plant::contains) ? NEUTRAL : 0.0;
    }

    /**
     * Scores overlapping ranges between {@code contactScore} and 1 by the share of the
     * requested range the plant covers; disjoint ranges decay from {@code contactScore}
     * with distance, halving at one {@code toleranceUnit}.
     *
     * <p>Any overlap therefore scores at least {@code contactScore} (0.5 by default), the
     * same floor a plain {@code max(0.5, overlapRatio)} gives, while still rising with the
     * covered share. The floor also makes touching ranges continuous with disjoint ones.</p>
     */
    public static double rangeOverlap(NumericRange criterion,
                                      NumericRange plant,
                                      double contactScore,
                                      double toleranceUnit) {
        if (criterion == null || plant == null) {
            return NEUTRAL;
        }
        double contact = ValidationUtils.clampToUnit(contactScore);
        if (criterion.intersects(plant)) {
            double ratio = overlapRatio(criterion, plant);
            return bounded(contact + (1.0 - contact) * ratio);
        }
        double unit = toleranceUnit > 0.0 && Double.isFinite(toleranceUnit) ? toleranceUnit : 1.0;
        double distance = criterion.distanceTo(plant);
        return bounded(contact / (1.0 + distance / unit));
    }

    /**
     * Rank distance within an enum's declaration order, scaled so adjacent extremes score zero.
     */
    public static <E extends Enum<E>> double ordinal(E criterion, E plant) {
        if (criterion == null || plant == null) {
            return NEUTRAL;
        }
        int maxDistance = criterion.getDeclaringClass().getEnumConstants().length - 1;
        if (maxDistance <= 0) {
            return NEUTRAL;
        }
        int distance = Math.abs(criterion.ordinal() - plant.ordinal());
        return bounded(1.0 - (double) distance / maxDistance);
    }

    /**
     * Ordinal distance between zone spans, zero gap whenever they share a zone.
     */
    public static double zoneRange(ZoneRange criterion, ZoneRange plant, int maxZoneDistance) {
        if (criterion == null || plant == null) {
            return NEUTRAL;
        }
        if (maxZoneDistance <= 0) {
            return criterion.distanceTo(plant) == 0 ? NEUTRAL : 0.0;
        }
        return bounded(1.0 - (double) criterion.distanceTo(plant) / maxZoneDistance);
    }

    /**
     * One-sided level check: meeting or exceeding the requested minimum scores 1.
     */
    public static double minimumLevel(Double criterion, Double plant) {
        if (criterion == null || plant == null || criterion.isNaN() || plant.isNaN()) {
            return NEUTRAL;
        }
        double shortfall = Math.max(0.0, ValidationUtils.clampToUnit(criterion) - ValidationUtils.clampToUnit(plant));
        return bounded(1.0 - shortfall);
    }

    /**
     * Soft boolean constraint: a required flag the plant lacks scores {@code floor}.
     */
    public static double booleanPreference(Boolean criterion, Boolean plant, double floor) {
        if (!Boolean.TRUE.equals(criterion) || plant == null) {
            return NEUTRAL;
        }
        return plant ? NEUTRAL : ValidationUtils.clampToUnit(floor);
    }

    private static double overlapRatio(NumericRange criterion, NumericRange plant) {
        // A point on either side that lies inside the other range is a full fit.
        if (criterion.width() == 0.0 || plant.width() == 0.0) {
            return 1.0;
        }
        return ValidationUtils.clampToUnit(criterion.overlapWith(plant) / criterion.width());
    }

    private static double bounded(double score) {
        if (Double.isNaN(score)) {
            return NEUTRAL;
        }
        return ValidationUtils.clampToUnit(score);
    }
}
