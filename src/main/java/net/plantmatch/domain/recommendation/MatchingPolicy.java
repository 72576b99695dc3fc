package net.plantmatch.domain.recommendation;

/**
 * Tunable constants shared by every attribute matcher and the category scorer.
 *
 * @param matchThreshold minimum attribute score reported as a matched attribute
 * @param concernThreshold attribute scores below this produce a concern warning
 * @param booleanFloor score for a required flag the plant does not have
 * @param rangeContactScore score of two ranges that touch without overlapping
 * @param heightToleranceCm distance at which a disjoint height range loses half its contact score
 * @param widthToleranceCm same as {@code heightToleranceCm}, for spread
 * @param phTolerance same as {@code heightToleranceCm}, for soil pH units
 * @param maxZoneDistance zone gap at which the hardiness score reaches zero
 */
public record MatchingPolicy(double matchThreshold,
                             double concernThreshold,
                             double booleanFloor,
                             double rangeContactScore,
                             double heightToleranceCm,
                             double widthToleranceCm,
                             double phTolerance,
                             int maxZoneDistance) {

    public MatchingPolicy {
        requireUnit("matchThreshold", matchThreshold);
        requireUnit("concernThreshold", concernThreshold);
        requireUnit("booleanFloor", booleanFloor);
        requireUnit("rangeContactScore", rangeContactScore);
        requirePositive("heightToleranceCm", heightToleranceCm);
        requirePositive("widthToleranceCm", widthToleranceCm);
        requirePositive("phTolerance", phTolerance);
        if (maxZoneDistance < 1) {
            throw new IllegalArgumentException("maxZoneDistance must be at least 1");
        }
    }

    public static MatchingPolicy defaults() {
        return new MatchingPolicy(0.8, 0.5, 0.3, 0.5, 50.0, 50.0, 0.5, 3);
    }

    private static void requireUnit(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0,1]: " + value);
        }
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
