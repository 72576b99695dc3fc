package net.plantmatch.domain.recommendation;

/**
 * Outcome of matching one attribute of one plant.
 *
 * @param attribute the attribute matched
 * @param score compatibility in {@code [0,1]}
 * @param expressed whether the brief states a preference for it
 * @param known whether the catalog has data for it
 * @param requestedValue display form of the preference, {@code null} when not expressed
 * @param plantValue display form of the plant's value, {@code null} when unknown
 */
public record AttributeEvaluation(PlantAttribute attribute,
                                  double score,
                                  boolean expressed,
                                  boolean known,
                                  String requestedValue,
                                  String plantValue) {

    /**
     * Only attributes with both a preference and data say anything about fit.
     */
    public boolean evaluated() {
        return expressed && known;
    }

    public boolean incomplete() {
        return expressed && !known;
    }
}
