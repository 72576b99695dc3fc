package net.plantmatch.domain.recommendation;

import net.plantmatch.model.PlantRecord;

import java.util.Collection;
import java.util.function.Function;
import java.util.function.ToDoubleBiFunction;

/**
 * Binds one {@link PlantAttribute} to its accessors, its matcher and its display form.
 */
final class AttributeRule<C, P> {

    private final PlantAttribute attribute;
    private final Function<SearchCriteria, C> criterionValue;
    private final Function<PlantRecord, P> plantValue;
    private final ToDoubleBiFunction<C, P> matcher;
    private final Function<Object, String> display;

    AttributeRule(PlantAttribute attribute,
                  Function<SearchCriteria, C> criterionValue,
                  Function<PlantRecord, P> plantValue,
                  ToDoubleBiFunction<C, P> matcher,
                  Function<Object, String> display) {
        this.attribute = attribute;
        this.criterionValue = criterionValue;
        this.plantValue = plantValue;
        this.matcher = matcher;
        this.display = display;
    }

    PlantAttribute attribute() {
        return attribute;
    }

    AttributeEvaluation evaluate(SearchCriteria criteria, PlantRecord plant) {
        C requested = criterionValue.apply(criteria);
        P actual = plantValue.apply(plant);
        boolean expressed = isPreference(requested);
        boolean known = isPresent(actual);
        double score = expressed && known ? matcher.applyAsDouble(requested, actual) : AttributeMatcher.NEUTRAL;
        if (Double.isNaN(score)) {
            score = AttributeMatcher.NEUTRAL;
        }
        return new AttributeEvaluation(
            attribute,
            Math.max(0.0, Math.min(1.0, score)),
            expressed,
            known,
            expressed ? display.apply(requested) : null,
            known ? display.apply(actual) : null);
    }

    /**
     * A {@code false} flag in a brief means "don't care", unlike a {@code false} flag on a plant.
     */
    static boolean isPreference(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        return isPresent(value);
    }

    static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Double number) {
            return !number.isNaN();
        }
        return true;
    }
}
