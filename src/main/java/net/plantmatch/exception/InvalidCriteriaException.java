package net.plantmatch.exception;

import java.util.List;

/**
 * A brief the engine refuses to score: a negative or non-finite category weight,
 * or a result limit below one. Raised before any plant is scored.
 */
public class InvalidCriteriaException extends RuntimeException {

    private final List<String> violations;

    public InvalidCriteriaException(List<String> violations) {
        super("Invalid recommendation criteria: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidCriteriaException(String violation) {
        this(List.of(violation));
    }

    /**
     * Every problem found, in the order checked.
     */
    public List<String> violations() {
        return violations;
    }
}
