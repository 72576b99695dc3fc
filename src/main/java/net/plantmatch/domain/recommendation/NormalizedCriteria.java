package net.plantmatch.domain.recommendation;

import java.util.List;

/**
 * A typed brief plus the warnings raised while reading the raw request.
 */
public record NormalizedCriteria(SearchCriteria criteria, List<String> warnings) {

    public NormalizedCriteria {
        warnings = List.copyOf(warnings);
    }
}
