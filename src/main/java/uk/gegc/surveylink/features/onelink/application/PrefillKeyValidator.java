package uk.gegc.surveylink.features.onelink.application;

import java.util.Set;

@FunctionalInterface
public interface PrefillKeyValidator {

    /**
     * @return the subset of {@code keys} the survey does not declare as prefillable; empty when all are valid
     */
    Set<String> invalidKeys(Long surveyId, Set<String> keys);
}
