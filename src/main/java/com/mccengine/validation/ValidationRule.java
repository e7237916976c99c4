package com.mccengine.validation;

import java.util.Optional;

/**
 * A single check applied by {@link MccValidator}.
 *
 * Rules run in order and the first one that reports an error ends the validation.
 */
interface ValidationRule {

    /**
     * @return the error this rule reports, or empty when the value passes
     */
    Optional<ValidationError> evaluate(ValidationContext context);

    String getRuleName();
}
