package com.mccengine.validation;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Accepts one to four digits. Shorter values are valid here because they
 * zero-pad to a full code.
 */
class FormatRule implements ValidationRule {

    private static final Pattern CANDIDATE = Pattern.compile("\\d{1,4}");

    @Override
    public Optional<ValidationError> evaluate(ValidationContext context) {
        String candidate = context.getValue().toString().trim();
        if (CANDIDATE.matcher(candidate).matches()) {
            return Optional.empty();
        }
        return Optional.of(ValidationError.INVALID_FORMAT);
    }

    @Override
    public String getRuleName() {
        return "Format";
    }
}
