package com.mccengine.validation;

import java.util.Optional;

class ExistenceRule implements ValidationRule {

    @Override
    public Optional<ValidationError> evaluate(ValidationContext context) {
        if (context.resolvedCode().isPresent()) {
            return Optional.empty();
        }
        return Optional.of(ValidationError.NOT_FOUND);
    }

    @Override
    public String getRuleName() {
        return "Existence";
    }
}
