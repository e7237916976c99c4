package com.mccengine.validation;

import com.mccengine.codes.Code;

import java.util.Optional;
import java.util.Set;

/**
 * Rejects codes that belong to any of the denied categories.
 */
class DeniedCategoryRule implements ValidationRule {

    private final Set<String> deniedCategories;

    DeniedCategoryRule(Set<String> deniedCategories) {
        this.deniedCategories = deniedCategories;
    }

    @Override
    public Optional<ValidationError> evaluate(ValidationContext context) {
        Optional<Code> code = context.resolvedCode();
        if (code.isEmpty()) {
            return Optional.empty();
        }

        boolean denied = deniedCategories.stream()
            .anyMatch(categoryId -> context.getCollection().isInCategory(categoryId, code.get()));
        return denied ? Optional.of(ValidationError.DENIED_CATEGORY) : Optional.empty();
    }

    @Override
    public String getRuleName() {
        return "DeniedCategory";
    }
}
