package com.mccengine.validation;

import com.mccengine.codes.Code;

import java.util.Optional;
import java.util.Set;

/**
 * Rejects codes outside every allowed category. An empty allow-list rejects everything.
 */
class AllowedCategoryRule implements ValidationRule {

    private final Set<String> allowedCategories;

    AllowedCategoryRule(Set<String> allowedCategories) {
        this.allowedCategories = allowedCategories;
    }

    @Override
    public Optional<ValidationError> evaluate(ValidationContext context) {
        Optional<Code> code = context.resolvedCode();
        if (code.isEmpty()) {
            return Optional.empty();
        }

        boolean allowed = allowedCategories.stream()
            .anyMatch(categoryId -> context.getCollection().isInCategory(categoryId, code.get()));
        return allowed ? Optional.empty() : Optional.of(ValidationError.DENIED_CATEGORY);
    }

    @Override
    public String getRuleName() {
        return "AllowedCategory";
    }
}
