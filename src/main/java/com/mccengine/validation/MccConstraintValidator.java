package com.mccengine.validation;

import com.mccengine.collection.MccCollection;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Adapts {@link MccValidator} to jakarta.validation. Each validator message
 * becomes one constraint violation.
 *
 * Instances are created by Spring's constraint validator factory, which injects
 * the application's collection.
 */
public class MccConstraintValidator implements ConstraintValidator<ValidMcc, Object> {

    private final MccCollection collection;
    private MccValidator validator;

    public MccConstraintValidator(MccCollection collection) {
        this.collection = collection;
    }

    @Override
    public void initialize(ValidMcc annotation) {
        ValidationOptions options = ValidationOptions.builder()
            .strict(annotation.strict())
            .denyCategories(toSet(annotation.denyCategories()))
            .allowCategories(annotation.allowCategories().length == 0 ? null : toSet(annotation.allowCategories()))
            .build();
        this.validator = new MccValidator(collection, options);
    }

    private static Set<String> toSet(String[] categoryIds) {
        return new LinkedHashSet<>(Arrays.asList(categoryIds));
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        var errors = validator.validate(value);
        if (errors.isEmpty()) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        errors.forEach(message -> context.buildConstraintViolationWithTemplate(message).addConstraintViolation());
        return false;
    }
}
