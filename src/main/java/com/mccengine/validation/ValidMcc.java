package com.mccengine.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Bean-validation constraint for MCC fields. Null values are valid; combine with
 * {@code @NotNull} to require a value.
 *
 * <pre>
 * &#64;ValidMcc(denyCategories = {"gambling", "adult"})
 * private String merchantCategoryCode;
 * </pre>
 */
@Documented
@Constraint(validatedBy = MccConstraintValidator.class)
@Target({ElementType.FIELD, ElementType.METHOD, ElementType.PARAMETER, ElementType.ANNOTATION_TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidMcc {

    String message() default "must be a valid 4-digit MCC code";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};

    boolean strict() default true;

    String[] denyCategories() default {};

    /**
     * Allowed category ids. Empty means no allow-list.
     */
    String[] allowCategories() default {};
}
