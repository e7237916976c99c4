package com.mccengine.validation;

import com.mccengine.collection.MccCollection;
import com.mccengine.common.exception.MccEngineException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Validates candidate MCC values for data-entry pipelines.
 *
 * Rules are evaluated in order and the first failure ends validation, so at
 * most one error is reported:
 * <ol>
 *   <li>format: one to four digits</li>
 *   <li>existence in the collection (strict mode only)</li>
 *   <li>deny-list categories (strict mode only)</li>
 *   <li>allow-list categories, when configured (strict mode only)</li>
 * </ol>
 * A null value is always valid. The validator never throws; if the collection
 * cannot answer, the value is reported as {@link ValidationError#UNVERIFIED}.
 */
@Slf4j
public class MccValidator {

    private final MccCollection collection;
    private final ValidationOptions options;
    private final List<ValidationRule> rules;

    public MccValidator(MccCollection collection) {
        this(collection, ValidationOptions.defaults());
    }

    public MccValidator(MccCollection collection, ValidationOptions options) {
        this.collection = collection;
        this.options = options;
        this.rules = buildRules(options);
    }

    private static List<ValidationRule> buildRules(ValidationOptions options) {
        List<ValidationRule> rules = new ArrayList<>();
        rules.add(new FormatRule());

        if (options.isStrict()) {
            rules.add(new ExistenceRule());
            if (options.getDenyCategories() != null && !options.getDenyCategories().isEmpty()) {
                rules.add(new DeniedCategoryRule(options.getDenyCategories()));
            }
            if (options.hasAllowList()) {
                rules.add(new AllowedCategoryRule(options.getAllowCategories()));
            }
        }
        return Collections.unmodifiableList(rules);
    }

    public ValidationOptions getOptions() {
        return options;
    }

    /**
     * @return error messages, empty when the value is valid
     */
    public List<String> validate(Object value) {
        return errorOf(value)
            .map(error -> List.of(error.getMessage()))
            .orElse(List.of());
    }

    /**
     * The first failing rule's error, if any.
     */
    public Optional<ValidationError> errorOf(Object value) {
        if (value == null) {
            return Optional.empty();
        }

        ValidationContext context = new ValidationContext(value, collection);
        try {
            for (ValidationRule rule : rules) {
                Optional<ValidationError> error = rule.evaluate(context);
                if (error.isPresent()) {
                    log.debug("Rule {} rejected MCC '{}': {}", rule.getRuleName(), value, error.get());
                    return error;
                }
            }
        } catch (MccEngineException e) {
            log.warn("Could not validate MCC '{}' against the registry", value, e);
            return Optional.of(ValidationError.UNVERIFIED);
        }
        return Optional.empty();
    }

    public boolean valid(Object value) {
        return errorOf(value).isEmpty();
    }
}
