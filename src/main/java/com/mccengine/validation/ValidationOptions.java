package com.mccengine.validation;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Options for {@link MccValidator}.
 */
@Value
@Builder(toBuilder = true)
public class ValidationOptions {

    /**
     * Require the code to exist in the loaded dataset, and apply category rules.
     */
    @Builder.Default
    boolean strict = true;

    /**
     * Category ids whose codes are rejected. Checked before the allow-list.
     */
    @Builder.Default
    Set<String> denyCategories = Set.of();

    /**
     * When set, only codes in at least one of these categories pass. Null means no allow-list.
     */
    Set<String> allowCategories;

    public static ValidationOptions defaults() {
        return builder().build();
    }

    public boolean hasAllowList() {
        return allowCategories != null;
    }
}
