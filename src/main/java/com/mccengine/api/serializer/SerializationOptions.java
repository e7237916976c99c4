package com.mccengine.api.serializer;

import lombok.Builder;
import lombok.Value;

/**
 * Controls which parts of a code {@link MccSerializer} emits.
 */
@Value
@Builder(toBuilder = true)
public class SerializationOptions {

    /**
     * Add every per-source description next to the resolved one.
     */
    @Builder.Default
    boolean includeAllDescriptions = false;

    @Builder.Default
    boolean includeCategories = true;

    @Builder.Default
    boolean includeRange = true;

    public static SerializationOptions defaults() {
        return builder().build();
    }
}
