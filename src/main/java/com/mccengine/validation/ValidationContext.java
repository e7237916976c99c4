package com.mccengine.validation;

import com.mccengine.codes.Code;
import com.mccengine.collection.MccCollection;

import java.util.Optional;

/**
 * State shared by the rules of one validation: the raw value and, once
 * looked up, the code it resolves to.
 */
class ValidationContext {

    private final Object value;
    private final MccCollection collection;
    private Optional<Code> resolved;

    ValidationContext(Object value, MccCollection collection) {
        this.value = value;
        this.collection = collection;
    }

    Object getValue() {
        return value;
    }

    MccCollection getCollection() {
        return collection;
    }

    Optional<Code> resolvedCode() {
        if (resolved == null) {
            resolved = collection.find(value);
        }
        return resolved;
    }
}
