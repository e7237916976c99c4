package com.mccengine.common.exception;

/**
 * Thrown when a value cannot be normalized to a 4-digit MCC.
 */
public class InvalidCodeFormatException extends MccEngineException {

    private final transient Object value;

    public InvalidCodeFormatException(Object value) {
        super(String.format("Invalid MCC code format: '%s'. Expected a 4-digit string or integer.", value));
        this.value = value;
    }

    public Object getValue() {
        return value;
    }
}
