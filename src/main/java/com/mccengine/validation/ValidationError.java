package com.mccengine.validation;

/**
 * Failures reported by {@link MccValidator}, with their user-facing messages.
 */
public enum ValidationError {
    INVALID_FORMAT("must be a valid 4-digit MCC code"),
    NOT_FOUND("is not a recognized MCC code"),
    DENIED_CATEGORY("is in a denied category"),

    /**
     * The registry could not answer, e.g. because its data failed to load.
     */
    UNVERIFIED("could not be verified against the MCC registry");

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
