package com.mccengine.common.exception;

/**
 * Thrown when resolved configuration or query parameters fail validation.
 */
public class ConfigurationException extends MccEngineException {

    public ConfigurationException(String message) {
        super(message);
    }
}
