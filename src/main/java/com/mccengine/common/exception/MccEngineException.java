package com.mccengine.common.exception;

/**
 * Base exception for all MCC engine exceptions.
 */
public class MccEngineException extends RuntimeException {

    public MccEngineException(String message) {
        super(message);
    }

    public MccEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
