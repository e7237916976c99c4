package com.mccengine.common.exception;

/**
 * Thrown when a range's start code is greater than its end code.
 */
public class InvalidRangeException extends MccEngineException {

    public InvalidRangeException(String startCode, String endCode) {
        super(String.format("Start code (%s) cannot be greater than end code (%s)", startCode, endCode));
    }
}
