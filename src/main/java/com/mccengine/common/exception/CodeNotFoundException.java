package com.mccengine.common.exception;

/**
 * Thrown when a strict lookup finds no matching MCC.
 */
public class CodeNotFoundException extends MccEngineException {

    public CodeNotFoundException(Object code) {
        super("MCC code not found: " + code);
    }
}
