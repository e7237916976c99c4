package com.mccengine.common.exception;

/**
 * Thrown when the data loader fails to produce valid records.
 *
 * Carries the identifier of the source that failed (file path or classpath
 * location) so operators can tell which data file is corrupt.
 */
public class DataLoadException extends MccEngineException {

    private final String source;

    public DataLoadException(String source, Throwable cause) {
        super(buildMessage(source, cause), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    private static String buildMessage(String source, Throwable cause) {
        String message = "Failed to load MCC data from: " + source;
        if (cause != null && cause.getMessage() != null) {
            message += " (" + cause.getMessage() + ")";
        }
        return message;
    }
}
