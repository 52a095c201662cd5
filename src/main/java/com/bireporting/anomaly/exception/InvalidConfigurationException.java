package com.bireporting.anomaly.exception;

/**
 * A configuration update was rejected. Nothing from the rejected update has been applied.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final String field;

    public InvalidConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidConfigurationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
