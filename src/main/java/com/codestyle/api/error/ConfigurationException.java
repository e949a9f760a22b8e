package com.codestyle.api.error;

/**
 * Raised when the analyzer set or the options cannot support a run.
 * Fatal for the operation that detected it.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
