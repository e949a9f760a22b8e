package com.codestyle.api.error;

/**
 * Thrown by fixers that cannot produce edits for a document.
 */
public class CodeFixException extends Exception {

    public CodeFixException(String message) {
        super(message);
    }

    public CodeFixException(String message, Throwable cause) {
        super(message, cause);
    }
}
