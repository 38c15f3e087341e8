package com.ednataxa.api.reference;

/**
 * The local reference dataset is enabled but cannot be used. Raised during startup only.
 */
public class LocalReferenceException extends IllegalStateException {

    public LocalReferenceException(String message) {
        super(message);
    }

    public LocalReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
