package com.ednataxa.api.http;

public class RetriesExhaustedException extends RuntimeException {

    public RetriesExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
