package com.ednataxa.api.http;

public class PermanentApiException extends RuntimeException {

    public PermanentApiException(String message) {
        super(message);
    }

    public PermanentApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
