package com.ednataxa.api.http;

import java.util.Optional;

public record TransportResponse(int statusCode, String body, String retryAfter) {

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, body, null);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isNoContent() {
        return statusCode == 204 || statusCode == 404;
    }

    public boolean isTransientFailure() {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public Optional<String> retryAfterHeader() {
        return Optional.ofNullable(retryAfter).filter(v -> !v.isBlank());
    }
}
