package com.ednataxa.api.http;

import java.net.URI;
import java.time.Duration;

@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (uri, attempt, wait) -> { };

    void onRetry(URI uri, int attempt, Duration wait);
}
