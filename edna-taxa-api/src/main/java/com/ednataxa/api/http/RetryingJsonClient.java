package com.ednataxa.api.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GETs JSON from a backbone API, retrying throttling, server errors and timeouts.
 * Client errors other than 404/408/429 are raised immediately as {@link PermanentApiException}.
 */
public class RetryingJsonClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingJsonClient.class);

    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final BackoffPolicy backoffPolicy;
    private final Duration requestTimeout;
    private final RetryListener listener;

    public RetryingJsonClient(HttpTransport transport,
                              ObjectMapper objectMapper,
                              BackoffPolicy backoffPolicy,
                              Duration requestTimeout,
                              RetryListener listener) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.backoffPolicy = backoffPolicy;
        this.requestTimeout = requestTimeout;
        this.listener = listener;
    }

    public BackoffPolicy.RetryBudget newBudget() {
        return backoffPolicy.newBudget();
    }

    /**
     * @return the parsed body, or empty when the API answered with no content
     */
    public Optional<JsonNode> getJson(URI uri, BackoffPolicy.RetryBudget budget) {
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of("taxonomy-http", retryConfig(uri, budget));
        try {
            return retry.executeCallable(() -> {
                attempts.incrementAndGet();
                return fetch(uri);
            });
        } catch (IOException e) {
            // covers HttpTimeoutException, connection resets and transient statuses
            throw new RetriesExhaustedException("Giving up on " + uri + " after " + attempts.get()
                    + " attempt(s): " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetriesExhaustedException("Interrupted while calling " + uri, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new PermanentApiException("Unexpected failure calling " + uri + ": " + e.getMessage(), e);
        }
    }

    private RetryConfig retryConfig(URI uri, BackoffPolicy.RetryBudget budget) {
        IntervalBiFunction<Optional<JsonNode>> interval = (attempt, outcome) -> {
            Throwable failure = outcome.isLeft() ? outcome.getLeft() : null;
            Optional<String> retryAfter = failure instanceof TransientResponseException
                    ? ((TransientResponseException) failure).retryAfter()
                    : Optional.empty();
            Duration delay = backoffPolicy.delayAfter(attempt, retryAfter);
            String reason = failure == null ? "unknown" : failure.getMessage();
            if (!budget.tryConsume(delay)) {
                log.warn("Retry budget exhausted for {} after {} attempt(s); last failure: {}", uri, attempt, reason);
                throw new RetriesExhaustedException("Retry budget exhausted for " + uri + " after " + attempt
                        + " attempt(s): " + reason, failure);
            }
            log.debug("Transient failure ({}) calling {}; retrying in {} ms (attempt {}/{})",
                    reason, uri, delay.toMillis(), attempt, backoffPolicy.maxAttempts());
            listener.onRetry(uri, attempt, delay);
            return delay.toMillis();
        };
        return RetryConfig.<Optional<JsonNode>>custom()
                .maxAttempts(backoffPolicy.maxAttempts())
                .intervalBiFunction(interval)
                .retryExceptions(IOException.class)
                .build();
    }

    private Optional<JsonNode> fetch(URI uri) throws IOException, InterruptedException {
        TransportResponse response = transport.get(uri, requestTimeout);
        if (response.isNoContent()) {
            return Optional.empty();
        }
        if (response.isSuccess()) {
            return parse(uri, response.body());
        }
        if (response.isTransientFailure()) {
            throw new TransientResponseException(response);
        }
        throw new PermanentApiException("HTTP " + response.statusCode() + " for " + uri);
    }

    private Optional<JsonNode> parse(URI uri, String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isNull() || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (IOException e) {
            throw new PermanentApiException("Malformed JSON from " + uri + ": " + e.getMessage(), e);
        }
    }

    /** Throttling or server-side failure; retried like an I/O error. */
    static final class TransientResponseException extends IOException {

        private final transient TransportResponse response;

        TransientResponseException(TransportResponse response) {
            super("HTTP " + response.statusCode());
            this.response = response;
        }

        Optional<String> retryAfter() {
            return response.retryAfterHeader();
        }
    }
}
