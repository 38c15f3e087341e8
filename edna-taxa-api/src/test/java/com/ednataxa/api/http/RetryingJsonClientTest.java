package com.ednataxa.api.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingJsonClientTest {

    private static final URI URI_UNDER_TEST = URI.create("https://api.example.org/species/match?name=Homo");

    private final List<Duration> sleeps = new ArrayList<>();
    private final List<Integer> retriedAttempts = new ArrayList<>();

    private RetryingJsonClient client(ScriptedTransport transport, BackoffPolicy policy) {
        return new RetryingJsonClient(transport, new ObjectMapper(), policy, Duration.ofSeconds(1),
                (uri, attempt, wait) -> {
                    retriedAttempts.add(attempt);
                    sleeps.add(wait);
                });
    }

    private static BackoffPolicy policy(int maxAttempts) {
        return new BackoffPolicy(maxAttempts, Duration.ofMillis(100), Duration.ofSeconds(2), 2.0, 0.0, Duration.ofMinutes(1));
    }

    @Test
    void throttledTwiceThenSuccessWaitsTwiceAndStops() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(429, "")
                .respond(503, "")
                .respond(200, "{\"usageKey\": 2436436}");
        RetryingJsonClient client = client(transport, policy(5));

        Optional<JsonNode> body = client.getJson(URI_UNDER_TEST, client.newBudget());

        assertThat(body).isPresent();
        assertThat(body.get().path("usageKey").asLong()).isEqualTo(2436436L);
        assertThat(transport.calls()).hasSize(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(retriedAttempts).containsExactly(1, 2);
    }

    @Test
    void retryAfterHintRaisesTheDelay() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(new TransportResponse(429, "", "1"))
                .respond(200, "[]");
        RetryingJsonClient client = client(transport, policy(3));

        client.getJson(URI_UNDER_TEST, client.newBudget());

        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void timeoutIsRetried() {
        ScriptedTransport transport = new ScriptedTransport()
                .fail(new HttpTimeoutException("request timed out"))
                .respond(200, "{\"ok\": true}");
        RetryingJsonClient client = client(transport, policy(3));

        assertThat(client.getJson(URI_UNDER_TEST, client.newBudget())).isPresent();
        assertThat(transport.calls()).hasSize(2);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void exhaustionAfterMaxAttempts() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(503, "")
                .respond(503, "")
                .respond(503, "");
        RetryingJsonClient client = client(transport, policy(3));

        assertThatThrownBy(() -> client.getJson(URI_UNDER_TEST, client.newBudget()))
                .isInstanceOf(RetriesExhaustedException.class)
                .hasMessageContaining("HTTP 503")
                .hasMessageContaining("after 3 attempt(s)");
        assertThat(transport.calls()).hasSize(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void clientErrorIsNotRetried() {
        ScriptedTransport transport = new ScriptedTransport().respond(400, "bad request");
        RetryingJsonClient client = client(transport, policy(5));

        assertThatThrownBy(() -> client.getJson(URI_UNDER_TEST, client.newBudget()))
                .isInstanceOf(PermanentApiException.class)
                .hasMessageContaining("HTTP 400");
        assertThat(transport.calls()).hasSize(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void noContentAndNotFoundMeanNoResult() {
        ScriptedTransport transport = new ScriptedTransport()
                .respond(204, "")
                .respond(404, "");
        RetryingJsonClient client = client(transport, policy(5));

        assertThat(client.getJson(URI_UNDER_TEST, client.newBudget())).isEmpty();
        assertThat(client.getJson(URI_UNDER_TEST, client.newBudget())).isEmpty();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void interruptedTransportIsNotRetried() {
        ScriptedTransport transport = new ScriptedTransport().fail(new InterruptedException("shutting down"));
        RetryingJsonClient client = client(transport, policy(5));

        try {
            assertThatThrownBy(() -> client.getJson(URI_UNDER_TEST, client.newBudget()))
                    .isInstanceOf(RetriesExhaustedException.class)
                    .hasMessageContaining("Interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(transport.calls()).hasSize(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void malformedJsonIsPermanent() {
        ScriptedTransport transport = new ScriptedTransport().respond(200, "<html>oops</html>");
        RetryingJsonClient client = client(transport, policy(5));

        assertThatThrownBy(() -> client.getJson(URI_UNDER_TEST, client.newBudget()))
                .isInstanceOf(PermanentApiException.class);
    }

    @Test
    void spentBudgetStopsRetryingEarly() {
        BackoffPolicy tightBudget = new BackoffPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(10), 2.0, 0.0,
                Duration.ofSeconds(1));
        ScriptedTransport transport = new ScriptedTransport().respond(503, "");
        RetryingJsonClient client = client(transport, tightBudget);

        assertThatThrownBy(() -> client.getJson(URI_UNDER_TEST, client.newBudget()))
                .isInstanceOf(RetriesExhaustedException.class)
                .hasMessageContaining("Retry budget exhausted");
        assertThat(transport.calls()).hasSize(1);
        assertThat(sleeps).isEmpty();
    }
}
