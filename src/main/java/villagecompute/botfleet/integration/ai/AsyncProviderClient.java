/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.botfleet.exceptions.ProviderException;
import villagecompute.botfleet.exceptions.RateLimitException;

/**
 * Shared HTTP plumbing for the task-based media providers (fal.ai, Runway, Kling, MiniMax).
 *
 * <p>
 * Subclasses submit a task with {@link #postJson}, then call {@link #poll} with a status function. Non-2xx responses
 * on submission become {@link ProviderException} ({@link RateLimitException} for HTTP 429); non-2xx responses while
 * polling are treated as transient and polled again.
 */
public abstract class AsyncProviderClient {

    private static final Logger LOG = Logger.getLogger(AsyncProviderClient.class);

    protected static final Duration HTTP_TIMEOUT = Duration.ofSeconds(30);

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "ai.provider.poll-interval",
            defaultValue = "5s")
    Duration pollInterval;

    @ConfigProperty(
            name = "ai.provider.max-wait",
            defaultValue = "5m")
    Duration maxWait;

    private final HttpClient httpClient;

    protected AsyncProviderClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
    }

    /**
     * Outcome of one poll: keep waiting, finished with a value, or finished without one.
     */
    protected static final class PollResult<T> {

        private static final PollResult<?> PENDING = new PollResult<>(false, null);

        private final boolean done;
        private final T value;

        private PollResult(boolean done, T value) {
            this.done = done;
            this.value = value;
        }

        @SuppressWarnings("unchecked")
        static <T> PollResult<T> pending() {
            return (PollResult<T>) PENDING;
        }

        static <T> PollResult<T> done(T value) {
            return new PollResult<>(true, value);
        }
    }

    protected JsonNode postJson(String url, Map<String, String> headers, Object body) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(HTTP_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            headers.forEach(builder::header);
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            return readSuccess(url, response);
        } catch (IOException e) {
            throw new ProviderException(providerId() + " request failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(providerId() + " request interrupted: " + url, e);
        }
    }

    /**
     * GETs a JSON document. Returns empty on non-2xx so pollers can retry.
     */
    protected Optional<JsonNode> getJson(String url, Map<String, String> headers) {
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url)).timeout(HTTP_TIMEOUT).GET();
            headers.forEach(builder::header);
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                LOG.debugf("%s GET %s returned status %d", providerId(), url, response.statusCode());
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            LOG.debugf("%s GET %s failed: %s", providerId(), url, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(providerId() + " poll interrupted: " + url, e);
        }
    }

    /**
     * Polls {@code check} every {@link #pollInterval} until it reports done or {@link #maxWait} elapses.
     *
     * @return the finished value, or null on timeout
     */
    protected <T> T poll(String taskId, Function<Integer, PollResult<T>> check) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        int attempt = 0;
        while (System.nanoTime() < deadline) {
            sleep(pollInterval);
            PollResult<T> result = check.apply(++attempt);
            if (result.done) {
                return result.value;
            }
        }
        LOG.warnf("%s task %s timed out after %s", providerId(), taskId, maxWait);
        return null;
    }

    private JsonNode readSuccess(String url, HttpResponse<String> response) throws IOException {
        int status = response.statusCode();
        if (status == 429) {
            throw new RateLimitException(providerId() + " rate limit exceeded: " + response.body());
        }
        if (status / 100 != 2) {
            throw new ProviderException(providerId() + " returned status " + status + " for " + url + ": "
                    + truncate(response.body()));
        }
        return objectMapper.readTree(response.body());
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(providerId() + " polling interrupted", e);
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }

    public abstract String providerId();
}
