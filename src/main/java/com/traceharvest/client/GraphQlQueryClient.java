package com.traceharvest.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.traceharvest.exception.BackendUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * GraphQL over HTTP POST with bounded, linearly increasing backoff.
 * Retries run on the calling thread.
 */
@Slf4j
public class GraphQlQueryClient implements QueryClient {

    private final RestClient restClient;
    private final String endpoint;
    private final int maxAttempts;
    private final Duration backoffStep;
    private final Duration maxBackoff;

    public GraphQlQueryClient(RestClient restClient, String endpoint, int maxAttempts,
                              Duration backoffStep, Duration maxBackoff) {
        this.restClient = restClient;
        this.endpoint = endpoint;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffStep = backoffStep;
        this.maxBackoff = maxBackoff;
    }

    @Override
    public JsonNode query(GraphQlRequest request) {
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return execute(request);
            } catch (RestClientException | QueryErrorException e) {
                lastFailure = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration wait = backoffFor(attempt);
                log.warn("Backend query failed (attempt {}/{}): {}; retrying in {}ms",
                        attempt, maxAttempts, e.getMessage(), wait.toMillis());
                sleep(wait, attempt, e);
            }
        }

        throw new BackendUnavailableException(
                String.format("Backend query failed after %d attempts: %s",
                        maxAttempts, lastFailure.getMessage()),
                maxAttempts, lastFailure);
    }

    Duration backoffFor(int attempt) {
        Duration wait = backoffStep.multipliedBy(attempt);
        return wait.compareTo(maxBackoff) > 0 ? maxBackoff : wait;
    }

    private JsonNode execute(GraphQlRequest request) {
        JsonNode body = restClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class);

        if (body == null) {
            throw new QueryErrorException("Empty response body");
        }

        JsonNode errors = body.get("errors");
        if (errors != null && !errors.isNull() && !(errors.isContainerNode() && errors.isEmpty())) {
            throw new QueryErrorException(errors.toString());
        }

        JsonNode data = body.get("data");
        if (data == null || data.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        return data;
    }

    private void sleep(Duration wait, int attempt, RuntimeException failure) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            BackendUnavailableException interrupted = new BackendUnavailableException(
                    "Interrupted while backing off from a failed backend query", attempt, failure);
            interrupted.addSuppressed(e);
            throw interrupted;
        }
    }
}
