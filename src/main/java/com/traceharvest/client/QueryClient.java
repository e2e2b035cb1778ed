package com.traceharvest.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Issues structured queries against the tracing backend.
 */
public interface QueryClient {

    /**
     * Sends the request and returns its {@code data} payload, never null.
     *
     * @throws com.traceharvest.exception.BackendUnavailableException when
     *         every attempt failed
     */
    JsonNode query(GraphQlRequest request);
}
