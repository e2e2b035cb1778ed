package com.traceharvest.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.Map;

/**
 * Query document plus variables, serialized as the POST body.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class GraphQlRequest {
    String query;
    Map<String, Object> variables;

    public static GraphQlRequest of(String query) {
        return new GraphQlRequest(query, Map.of());
    }

    public static GraphQlRequest of(String query, Map<String, Object> variables) {
        return new GraphQlRequest(query, variables);
    }
}
