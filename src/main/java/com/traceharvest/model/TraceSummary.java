package com.traceharvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Index entry for one trace as returned by discovery.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TraceSummary {
    String traceId;
    long durationMs;
    long startTimestampMs;
    @JsonProperty("is_error")
    boolean error;
    @Singular
    List<String> endpointNames;

    public String getStartTimeUtc() {
        return Timestamps.utcIso(startTimestampMs);
    }
}
