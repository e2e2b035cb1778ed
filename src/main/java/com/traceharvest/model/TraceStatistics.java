package com.traceharvest.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Aggregate view over the traces retained by a run.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TraceStatistics {
    int totalTraces;
    int errorTraces;
    Map<String, Integer> serviceSpanCounts;
    Map<String, Integer> endpointSpanCounts;
    /** Null when no trace reported a positive duration */
    LatencyStats latency;
    Long earliestStartMs;
    Long latestStartMs;
}
