package com.traceharvest.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CollectionMetadata {
    String generatedAt;
    double lookbackHours;
    int requestedTraceLimit;
    long minTraceDurationMs;
    QueryOrder queryOrder;
    int concurrency;
    int discoveredTraces;
    int collectedTraces;
    int failedTraces;
    int emptyTraces;
    long availableTotal;
    List<String> servicesDiscovered;
    String experimentName;
    String backendBaseUrl;
    String backendGraphqlEndpoint;
    TraceStatistics statistics;
}
