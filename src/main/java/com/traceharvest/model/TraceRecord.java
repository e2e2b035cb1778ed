package com.traceharvest.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TraceRecord {
    TraceSummary summary;
    int spanCount;
    List<String> servicesInvolved;
    List<String> rootSpanNodeIds;
    List<SpanNode> spans;
}
