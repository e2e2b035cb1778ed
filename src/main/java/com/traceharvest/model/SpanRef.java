package com.traceharvest.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Cross-segment pointer to the span's parent in another segment.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpanRef {
    String parentTraceId;
    String parentSegmentId;
    Integer parentSpanId;
    String type;
}
