package com.traceharvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A span placed in its trace's hierarchy. The node id is the segment id
 * joined with the span id, which is unique within one trace.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpanNode {
    String nodeId;
    String traceId;
    String segmentId;
    int spanId;
    Integer parentSpanId;
    /** May reference a node outside this trace's span set */
    String parentNodeId;
    int depth;
    List<String> childrenNodeIds;
    String serviceCode;
    String serviceInstance;
    long startTimestampMs;
    long endTimestampMs;
    String endpointName;
    String type;
    String peer;
    String component;
    String layer;
    @JsonProperty("is_error")
    boolean error;
    List<KeyValue> tags;
    List<SpanLog> logs;
    List<SpanRef> refs;

    public static String nodeId(String segmentId, int spanId) {
        return segmentId + ":" + spanId;
    }

    public long getDurationMs() {
        return Math.max(0, endTimestampMs - startTimestampMs);
    }

    public String getStartTimeUtc() {
        return Timestamps.utcIso(startTimestampMs);
    }

    public String getEndTimeUtc() {
        return Timestamps.utcIso(endTimestampMs);
    }

    // Repeated keys keep the last value
    public Map<String, String> getTagsMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (KeyValue tag : tags) {
            map.put(tag.getKey(), tag.getValue());
        }
        return map;
    }
}
