package com.traceharvest.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Unprocessed span record as returned by the backend for one trace.
 * segmentId and spanId are nullable here; spans missing either are
 * dropped when the hierarchy is built.
 */
@Value
@Builder(toBuilder = true)
public class RawSpan {
    String traceId;
    String segmentId;
    Integer spanId;
    /** Local parent within the same segment, null when absent */
    Integer parentSpanId;
    @Singular
    List<SpanRef> refs;
    String serviceCode;
    String serviceInstance;
    long startTime;
    long endTime;
    String endpointName;
    String type;
    String peer;
    String component;
    String layer;
    boolean error;
    @Singular
    List<KeyValue> tags;
    @Singular
    List<SpanLog> logs;
}
