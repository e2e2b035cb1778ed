package com.traceharvest.engine.skywalking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Response shapes of the SkyWalking GraphQL query protocol.
 */
final class SkyWalkingResponses {

    private SkyWalkingResponses() {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BasicTraces {
        private long total;
        private List<BasicTrace> traces = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BasicTrace {
        private List<String> traceIds = new ArrayList<>();
        private long duration;
        private long start;
        @JsonProperty("isError")
        private boolean error;
        private List<String> endpointNames = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TraceDetail {
        private List<Span> spans = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Span {
        private String traceId;
        private String segmentId;
        private Integer spanId;
        private Integer parentSpanId;
        private String serviceCode;
        private String serviceInstanceName;
        private long startTime;
        private long endTime;
        private String endpointName;
        private String type;
        private String peer;
        private String component;
        @JsonProperty("isError")
        private boolean error;
        private String layer;
        private List<KeyValue> tags = new ArrayList<>();
        private List<LogEntity> logs = new ArrayList<>();
        private List<Ref> refs = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class KeyValue {
        private String key;
        private String value;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LogEntity {
        private long time;
        private List<KeyValue> data = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Ref {
        private String traceId;
        private String parentSegmentId;
        private Integer parentSpanId;
        private String type;
    }
}
