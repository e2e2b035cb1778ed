package com.traceharvest;

import com.traceharvest.engine.TraceBackendEngine;
import com.traceharvest.model.RawSpan;
import com.traceharvest.model.SpanRef;
import com.traceharvest.model.TraceQueryCondition;
import com.traceharvest.model.TraceSummary;
import com.traceharvest.model.TraceSummaryPage;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public final class TraceFixtures {

    private TraceFixtures() {
    }

    public static RawSpan span(String segmentId, int spanId, Integer parentSpanId) {
        return span(segmentId, spanId, parentSpanId, "svc-" + segmentId);
    }

    public static RawSpan span(String segmentId, int spanId, Integer parentSpanId, String serviceCode) {
        return RawSpan.builder()
                .traceId("trace-1")
                .segmentId(segmentId)
                .spanId(spanId)
                .parentSpanId(parentSpanId)
                .serviceCode(serviceCode)
                .serviceInstance(serviceCode + "@host")
                .startTime(1_700_000_000_000L + spanId)
                .endTime(1_700_000_000_010L + spanId)
                .type("Local")
                .build();
    }

    public static RawSpan refSpan(String segmentId, int spanId, String parentSegmentId, int parentSpanId) {
        return span(segmentId, spanId, null).toBuilder()
                .ref(SpanRef.builder()
                        .parentSegmentId(parentSegmentId)
                        .parentSpanId(parentSpanId)
                        .type("CrossProcess")
                        .build())
                .build();
    }

    public static TraceSummary summary(String traceId) {
        return TraceSummary.builder()
                .traceId(traceId)
                .durationMs(25)
                .startTimestampMs(1_700_000_000_000L)
                .endpointName("GET:/api/" + traceId)
                .build();
    }

    public static List<TraceSummary> summaries(String prefix, int count) {
        List<TraceSummary> summaries = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            summaries.add(summary(prefix + i));
        }
        return summaries;
    }

    /**
     * Engine double serving fixed summary pages and per-trace spans. Safe for
     * concurrent queryTrace calls as long as the supplied function is.
     */
    public static class StubEngine implements TraceBackendEngine {
        private final List<List<TraceSummary>> pages;
        private final long total;
        private final Function<String, List<RawSpan>> spans;
        public final List<TraceQueryCondition> conditions = new ArrayList<>();

        public StubEngine(List<List<TraceSummary>> pages, long total, Function<String, List<RawSpan>> spans) {
            this.pages = pages;
            this.total = total;
            this.spans = spans;
        }

        @Override
        public TraceSummaryPage queryTraceSummaries(TraceQueryCondition condition) {
            conditions.add(condition);
            int index = condition.getPageNum() - 1;
            List<TraceSummary> page = index < pages.size() ? pages.get(index) : List.of();
            return new TraceSummaryPage(total, page.size(), page);
        }

        @Override
        public List<RawSpan> queryTrace(String traceId) {
            return spans.apply(traceId);
        }

        @Override
        public boolean testConnection() {
            return true;
        }

        @Override
        public String getEngineType() {
            return "Stub";
        }
    }
}
