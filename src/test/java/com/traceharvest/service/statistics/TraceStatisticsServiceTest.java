package com.traceharvest.service.statistics;

import com.traceharvest.model.SpanNode;
import com.traceharvest.model.TraceRecord;
import com.traceharvest.model.TraceStatistics;
import com.traceharvest.model.TraceSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TraceStatisticsServiceTest {

    TraceStatisticsService service = new TraceStatisticsService();

    static TraceRecord record(String traceId, long duration, long start, boolean error, SpanNode... spans) {
        return TraceRecord.builder()
                .summary(TraceSummary.builder()
                        .traceId(traceId)
                        .durationMs(duration)
                        .startTimestampMs(start)
                        .error(error)
                        .build())
                .spanCount(spans.length)
                .spans(List.of(spans))
                .build();
    }

    static SpanNode node(String service, String endpoint) {
        return SpanNode.builder().serviceCode(service).endpointName(endpoint).build();
    }

    @Test
    void summarize_countsAndLatency() {
        TraceStatistics stats = service.summarize(List.of(
                record("t1", 10, 2_000, false, node("gateway", "GET:/a"), node("orders", null)),
                record("t2", 30, 1_000, true, node("gateway", "GET:/a")),
                record("t3", 0, 3_000, false, node(null, "GET:/b"))));

        assertThat(stats.getTotalTraces()).isEqualTo(3);
        assertThat(stats.getErrorTraces()).isEqualTo(1);
        assertThat(stats.getServiceSpanCounts())
                .containsEntry("gateway", 2).containsEntry("orders", 1).containsEntry("unknown", 1);
        assertThat(stats.getEndpointSpanCounts())
                .containsEntry("GET:/a", 2).containsEntry("GET:/b", 1).containsEntry("unknown", 1);
        assertThat(stats.getLatency().getMinMs()).isEqualTo(10);
        assertThat(stats.getLatency().getMaxMs()).isEqualTo(30);
        assertThat(stats.getLatency().getAvgMs()).isEqualTo(20.0);
        assertThat(stats.getLatency().getCount()).isEqualTo(2);
        assertThat(stats.getEarliestStartMs()).isEqualTo(1_000L);
        assertThat(stats.getLatestStartMs()).isEqualTo(3_000L);
    }

    @Test
    void summarize_noTraces() {
        TraceStatistics stats = service.summarize(List.of());

        assertThat(stats.getTotalTraces()).isZero();
        assertThat(stats.getLatency()).isNull();
        assertThat(stats.getEarliestStartMs()).isNull();
        assertThat(stats.getServiceSpanCounts()).isEmpty();
    }
}
