package com.traceharvest.service.statistics;

import com.traceharvest.model.LatencyStats;
import com.traceharvest.model.SpanNode;
import com.traceharvest.model.TraceRecord;
import com.traceharvest.model.TraceStatistics;
import com.traceharvest.model.TraceSummary;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates call counts, error counts and latency over retained traces.
 */
@Service
public class TraceStatisticsService {

    static final String UNKNOWN = "unknown";

    public TraceStatistics summarize(List<TraceRecord> traces) {
        Map<String, Integer> serviceCounts = new TreeMap<>();
        Map<String, Integer> endpointCounts = new TreeMap<>();
        LongSummaryStatistics latency = new LongSummaryStatistics();
        int errorTraces = 0;
        Long earliest = null;
        Long latest = null;

        for (TraceRecord trace : traces) {
            TraceSummary summary = trace.getSummary();
            if (summary.isError()) {
                errorTraces++;
            }
            if (summary.getDurationMs() > 0) {
                latency.accept(summary.getDurationMs());
            }

            long start = summary.getStartTimestampMs();
            if (start > 0) {
                earliest = earliest == null ? start : Math.min(earliest, start);
                latest = latest == null ? start : Math.max(latest, start);
            }

            for (SpanNode span : trace.getSpans()) {
                serviceCounts.merge(orUnknown(span.getServiceCode()), 1, Integer::sum);
                endpointCounts.merge(orUnknown(span.getEndpointName()), 1, Integer::sum);
            }
        }

        return TraceStatistics.builder()
                .totalTraces(traces.size())
                .errorTraces(errorTraces)
                .serviceSpanCounts(serviceCounts)
                .endpointSpanCounts(endpointCounts)
                .latency(latency.getCount() == 0 ? null : new LatencyStats(
                        latency.getMin(), latency.getMax(), latency.getAverage(), (int) latency.getCount()))
                .earliestStartMs(earliest)
                .latestStartMs(latest)
                .build();
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? UNKNOWN : value;
    }
}
