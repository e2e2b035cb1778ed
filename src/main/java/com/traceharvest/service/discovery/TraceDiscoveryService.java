package com.traceharvest.service.discovery;

import com.traceharvest.engine.TraceBackendEngine;
import com.traceharvest.factory.TraceBackendEngineFactory;
import com.traceharvest.model.DiscoveryResult;
import com.traceharvest.model.QueryOrder;
import com.traceharvest.model.QueryStep;
import com.traceharvest.model.TimeWindow;
import com.traceharvest.model.TraceQueryCondition;
import com.traceharvest.model.TraceSummary;
import com.traceharvest.model.TraceSummaryPage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pages through trace summaries over a lookback window.
 * Pagination is sequential: each page depends on whether the previous one was full.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TraceDiscoveryService {

    public static final double MIN_LOOKBACK_HOURS = 0.1;
    // Longer windows are queried in hour buckets
    static final double MINUTE_STEP_MAX_HOURS = 12;

    private final TraceBackendEngineFactory engineFactory;
    private final Clock clock;

    public DiscoveryResult discover(int limit, double lookbackHours, long minDurationMs,
                                    QueryOrder order, int pageSize) {
        boolean bounded = limit > 0;
        int effectivePageSize = Math.max(1, bounded ? Math.min(pageSize, limit) : pageSize);
        TimeWindow window = computeWindow(lookbackHours);
        TraceBackendEngine engine = engineFactory.getEngine();

        log.debug("Discovering traces in [{} .. {}] step={} pageSize={}",
                window.formattedStart(), window.formattedEnd(), window.getStep(), effectivePageSize);

        List<TraceSummary> summaries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        long totalAvailable = 0;

        int pageNum = 1;
        while (!bounded || summaries.size() < limit) {
            TraceQueryCondition condition = TraceQueryCondition.builder()
                    .window(window)
                    .minDurationMs(Math.max(0, minDurationMs))
                    .order(order)
                    .pageNum(pageNum)
                    .pageSize(effectivePageSize)
                    .build();

            TraceSummaryPage page = engine.queryTraceSummaries(condition);
            totalAvailable = page.getTotal();

            if (page.getEntryCount() == 0) {
                break;
            }

            int added = 0;
            for (TraceSummary summary : page.getSummaries()) {
                if (!seen.add(summary.getTraceId())) {
                    continue;
                }
                summaries.add(summary);
                added++;
                if (bounded && summaries.size() >= limit) {
                    break;
                }
            }

            if (page.getEntryCount() < effectivePageSize) {
                break;
            }
            // A full page of already seen ids means the backend is not advancing
            if (added == 0) {
                log.warn("Page {} returned no new trace ids, stopping discovery at {} summaries",
                        pageNum, summaries.size());
                break;
            }
            pageNum++;
        }

        if (bounded && summaries.size() > limit) {
            summaries = new ArrayList<>(summaries.subList(0, limit));
        }
        return new DiscoveryResult(summaries, totalAvailable);
    }

    TimeWindow computeWindow(double lookbackHours) {
        double lookback = Math.max(lookbackHours, MIN_LOOKBACK_HOURS);
        QueryStep step = lookback <= MINUTE_STEP_MAX_HOURS ? QueryStep.MINUTE : QueryStep.HOUR;
        ChronoUnit unit = step == QueryStep.MINUTE ? ChronoUnit.MINUTES : ChronoUnit.HOURS;

        LocalDateTime end = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        LocalDateTime start = end.minus(Duration.ofMillis(Math.round(lookback * 3_600_000d)));

        return new TimeWindow(start.truncatedTo(unit), end.truncatedTo(unit), step);
    }
}
