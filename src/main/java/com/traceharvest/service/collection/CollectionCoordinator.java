package com.traceharvest.service.collection;

import com.traceharvest.exception.AllFetchesFailedException;
import com.traceharvest.exception.NoSummariesException;
import com.traceharvest.exception.TraceHarvestException;
import com.traceharvest.model.CollectionArtifact;
import com.traceharvest.model.CollectionRequest;
import com.traceharvest.model.DiscoveryResult;
import com.traceharvest.model.RawSpan;
import com.traceharvest.model.RunTally;
import com.traceharvest.model.SpanHierarchy;
import com.traceharvest.model.SpanNode;
import com.traceharvest.model.TraceRecord;
import com.traceharvest.model.TraceSummary;
import com.traceharvest.service.artifact.ArtifactAssembler;
import com.traceharvest.service.discovery.TraceDiscoveryService;
import com.traceharvest.service.fetch.SpanFetchService;
import com.traceharvest.service.hierarchy.HierarchyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs one collection: discovery, concurrent span fetches, hierarchy
 * reconstruction and artifact assembly.
 *
 * <p>Workers only return values. All merging happens on the calling thread as
 * futures complete, so no shared collection is mutated concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionCoordinator {

    private static final Comparator<SpanNode> BY_START_TIME =
            Comparator.comparingLong(SpanNode::getStartTimestampMs).thenComparing(SpanNode::getNodeId);

    private final TraceDiscoveryService discoveryService;
    private final SpanFetchService spanFetchService;
    private final HierarchyBuilder hierarchyBuilder;
    private final ArtifactAssembler artifactAssembler;

    public CollectionArtifact collect(CollectionRequest requested) {
        CollectionRequest request = effective(requested);
        int workers = request.getConcurrency();
        log.info("Collecting traces: target={} hours={} min_duration={}ms workers={}",
                request.getSize() <= 0 ? "all available" : String.valueOf(request.getSize()),
                request.getLookbackHours(), request.getMinDurationMs(), workers);

        DiscoveryResult discovery = discoveryService.discover(
                request.getSize(),
                request.getLookbackHours(),
                request.getMinDurationMs(),
                request.getQueryOrder(),
                request.getPageSize());

        List<TraceSummary> summaries = discovery.getSummaries();
        if (summaries.isEmpty()) {
            throw new NoSummariesException("No trace summaries were returned by the tracing backend");
        }
        log.info("Trace summaries obtained: {} (of total {})", summaries.size(), discovery.getTotalAvailable());

        List<TraceRecord> retained = new ArrayList<>();
        TreeSet<String> services = new TreeSet<>();
        int failed = 0;
        int empty = 0;
        Throwable firstFailure = null;

        ExecutorService executor = Executors.newFixedThreadPool(workers, fetchThreadFactory());
        try {
            CompletionService<TraceOutcome> completion = new ExecutorCompletionService<>(executor);
            Map<Future<TraceOutcome>, TraceSummary> submitted = new HashMap<>();
            for (TraceSummary summary : summaries) {
                submitted.put(completion.submit(() -> fetchAndBuild(summary)), summary);
            }

            for (int i = 0; i < summaries.size(); i++) {
                Future<TraceOutcome> future = completion.take();
                TraceSummary summary = submitted.get(future);
                try {
                    TraceOutcome outcome = future.get();
                    if (outcome.isEmpty()) {
                        empty++;
                        continue;
                    }
                    retained.add(outcome.getRecord());
                    services.addAll(outcome.getRecord().getServicesInvolved());
                } catch (ExecutionException e) {
                    failed++;
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (firstFailure == null) {
                        firstFailure = cause;
                    }
                    log.error("Failed to fetch trace {}: {}", summary.getTraceId(), cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TraceHarvestException("Interrupted while waiting for trace fetches", e);
        } finally {
            executor.shutdownNow();
        }

        if (retained.isEmpty()) {
            throw new AllFetchesFailedException(summaries.size(), failed, empty, firstFailure);
        }

        log.info("Traces retained: {} of {} discovered ({} failed, {} empty)",
                retained.size(), summaries.size(), failed, empty);

        RunTally tally = RunTally.builder()
                .discovered(summaries.size())
                .availableTotal(discovery.getTotalAvailable())
                .failed(failed)
                .empty(empty)
                .servicesDiscovered(new ArrayList<>(services))
                .build();
        return artifactAssembler.assemble(retained, request, tally);
    }

    /**
     * Fetches and rebuilds one trace on its own, outside any run. Nodes come
     * back in the same order as a collected record's spans.
     */
    public SpanHierarchy rebuildTrace(String traceId) {
        SpanHierarchy hierarchy = hierarchyBuilder.build(spanFetchService.fetch(traceId));
        return new SpanHierarchy(sorted(hierarchy), hierarchy.getRootNodeIds());
    }

    // The values the run actually uses, which are also the ones recorded in the metadata
    static CollectionRequest effective(CollectionRequest request) {
        return request.toBuilder()
                .lookbackHours(Math.max(request.getLookbackHours(), TraceDiscoveryService.MIN_LOOKBACK_HOURS))
                .concurrency(Math.max(1, request.getConcurrency()))
                .build();
    }

    TraceOutcome fetchAndBuild(TraceSummary summary) {
        List<RawSpan> spans = spanFetchService.fetch(summary.getTraceId());
        SpanHierarchy hierarchy = hierarchyBuilder.build(spans);
        if (hierarchy.isEmpty()) {
            log.debug("Trace {} had no usable span records, skipping", summary.getTraceId());
            return new TraceOutcome(summary, null);
        }
        return new TraceOutcome(summary, toRecord(summary, hierarchy));
    }

    static TraceRecord toRecord(TraceSummary summary, SpanHierarchy hierarchy) {
        List<SpanNode> ordered = sorted(hierarchy);
        List<String> services = ordered.stream()
                .map(SpanNode::getServiceCode)
                .filter(Objects::nonNull)
                .filter(code -> !code.isEmpty())
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        return TraceRecord.builder()
                .summary(summary)
                .spanCount(ordered.size())
                .servicesInvolved(services)
                .rootSpanNodeIds(hierarchy.getRootNodeIds())
                .spans(ordered)
                .build();
    }

    private static List<SpanNode> sorted(SpanHierarchy hierarchy) {
        return hierarchy.getNodes().stream()
                .sorted(BY_START_TIME)
                .collect(Collectors.toList());
    }

    private static ThreadFactory fetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "trace-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
