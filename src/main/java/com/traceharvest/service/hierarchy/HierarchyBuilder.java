package com.traceharvest.service.hierarchy;

import com.traceharvest.model.RawSpan;
import com.traceharvest.model.SpanHierarchy;
import com.traceharvest.model.SpanNode;
import com.traceharvest.model.SpanRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Rebuilds parent/child links and depth for one trace's spans.
 *
 * <p>A span's parent is resolved in order: the local parent span in the same
 * segment, then the first cross-segment reference. Spans whose parent is
 * absent, or not part of the span set, are roots. Depth is assigned breadth
 * first from the roots; each node gets a depth at most once, so cyclic input
 * terminates and unreachable nodes keep depth 0.
 *
 * <p>Stateless and safe to share between fetch workers.
 */
@Slf4j
@Component
public class HierarchyBuilder {

    public SpanHierarchy build(List<RawSpan> rawSpans) {
        if (rawSpans == null || rawSpans.isEmpty()) {
            return new SpanHierarchy(Collections.emptyList(), Collections.emptyList());
        }

        // Normalize
        Map<String, RawSpan> nodes = new LinkedHashMap<>();
        Map<String, Set<String>> children = new HashMap<>();
        for (RawSpan span : rawSpans) {
            if (span.getSegmentId() == null || span.getSpanId() == null) {
                log.debug("Dropping span without segment or span id in trace {}", span.getTraceId());
                continue;
            }
            String nodeId = SpanNode.nodeId(span.getSegmentId(), span.getSpanId());
            if (nodes.putIfAbsent(nodeId, span) != null) {
                log.debug("Dropping duplicate span {} in trace {}", nodeId, span.getTraceId());
                continue;
            }
            children.put(nodeId, new LinkedHashSet<>());
        }

        // Resolve parents and invert them into child sets
        Map<String, String> parents = new HashMap<>();
        List<String> roots = new ArrayList<>();
        for (Map.Entry<String, RawSpan> entry : nodes.entrySet()) {
            String nodeId = entry.getKey();
            String parentNodeId = resolveParent(entry.getValue());
            parents.put(nodeId, parentNodeId);

            if (parentNodeId != null && nodes.containsKey(parentNodeId)) {
                children.get(parentNodeId).add(nodeId);
            } else {
                roots.add(nodeId);
            }
        }

        Map<String, Integer> depths = assignDepths(roots, children);

        List<SpanNode> result = new ArrayList<>(nodes.size());
        for (Map.Entry<String, RawSpan> entry : nodes.entrySet()) {
            String nodeId = entry.getKey();
            RawSpan span = entry.getValue();
            result.add(SpanNode.builder()
                    .nodeId(nodeId)
                    .traceId(span.getTraceId())
                    .segmentId(span.getSegmentId())
                    .spanId(span.getSpanId())
                    .parentSpanId(span.getParentSpanId())
                    .parentNodeId(parents.get(nodeId))
                    .depth(depths.getOrDefault(nodeId, 0))
                    .childrenNodeIds(List.copyOf(children.get(nodeId)))
                    .serviceCode(span.getServiceCode())
                    .serviceInstance(span.getServiceInstance())
                    .startTimestampMs(span.getStartTime())
                    .endTimestampMs(span.getEndTime())
                    .endpointName(span.getEndpointName())
                    .type(span.getType())
                    .peer(span.getPeer())
                    .component(span.getComponent())
                    .layer(span.getLayer())
                    .error(span.isError())
                    .tags(span.getTags())
                    .logs(span.getLogs())
                    .refs(span.getRefs())
                    .build());
        }

        return new SpanHierarchy(result, roots);
    }

    /**
     * Local parent wins over refs; only the first ref is honored.
     */
    static String resolveParent(RawSpan span) {
        Integer parentSpanId = span.getParentSpanId();
        if (parentSpanId != null && parentSpanId >= 0) {
            return SpanNode.nodeId(span.getSegmentId(), parentSpanId);
        }
        if (!span.getRefs().isEmpty()) {
            SpanRef ref = span.getRefs().get(0);
            if (ref.getParentSegmentId() != null && ref.getParentSpanId() != null) {
                return SpanNode.nodeId(ref.getParentSegmentId(), ref.getParentSpanId());
            }
        }
        return null;
    }

    private static Map<String, Integer> assignDepths(List<String> roots, Map<String, Set<String>> children) {
        Map<String, Integer> depths = new HashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        for (String root : roots) {
            depths.put(root, 0);
            queue.add(root);
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int childDepth = depths.get(current) + 1;
            for (String child : children.get(current)) {
                if (depths.putIfAbsent(child, childDepth) == null) {
                    queue.add(child);
                }
            }
        }
        return depths;
    }
}
