package com.traceharvest.engine.skywalking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceharvest.client.GraphQlRequest;
import com.traceharvest.client.QueryClient;
import com.traceharvest.engine.TraceBackendEngine;
import com.traceharvest.exception.TraceHarvestException;
import com.traceharvest.model.KeyValue;
import com.traceharvest.model.RawSpan;
import com.traceharvest.model.SpanLog;
import com.traceharvest.model.SpanRef;
import com.traceharvest.model.TraceQueryCondition;
import com.traceharvest.model.TraceSummary;
import com.traceharvest.model.TraceSummaryPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SkyWalking implementation of TraceBackendEngine, speaking the OAP
 * GraphQL query protocol.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "harvest.engine.type", havingValue = "skywalking", matchIfMissing = true)
public class SkyWalkingBackendEngine implements TraceBackendEngine {

    static final String TRACE_LIST_QUERY = String.join("\n",
            "query queryBasicTraces($condition: TraceQueryCondition!) {",
            "  data: queryBasicTraces(condition: $condition) {",
            "    total",
            "    traces {",
            "      traceIds",
            "      duration",
            "      start",
            "      isError",
            "      endpointNames",
            "    }",
            "  }",
            "}");

    static final String TRACE_DETAIL_QUERY = String.join("\n",
            "query queryTrace($traceId: ID!) {",
            "  trace: queryTrace(traceId: $traceId) {",
            "    spans {",
            "      traceId",
            "      segmentId",
            "      spanId",
            "      parentSpanId",
            "      serviceCode",
            "      serviceInstanceName",
            "      startTime",
            "      endTime",
            "      endpointName",
            "      type",
            "      peer",
            "      component",
            "      isError",
            "      layer",
            "      tags { key value }",
            "      logs { time data { key value } }",
            "      refs { traceId parentSegmentId parentSpanId type }",
            "    }",
            "  }",
            "}");

    static final String TIME_INFO_QUERY = "query { result: getTimeInfo { timezone currentTimestamp } }";

    private final QueryClient queryClient;
    private final ObjectMapper objectMapper;

    public SkyWalkingBackendEngine(QueryClient queryClient, ObjectMapper objectMapper) {
        this.queryClient = queryClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getEngineType() {
        return "SkyWalking";
    }

    @Override
    public boolean testConnection() {
        try {
            JsonNode data = queryClient.query(GraphQlRequest.of(TIME_INFO_QUERY));
            return data.hasNonNull("result");
        } catch (Exception e) {
            log.error("SkyWalking connection test failed", e);
            return false;
        }
    }

    @Override
    public TraceSummaryPage queryTraceSummaries(TraceQueryCondition condition) {
        JsonNode data = queryClient.query(
                GraphQlRequest.of(TRACE_LIST_QUERY, Map.of("condition", toVariables(condition))));

        JsonNode result = data.get("data");
        if (result == null || result.isNull()) {
            return new TraceSummaryPage(0, 0, Collections.emptyList());
        }

        SkyWalkingResponses.BasicTraces page = convert(result, SkyWalkingResponses.BasicTraces.class);
        List<SkyWalkingResponses.BasicTrace> entries = page.getTraces() != null
                ? page.getTraces()
                : Collections.emptyList();

        List<TraceSummary> summaries = new ArrayList<>();
        for (SkyWalkingResponses.BasicTrace entry : entries) {
            if (entry.getTraceIds() == null || entry.getTraceIds().isEmpty()) {
                continue;
            }
            summaries.add(TraceSummary.builder()
                    .traceId(entry.getTraceIds().get(0))
                    .durationMs(Math.max(0, entry.getDuration()))
                    .startTimestampMs(entry.getStart())
                    .error(entry.isError())
                    .endpointNames(nullToEmpty(entry.getEndpointNames()))
                    .build());
        }

        return new TraceSummaryPage(page.getTotal(), entries.size(), summaries);
    }

    @Override
    public List<RawSpan> queryTrace(String traceId) {
        JsonNode data = queryClient.query(
                GraphQlRequest.of(TRACE_DETAIL_QUERY, Map.of("traceId", traceId)));

        JsonNode trace = data.get("trace");
        if (trace == null || trace.isNull()) {
            return Collections.emptyList();
        }

        SkyWalkingResponses.TraceDetail detail = convert(trace, SkyWalkingResponses.TraceDetail.class);
        if (detail.getSpans() == null) {
            return Collections.emptyList();
        }
        return detail.getSpans().stream()
                .map(this::toRawSpan)
                .collect(Collectors.toList());
    }

    Map<String, Object> toVariables(TraceQueryCondition condition) {
        Map<String, Object> queryDuration = new LinkedHashMap<>();
        queryDuration.put("start", condition.getWindow().formattedStart());
        queryDuration.put("end", condition.getWindow().formattedEnd());
        queryDuration.put("step", condition.getWindow().getStep().name());

        Map<String, Object> paging = new LinkedHashMap<>();
        paging.put("pageNum", condition.getPageNum());
        paging.put("pageSize", condition.getPageSize());

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("queryDuration", queryDuration);
        variables.put("traceState", "ALL");
        variables.put("queryOrder", condition.getOrder().name());
        variables.put("minTraceDuration", Math.max(0, condition.getMinDurationMs()));
        variables.put("paging", paging);
        return variables;
    }

    private RawSpan toRawSpan(SkyWalkingResponses.Span span) {
        return RawSpan.builder()
                .traceId(span.getTraceId())
                .segmentId(span.getSegmentId())
                .spanId(span.getSpanId())
                // SkyWalking marks a segment's first span with parentSpanId -1
                .parentSpanId(span.getParentSpanId() != null && span.getParentSpanId() >= 0
                        ? span.getParentSpanId()
                        : null)
                .refs(nullToEmpty(span.getRefs()).stream()
                        .map(ref -> SpanRef.builder()
                                .parentTraceId(ref.getTraceId())
                                .parentSegmentId(ref.getParentSegmentId())
                                .parentSpanId(ref.getParentSpanId())
                                .type(ref.getType())
                                .build())
                        .collect(Collectors.toList()))
                .serviceCode(span.getServiceCode())
                .serviceInstance(span.getServiceInstanceName())
                .startTime(span.getStartTime())
                .endTime(span.getEndTime())
                .endpointName(span.getEndpointName())
                .type(span.getType())
                .peer(span.getPeer())
                .component(span.getComponent())
                .layer(span.getLayer())
                .error(span.isError())
                .tags(toKeyValues(span.getTags()))
                .logs(nullToEmpty(span.getLogs()).stream()
                        .map(entry -> SpanLog.builder()
                                .timeMs(entry.getTime())
                                .fields(toKeyValues(entry.getData()))
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private List<KeyValue> toKeyValues(List<SkyWalkingResponses.KeyValue> pairs) {
        return nullToEmpty(pairs).stream()
                .filter(kv -> kv.getKey() != null)
                .map(kv -> new KeyValue(kv.getKey(), kv.getValue()))
                .collect(Collectors.toList());
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new TraceHarvestException("Unexpected SkyWalking response shape: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
