package com.traceharvest.engine.skywalking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceharvest.client.GraphQlRequest;
import com.traceharvest.client.QueryClient;
import com.traceharvest.exception.BackendUnavailableException;
import com.traceharvest.model.QueryOrder;
import com.traceharvest.model.QueryStep;
import com.traceharvest.model.RawSpan;
import com.traceharvest.model.TimeWindow;
import com.traceharvest.model.TraceQueryCondition;
import com.traceharvest.model.TraceSummaryPage;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SkyWalkingBackendEngineTest {

    ObjectMapper mapper = new ObjectMapper();
    List<GraphQlRequest> requests = new ArrayList<>();

    SkyWalkingBackendEngine engineAnswering(String dataJson) {
        QueryClient client = request -> {
            requests.add(request);
            return json(dataJson);
        };
        return new SkyWalkingBackendEngine(client, mapper);
    }

    @Test
    void queryTraceSummaries_buildsCondition() {
        SkyWalkingBackendEngine engine = engineAnswering("{\"data\":{\"total\":0,\"traces\":[]}}");
        TimeWindow window = new TimeWindow(
                LocalDateTime.of(2024, 3, 1, 9, 5), LocalDateTime.of(2024, 3, 1, 10, 5), QueryStep.MINUTE);

        engine.queryTraceSummaries(TraceQueryCondition.builder()
                .window(window)
                .minDurationMs(5)
                .order(QueryOrder.BY_DURATION)
                .pageNum(2)
                .pageSize(50)
                .build());

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).getQuery()).contains("queryBasicTraces");
        @SuppressWarnings("unchecked")
        Map<String, Object> condition = (Map<String, Object>) requests.get(0).getVariables().get("condition");
        assertThat(condition)
                .containsEntry("traceState", "ALL")
                .containsEntry("queryOrder", "BY_DURATION")
                .containsEntry("minTraceDuration", 5L)
                .containsEntry("queryDuration", Map.of("start", "2024-03-01 0905", "end", "2024-03-01 1005", "step", "MINUTE"))
                .containsEntry("paging", Map.of("pageNum", 2, "pageSize", 50));
    }

    @Test
    void queryTraceSummaries_mapsEntriesAndSkipsMissingIds() {
        SkyWalkingBackendEngine engine = engineAnswering("{\"data\":{\"total\":42,\"traces\":["
                + "{\"traceIds\":[\"t-1\",\"t-1b\"],\"duration\":120,\"start\":\"1700000000000\","
                + "\"isError\":true,\"endpointNames\":[\"GET:/a\"]},"
                + "{\"traceIds\":[],\"duration\":3,\"start\":\"1700000000001\",\"isError\":false},"
                + "{\"traceIds\":[\"t-2\"],\"duration\":7,\"start\":\"1700000000002\",\"isError\":false,\"endpointNames\":null}"
                + "]}}");

        TraceSummaryPage page = engine.queryTraceSummaries(anyCondition());

        assertThat(page.getTotal()).isEqualTo(42);
        assertThat(page.getEntryCount()).isEqualTo(3);
        assertThat(page.getSummaries()).hasSize(2);
        assertThat(page.getSummaries().get(0).getTraceId()).isEqualTo("t-1");
        assertThat(page.getSummaries().get(0).getDurationMs()).isEqualTo(120);
        assertThat(page.getSummaries().get(0).getStartTimestampMs()).isEqualTo(1_700_000_000_000L);
        assertThat(page.getSummaries().get(0).isError()).isTrue();
        assertThat(page.getSummaries().get(0).getEndpointNames()).containsExactly("GET:/a");
        assertThat(page.getSummaries().get(1).getEndpointNames()).isEmpty();
    }

    @Test
    void queryTraceSummaries_missingResultIsEmptyPage() {
        SkyWalkingBackendEngine engine = engineAnswering("{\"data\":null}");

        TraceSummaryPage page = engine.queryTraceSummaries(anyCondition());

        assertThat(page.getEntryCount()).isZero();
        assertThat(page.getSummaries()).isEmpty();
    }

    @Test
    void queryTrace_mapsSpans() {
        SkyWalkingBackendEngine engine = engineAnswering("{\"trace\":{\"spans\":[{"
                + "\"traceId\":\"t-1\",\"segmentId\":\"seg-b\",\"spanId\":0,\"parentSpanId\":-1,"
                + "\"serviceCode\":\"ts-order-service\",\"serviceInstanceName\":\"order-1\","
                + "\"startTime\":1700000000000,\"endTime\":1700000000040,\"endpointName\":\"POST:/order\","
                + "\"type\":\"Entry\",\"peer\":null,\"component\":\"SpringMVC\",\"isError\":true,\"layer\":\"Http\","
                + "\"tags\":[{\"key\":\"http.method\",\"value\":\"POST\"},{\"key\":\"http.method\",\"value\":\"PUT\"}],"
                + "\"logs\":[{\"time\":1700000000030,\"data\":[{\"key\":\"event\",\"value\":\"error\"}]}],"
                + "\"refs\":[{\"traceId\":\"t-1\",\"parentSegmentId\":\"seg-a\",\"parentSpanId\":2,\"type\":\"CROSS_PROCESS\"}]"
                + "},{\"segmentId\":\"seg-b\",\"spanId\":1,\"parentSpanId\":0}]}}");

        List<RawSpan> spans = engine.queryTrace("t-1");

        assertThat(requests.get(0).getVariables()).containsEntry("traceId", "t-1");
        assertThat(spans).hasSize(2);
        RawSpan entry = spans.get(0);
        assertThat(entry.getSegmentId()).isEqualTo("seg-b");
        assertThat(entry.getSpanId()).isZero();
        assertThat(entry.getParentSpanId()).isNull();
        assertThat(entry.getServiceInstance()).isEqualTo("order-1");
        assertThat(entry.isError()).isTrue();
        assertThat(entry.getTags()).hasSize(2);
        assertThat(entry.getLogs().get(0).getData()).containsEntry("event", "error");
        assertThat(entry.getRefs()).singleElement().satisfies(ref -> {
            assertThat(ref.getParentSegmentId()).isEqualTo("seg-a");
            assertThat(ref.getParentSpanId()).isEqualTo(2);
            assertThat(ref.getParentTraceId()).isEqualTo("t-1");
        });
        assertThat(spans.get(1).getParentSpanId()).isZero();
    }

    @Test
    void queryTrace_noSpansIsEmpty() {
        assertThat(engineAnswering("{\"trace\":{\"spans\":[]}}").queryTrace("t-1")).isEmpty();
        assertThat(engineAnswering("{\"trace\":null}").queryTrace("t-1")).isEmpty();
    }

    @Test
    void testConnection_falseWhenBackendUnavailable() {
        QueryClient failing = request -> {
            throw new BackendUnavailableException("down", 3, new IllegalStateException("refused"));
        };

        assertThat(new SkyWalkingBackendEngine(failing, mapper).testConnection()).isFalse();
        assertThat(engineAnswering("{\"result\":{\"timezone\":\"+0000\"}}").testConnection()).isTrue();
    }

    static TraceQueryCondition anyCondition() {
        return TraceQueryCondition.builder()
                .window(new TimeWindow(LocalDateTime.of(2024, 3, 1, 0, 0), LocalDateTime.of(2024, 3, 2, 0, 0), QueryStep.HOUR))
                .order(QueryOrder.BY_START_TIME)
                .pageNum(1)
                .pageSize(20)
                .build();
    }

    JsonNode json(String value) {
        try {
            return mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
