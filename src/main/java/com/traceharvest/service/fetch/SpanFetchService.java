package com.traceharvest.service.fetch;

import com.traceharvest.factory.TraceBackendEngineFactory;
import com.traceharvest.model.RawSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SpanFetchService {

    private final TraceBackendEngineFactory engineFactory;

    /**
     * Retrieves the full span list of one trace. An empty list is a valid
     * answer for traces whose spans expired while their summary is still indexed.
     */
    public List<RawSpan> fetch(String traceId) {
        List<RawSpan> spans = engineFactory.getEngine().queryTrace(traceId);
        if (spans.isEmpty()) {
            log.debug("Trace {} returned no spans", traceId);
        }
        return spans;
    }
}
