package com.traceharvest.engine;

import com.traceharvest.model.RawSpan;
import com.traceharvest.model.TraceQueryCondition;
import com.traceharvest.model.TraceSummaryPage;

import java.util.List;

/**
 * Read-side access to a tracing backend.
 * Implementations are selected through harvest.engine.type.
 */
public interface TraceBackendEngine {

    // Windowed, paginated summary query
    TraceSummaryPage queryTraceSummaries(TraceQueryCondition condition);

    // Full span list of one trace, empty when the backend has none
    List<RawSpan> queryTrace(String traceId);

    boolean testConnection();

    String getEngineType();
}
