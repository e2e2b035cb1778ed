package com.traceharvest.service.collection;

import com.traceharvest.model.TraceRecord;
import com.traceharvest.model.TraceSummary;
import lombok.Value;

/**
 * Result handed back by one fetch worker. A null record means the trace had
 * no usable spans.
 */
@Value
class TraceOutcome {
    TraceSummary summary;
    TraceRecord record;

    boolean isEmpty() {
        return record == null;
    }
}
