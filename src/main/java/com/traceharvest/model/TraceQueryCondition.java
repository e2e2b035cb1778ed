package com.traceharvest.model;

import lombok.Builder;
import lombok.Value;

/**
 * One page request of the windowed trace summary query.
 */
@Value
@Builder
public class TraceQueryCondition {
    TimeWindow window;
    long minDurationMs;
    QueryOrder order;
    int pageNum;
    int pageSize;
}
