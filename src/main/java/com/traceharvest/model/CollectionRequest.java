package com.traceharvest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one collection run.
 */
@Value
@Builder(toBuilder = true)
public class CollectionRequest {
    /** Maximum traces to collect, 0 or less means unlimited */
    int size;
    double lookbackHours;
    long minDurationMs;
    int concurrency;
    QueryOrder queryOrder;
    int pageSize;
    String experimentName;
}
