package com.traceharvest.model;

import lombok.Data;

/**
 * Optional per-request overrides of the configured run parameters.
 */
@Data
public class CollectionOverrides {
    private Integer size;
    private Double lookbackHours;
    private Long minDurationMs;
    private Integer concurrency;
    private QueryOrder queryOrder;
    private Integer pageSize;
    private String experimentName;

    public CollectionRequest applyTo(CollectionRequest defaults) {
        CollectionRequest.CollectionRequestBuilder builder = defaults.toBuilder();
        if (size != null) builder.size(size);
        if (lookbackHours != null) builder.lookbackHours(lookbackHours);
        if (minDurationMs != null) builder.minDurationMs(minDurationMs);
        if (concurrency != null) builder.concurrency(concurrency);
        if (queryOrder != null) builder.queryOrder(queryOrder);
        if (pageSize != null) builder.pageSize(pageSize);
        if (experimentName != null) builder.experimentName(experimentName);
        return builder.build();
    }
}
