package com.traceharvest.model;

import lombok.Value;

import java.util.List;

/**
 * A single page of summaries plus the backend's reported total.
 */
@Value
public class TraceSummaryPage {
    long total;
    /** Raw entry count on the page, including entries without a trace id */
    int entryCount;
    List<TraceSummary> summaries;
}
