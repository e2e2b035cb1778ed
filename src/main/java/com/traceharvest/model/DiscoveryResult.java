package com.traceharvest.model;

import lombok.Value;

import java.util.List;

@Value
public class DiscoveryResult {
    List<TraceSummary> summaries;
    /** Backend-reported hint, not reconciled with the returned list */
    long totalAvailable;
}
