package com.traceharvest.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Counters merged by the coordinator once all fetches completed.
 */
@Value
@Builder
public class RunTally {
    int discovered;
    long availableTotal;
    int failed;
    int empty;
    List<String> servicesDiscovered;
}
