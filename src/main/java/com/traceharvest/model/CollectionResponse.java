package com.traceharvest.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CollectionResponse {
    private String artifactPath;
    private int requested;
    private int discovered;
    private int collected;
    private int failed;
    private int empty;
    private long availableTotal;
    private List<String> servicesDiscovered;
}
