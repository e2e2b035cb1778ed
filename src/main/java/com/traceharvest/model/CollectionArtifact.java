package com.traceharvest.model;

import lombok.Value;

import java.util.List;

/**
 * Top-level document persisted once per collection run.
 */
@Value
public class CollectionArtifact {
    CollectionMetadata metadata;
    List<TraceRecord> traces;
}
