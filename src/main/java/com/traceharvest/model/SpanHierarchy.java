package com.traceharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

import java.util.List;

/**
 * Output of hierarchy reconstruction for one trace.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpanHierarchy {
    List<SpanNode> nodes;
    List<String> rootNodeIds;

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
