package com.traceharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpanLog {
    long timeMs;
    @JsonIgnore
    @Singular
    List<KeyValue> fields;

    public String getTimeUtc() {
        return Timestamps.utcIso(timeMs);
    }

    public Map<String, String> getData() {
        Map<String, String> data = new LinkedHashMap<>();
        for (KeyValue field : fields) {
            data.put(field.getKey(), field.getValue());
        }
        return data;
    }
}
