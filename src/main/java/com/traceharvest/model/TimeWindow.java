package com.traceharvest.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Absolute UTC query window, already truncated to its step.
 */
@Value
public class TimeWindow {
    LocalDateTime start;
    LocalDateTime end;
    QueryStep step;

    public String formattedStart() {
        return step.getFormatter().format(start);
    }

    public String formattedEnd() {
        return step.getFormatter().format(end);
    }
}
