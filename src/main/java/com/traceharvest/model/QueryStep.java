package com.traceharvest.model;

import java.time.format.DateTimeFormatter;

/**
 * Time bucket unit of a summary query window.
 */
public enum QueryStep {
    MINUTE("yyyy-MM-dd HHmm"),
    HOUR("yyyy-MM-dd HH");

    private final DateTimeFormatter formatter;

    QueryStep(String pattern) {
        this.formatter = DateTimeFormatter.ofPattern(pattern);
    }

    public DateTimeFormatter getFormatter() {
        return formatter;
    }
}
