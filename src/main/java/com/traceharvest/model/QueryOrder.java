package com.traceharvest.model;

/**
 * Ordering modes accepted by the trace summary query.
 */
public enum QueryOrder {
    BY_START_TIME,
    BY_DURATION
}
