package com.traceharvest.exception;

/**
 * Base type for failures raised by the trace harvesting pipeline.
 */
public class TraceHarvestException extends RuntimeException {

    public TraceHarvestException(String message) {
        super(message);
    }

    public TraceHarvestException(String message, Throwable cause) {
        super(message, cause);
    }
}
