package com.traceharvest.exception;

/**
 * Discovery returned no trace summaries for the requested window.
 */
public class NoSummariesException extends TraceHarvestException {

    public NoSummariesException(String message) {
        super(message);
    }
}
