package com.traceharvest.exception;

import lombok.Getter;

/**
 * Every dispatched span fetch either failed or produced no usable spans.
 */
@Getter
public class AllFetchesFailedException extends TraceHarvestException {

    private final int requested;
    private final int failed;
    private final int empty;

    public AllFetchesFailedException(int requested, int failed, int empty, Throwable firstFailure) {
        super(String.format("All %d trace detail requests failed or were empty (failed=%d, empty=%d)",
                requested, failed, empty), firstFailure);
        this.requested = requested;
        this.failed = failed;
        this.empty = empty;
    }
}
