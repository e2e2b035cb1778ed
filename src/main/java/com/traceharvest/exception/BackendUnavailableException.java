package com.traceharvest.exception;

import lombok.Getter;

/**
 * Raised when a backend query still fails after every retry attempt.
 * The cause is the failure observed on the last attempt.
 */
@Getter
public class BackendUnavailableException extends TraceHarvestException {

    private final int attempts;

    public BackendUnavailableException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
