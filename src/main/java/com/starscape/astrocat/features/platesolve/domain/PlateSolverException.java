package com.starscape.astrocat.features.platesolve.domain;

/**
 * Failure talking to a plate solver. Transient failures (network errors, 5xx, throttling)
 * may succeed on retry; the others will not.
 */
public class PlateSolverException extends RuntimeException {

    private final boolean transientFailure;

    public PlateSolverException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public PlateSolverException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
