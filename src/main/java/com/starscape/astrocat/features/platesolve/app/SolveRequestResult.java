package com.starscape.astrocat.features.platesolve.app;

/**
 * Outcome of a solve request as reported to the caller.
 *
 * @param retryAfterSeconds set when the request was deferred or a retry is scheduled
 */
public record SolveRequestResult(
    Status status,
    Long imageId,
    String submissionId,
    Integer retryAfterSeconds,
    String message
) {

    public enum Status {
        SUBMITTED,
        ALREADY_STARTED,
        DEFERRED,
        FAILED
    }

    static SolveRequestResult submitted(Long imageId, String submissionId) {
        return new SolveRequestResult(Status.SUBMITTED, imageId, submissionId, null, null);
    }

    static SolveRequestResult alreadyStarted(Long imageId) {
        return new SolveRequestResult(Status.ALREADY_STARTED, imageId, null, null, "Solve already started");
    }

    static SolveRequestResult deferred(Long imageId, int retryAfterSeconds, String reason) {
        return new SolveRequestResult(Status.DEFERRED, imageId, null, retryAfterSeconds, reason);
    }

    static SolveRequestResult failed(Long imageId, Integer retryAfterSeconds, String reason) {
        return new SolveRequestResult(Status.FAILED, imageId, null, retryAfterSeconds, reason);
    }
}
