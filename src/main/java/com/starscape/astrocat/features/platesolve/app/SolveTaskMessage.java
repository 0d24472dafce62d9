package com.starscape.astrocat.features.platesolve.app;

/**
 * One unit of background solve work. SUBMIT admits and uploads an image; POLL checks
 * one submission once and re-enqueues itself while the solver is still working.
 */
public record SolveTaskMessage(
    Type type,
    Long imageId,
    boolean force,
    String submissionId,
    int attempt
) {

    public enum Type {
        SUBMIT,
        POLL
    }

    public static SolveTaskMessage submit(Long imageId, boolean force, int attempt) {
        return new SolveTaskMessage(Type.SUBMIT, imageId, force, null, attempt);
    }

    public static SolveTaskMessage poll(Long imageId, String submissionId) {
        return new SolveTaskMessage(Type.POLL, imageId, false, submissionId, 0);
    }
}
