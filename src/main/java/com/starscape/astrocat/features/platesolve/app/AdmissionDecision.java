package com.starscape.astrocat.features.platesolve.app;

/**
 * Outcome of an admission attempt. A denial is ordinary control flow: the caller
 * retries after {@code retryAfterSeconds}.
 */
public record AdmissionDecision<T>(
    boolean granted,
    T value,
    int retryAfterSeconds,
    String reason
) {

    public static <T> AdmissionDecision<T> granted(T value) {
        return new AdmissionDecision<>(true, value, 0, null);
    }

    public static <T> AdmissionDecision<T> denied(int retryAfterSeconds, String reason) {
        return new AdmissionDecision<>(false, null, retryAfterSeconds, reason);
    }
}
