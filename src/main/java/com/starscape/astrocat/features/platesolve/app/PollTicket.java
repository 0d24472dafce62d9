package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.features.images.domain.SolveProvider;

/**
 * Context for one poll of an in-flight submission.
 */
public record PollTicket(
    SolveProvider provider,
    int attempt,
    String jobId
) {}
