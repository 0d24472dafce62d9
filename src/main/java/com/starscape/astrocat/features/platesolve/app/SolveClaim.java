package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.SolveHints;

/**
 * Result of trying to move an image into SUBMITTED.
 */
public record SolveClaim(
    Outcome outcome,
    Long imageId,
    String filePath,
    SolveProvider provider,
    AstrometryStatus previousStatus,
    SolveHints hints
) {

    public enum Outcome {
        CLAIMED,
        ALREADY_STARTED
    }

    static SolveClaim alreadyStarted(Long imageId, AstrometryStatus status) {
        return new SolveClaim(Outcome.ALREADY_STARTED, imageId, null, null, status, null);
    }

    public boolean claimed() {
        return outcome == Outcome.CLAIMED;
    }
}
