package com.starscape.astrocat.features.platesolve.api.dto;

import java.time.Instant;

public record SolveSettingsResponse(
    int maxInFlight,
    String provider,
    String effectiveProvider,
    long inFlight,
    Instant updatedAt
) {}
