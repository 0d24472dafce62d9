package com.starscape.astrocat.features.platesolve.api.dto;

import jakarta.validation.constraints.NotNull;

public record BulkSolveRequest(
    @NotNull(message = "Path prefix is required")
    String pathPrefix,
    boolean force
) {}
