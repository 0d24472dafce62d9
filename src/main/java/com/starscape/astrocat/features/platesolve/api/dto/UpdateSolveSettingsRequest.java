package com.starscape.astrocat.features.platesolve.api.dto;

import com.starscape.astrocat.features.images.domain.SolveProvider;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for changing the admission ceiling and the solver used for new submissions.
 */
public record UpdateSolveSettingsRequest(
    @Min(value = 1, message = "Max in-flight must be at least 1")
    @Max(value = 100, message = "Max in-flight must be 100 or less")
    int maxInFlight,

    @NotNull(message = "Provider is required")
    SolveProvider provider
) {}
