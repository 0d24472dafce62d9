package com.starscape.astrocat.features.catalogmatch.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for re-matching every plate-solved image under a path prefix.
 * An empty prefix selects all images.
 */
public record BulkMatchRequest(
    @NotNull(message = "Path prefix is required")
    String pathPrefix
) {}
