package com.starscape.astrocat.features.catalogmatch.api.dto;

import com.starscape.astrocat.features.catalogmatch.app.MatchOutcome;

import java.util.List;

/**
 * Response DTO for a single-image match recomputation.
 */
public record RecomputeMatchesResponse(
    Long imageId,
    int inserted,
    boolean skipped,
    boolean pixelValidated,
    List<String> catalogsQueried,
    List<String> catalogsFailed
) {

    public static RecomputeMatchesResponse from(Long imageId, MatchOutcome outcome) {
        return new RecomputeMatchesResponse(
            imageId,
            outcome.inserted(),
            outcome.skipped(),
            outcome.pixelValidated(),
            outcome.catalogsQueried().stream().map(Enum::name).toList(),
            outcome.catalogsFailed().stream().map(Enum::name).toList()
        );
    }
}
