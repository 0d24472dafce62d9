package com.starscape.astrocat.features.catalogmatch.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Matches of one image, nearest first. Pixel positions are present only when the
 * image has a usable WCS and the object's coordinates are known.
 */
public record ImageMatchesResponse(
    Long imageId,
    boolean pixelPositionsAvailable,
    List<MatchItem> matches
) {

    public record MatchItem(
        String catalog,
        String designation,
        String commonName,
        String objectType,
        Double raDegrees,
        Double decDegrees,
        Double angularSeparationDegrees,
        Double confidenceScore,
        String source,
        Double pixelX,
        Double pixelY,
        boolean inBounds,
        Instant matchedAt
    ) {}
}
