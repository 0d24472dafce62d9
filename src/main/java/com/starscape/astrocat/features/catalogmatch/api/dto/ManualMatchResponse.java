package com.starscape.astrocat.features.catalogmatch.api.dto;

import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;

import java.time.Instant;

public record ManualMatchResponse(
    Long id,
    Long imageId,
    String catalog,
    String designation,
    Double angularSeparationDegrees,
    String source,
    Instant matchedAt
) {

    public static ManualMatchResponse from(CatalogMatch match) {
        return new ManualMatchResponse(
            match.getId(),
            match.getImageId(),
            match.getCatalogVariant().name(),
            match.getDesignation(),
            match.getAngularSeparationDegrees(),
            match.getSource().name(),
            match.getMatchedAt()
        );
    }
}
