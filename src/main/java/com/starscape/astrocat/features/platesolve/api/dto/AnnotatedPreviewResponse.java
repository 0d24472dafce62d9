package com.starscape.astrocat.features.platesolve.api.dto;

public record AnnotatedPreviewResponse(
    Long imageId,
    String url,
    int expiresInSeconds
) {}
