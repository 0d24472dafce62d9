package com.starscape.astrocat.features.catalog.api.dto;

import java.util.List;

public record ConeSearchResponse(
    String catalog,
    double raDegrees,
    double decDegrees,
    double radiusDegrees,
    List<ConeSearchHit> hits
) {

    public record ConeSearchHit(
        String designation,
        String commonName,
        String objectType,
        Double raDegrees,
        Double decDegrees,
        double separationDegrees
    ) {}
}
