package com.starscape.astrocat.features.catalog.domain;

import com.starscape.astrocat.common.wcs.SkyPoint;

public record CatalogEntry(
    CatalogVariant variant,
    String designation,
    String commonName,
    String objectType,
    double raDegrees,
    double decDegrees,
    Double magnitude
) {

    public SkyPoint position() {
        return new SkyPoint(raDegrees, decDegrees);
    }
}
