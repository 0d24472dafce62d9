package com.starscape.astrocat.features.catalog.domain;

/**
 * A catalog object found by a radius search, with its great-circle distance to the search centre.
 */
public record CatalogCandidate(CatalogVariant variant, String designation, double separationDegrees) {
}
