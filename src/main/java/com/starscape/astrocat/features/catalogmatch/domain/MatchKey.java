package com.starscape.astrocat.features.catalogmatch.domain;

import com.starscape.astrocat.features.catalog.domain.CatalogVariant;

/**
 * Identity of a match within one image.
 */
public record MatchKey(CatalogVariant variant, String designation) {
}
