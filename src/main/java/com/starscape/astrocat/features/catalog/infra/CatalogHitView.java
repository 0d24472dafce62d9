package com.starscape.astrocat.features.catalog.infra;

/**
 * Row of a native radius search.
 */
public interface CatalogHitView {
    String getDesignation();
    Double getSeparation();
}
