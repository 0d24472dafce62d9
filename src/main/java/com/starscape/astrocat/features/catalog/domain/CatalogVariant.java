package com.starscape.astrocat.features.catalog.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reference catalogs a match can point into. IC designations resolve through the NGC
 * table and are never searched on their own.
 */
public enum CatalogVariant {
    MESSIER(true),
    NGC(true),
    IC(false),
    NAMED_STAR(true);

    private final boolean searchable;

    CatalogVariant(boolean searchable) {
        this.searchable = searchable;
    }

    public boolean isSearchable() {
        return searchable;
    }

    public static List<CatalogVariant> searchable() {
        return Arrays.stream(values()).filter(CatalogVariant::isSearchable).toList();
    }

    /**
     * Designation form used when historical rows stored spaced and unspaced variants
     * of the same identifier. Must agree with {@code UPPER(REPLACE(designation, ' ', ''))} in SQL.
     */
    public static String normalizeDesignation(String designation) {
        return designation == null ? null : designation.toUpperCase(Locale.ROOT).replace(" ", "");
    }
}
