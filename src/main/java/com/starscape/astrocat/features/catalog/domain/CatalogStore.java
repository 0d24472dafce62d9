package com.starscape.astrocat.features.catalog.domain;

import java.util.List;
import java.util.Optional;

/**
 * Read-only spatial lookup over the reference catalogs.
 */
public interface CatalogStore {

    /**
     * Objects whose great-circle distance to (ra, dec) is at most {@code radiusDegrees},
     * nearest first. Results are capped per catalog.
     *
     * @throws IllegalArgumentException for a catalog that cannot be searched
     */
    List<CatalogCandidate> findWithinRadius(CatalogVariant variant, double raDegrees, double decDegrees,
                                            double radiusDegrees);

    /**
     * Resolve a designation. Point-source catalogs also match the whitespace-normalised form.
     */
    Optional<CatalogEntry> findEntry(CatalogVariant variant, String designation);
}
