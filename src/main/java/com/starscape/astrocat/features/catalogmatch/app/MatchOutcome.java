package com.starscape.astrocat.features.catalogmatch.app;

import com.starscape.astrocat.features.catalog.domain.CatalogVariant;

import java.util.List;

/**
 * Result of one match recomputation. Callers must not assume every catalog was searched
 * unless {@link #catalogsFailed()} is empty.
 *
 * @param pixelValidated false when no WCS model could be built and candidates were accepted on radius alone
 * @param skipped        true when the image had no usable centre and nothing was written
 */
public record MatchOutcome(
    int inserted,
    List<CatalogVariant> catalogsQueried,
    List<CatalogVariant> catalogsFailed,
    boolean pixelValidated,
    boolean skipped
) {

    public static MatchOutcome skippedOutcome() {
        return new MatchOutcome(0, List.of(), List.of(), false, true);
    }

    public boolean allCatalogsQueried() {
        return !skipped && catalogsFailed.isEmpty();
    }
}
