package com.starscape.astrocat.features.catalog.app;

import com.starscape.astrocat.features.catalog.api.dto.ConeSearchResponse;
import com.starscape.astrocat.features.catalog.api.dto.ConeSearchResponse.ConeSearchHit;
import com.starscape.astrocat.features.catalog.domain.CatalogCandidate;
import com.starscape.astrocat.features.catalog.domain.CatalogEntry;
import com.starscape.astrocat.features.catalog.domain.CatalogStore;
import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Handler for ad-hoc radius searches against one catalog.
 */
@Service
public class ConeSearchHandler {

    private final CatalogStore catalogStore;

    public ConeSearchHandler(CatalogStore catalogStore) {
        this.catalogStore = catalogStore;
    }

    public ConeSearchResponse handle(CatalogVariant variant, double ra, double dec, double radius) {
        if (!variant.isSearchable()) {
            throw new IllegalArgumentException("Catalog " + variant + " does not support radius search");
        }
        List<ConeSearchHit> hits = catalogStore.findWithinRadius(variant, ra, dec, radius).stream()
                .map(this::toHit)
                .toList();
        return new ConeSearchResponse(variant.name(), ra, dec, radius, hits);
    }

    private ConeSearchHit toHit(CatalogCandidate candidate) {
        Optional<CatalogEntry> entry = catalogStore.findEntry(candidate.variant(), candidate.designation());
        return new ConeSearchHit(
            candidate.designation(),
            entry.map(CatalogEntry::commonName).orElse(null),
            entry.map(CatalogEntry::objectType).orElse(null),
            entry.map(CatalogEntry::raDegrees).orElse(null),
            entry.map(CatalogEntry::decDegrees).orElse(null),
            candidate.separationDegrees()
        );
    }
}
