package com.starscape.astrocat.features.catalogmatch.app;

import com.starscape.astrocat.common.config.MatchingProperties;
import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.common.wcs.AstrometrySummary;
import com.starscape.astrocat.common.wcs.PixelPoint;
import com.starscape.astrocat.common.wcs.ProjectionException;
import com.starscape.astrocat.common.wcs.WcsModel;
import com.starscape.astrocat.common.wcs.WcsModelFactory;
import com.starscape.astrocat.features.catalog.domain.CatalogCandidate;
import com.starscape.astrocat.features.catalog.domain.CatalogEntry;
import com.starscape.astrocat.features.catalog.domain.CatalogStore;
import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;
import com.starscape.astrocat.features.catalogmatch.domain.MatchKey;
import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recomputes the automatic catalog matches of one image.
 *
 * <p>Each searchable catalog is queried around the image centre. When a WCS model can be
 * built, a candidate is kept only if it projects inside the image rectangle (plus a
 * margin); otherwise every candidate within the radius is kept. Catalog queries run
 * outside the write transaction, and a failure in one catalog does not block the others.
 */
@Service
public class CatalogMatcher {

    private static final Logger log = LoggerFactory.getLogger(CatalogMatcher.class);

    private final ImageRepository imageRepository;
    private final CatalogStore catalogStore;
    private final CatalogMatchWriter matchWriter;
    private final WcsModelFactory wcsModelFactory;
    private final MatchingProperties properties;

    public CatalogMatcher(
            ImageRepository imageRepository,
            CatalogStore catalogStore,
            CatalogMatchWriter matchWriter,
            WcsModelFactory wcsModelFactory,
            MatchingProperties properties) {
        this.imageRepository = imageRepository;
        this.catalogStore = catalogStore;
        this.matchWriter = matchWriter;
        this.wcsModelFactory = wcsModelFactory;
        this.properties = properties;
    }

    public MatchOutcome matchImage(Long imageId) {
        Image image = imageRepository.findById(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));

        AstrometrySummary summary = image.toAstrometrySummary();
        if (!summary.hasCenter()) {
            log.debug("Skipping match for image {}: no centre coordinates", imageId);
            return MatchOutcome.skippedOutcome();
        }
        if (image.getAstrometryStatus() != AstrometryStatus.SOLVED && summary.fieldRadiusDegrees() == null) {
            log.debug("Skipping match for image {}: not solved and no field radius", imageId);
            return MatchOutcome.skippedOutcome();
        }

        double ra = summary.raCenterDegrees();
        double dec = summary.decCenterDegrees();
        double radius = summary.fieldRadiusDegrees() != null && summary.fieldRadiusDegrees() > 0
                ? summary.fieldRadiusDegrees()
                : properties.getDefaultRadiusDegrees();

        Optional<WcsModel> wcs = wcsModelFactory.build(summary);
        if (wcs.isEmpty()) {
            log.info("No WCS model for image {}; accepting candidates on radius only", imageId);
        }

        Map<MatchKey, CatalogMatch> accepted = new LinkedHashMap<>();
        List<CatalogVariant> queried = new ArrayList<>();
        List<CatalogVariant> failed = new ArrayList<>();

        for (CatalogVariant variant : CatalogVariant.searchable()) {
            List<CatalogCandidate> candidates;
            try {
                candidates = catalogStore.findWithinRadius(variant, ra, dec, radius);
                queried.add(variant);
            } catch (DataAccessException e) {
                log.warn("Catalog {} query failed for image {}: {}", variant, imageId, e.getMessage());
                failed.add(variant);
                continue;
            }

            for (CatalogCandidate candidate : candidates) {
                MatchKey key = new MatchKey(variant, candidate.designation());
                if (accepted.containsKey(key)) {
                    continue;
                }
                if (wcs.isPresent() && !isInsideFootprint(wcs.get(), candidate, summary, imageId)) {
                    continue;
                }
                accepted.put(key, CatalogMatch.automatic(
                        imageId,
                        variant,
                        candidate.designation(),
                        candidate.separationDegrees(),
                        properties.confidenceFor(candidate.separationDegrees())));
            }
        }

        int inserted = matchWriter.replaceAutomaticMatches(imageId, accepted.values());
        log.info("Matched image {}: inserted={}, radius={}, queried={}, failed={}, pixelValidated={}",
                imageId, inserted, radius, queried, failed, wcs.isPresent());
        return new MatchOutcome(inserted, List.copyOf(queried), List.copyOf(failed), wcs.isPresent(), false);
    }

    /**
     * A candidate whose coordinates cannot be resolved or projected is excluded on its own.
     */
    private boolean isInsideFootprint(WcsModel wcs, CatalogCandidate candidate, AstrometrySummary summary,
                                      Long imageId) {
        Optional<CatalogEntry> entry;
        try {
            entry = catalogStore.findEntry(candidate.variant(), candidate.designation());
        } catch (DataAccessException e) {
            log.warn("Coordinate lookup failed for {} {} (image {}): {}",
                    candidate.variant(), candidate.designation(), imageId, e.getMessage());
            return false;
        }
        if (entry.isEmpty()) {
            log.debug("No coordinates for {} {}", candidate.variant(), candidate.designation());
            return false;
        }

        try {
            PixelPoint pixel = wcs.skyToPixel(entry.get().raDegrees(), entry.get().decDegrees());
            int width = summary.widthPixels() != null ? summary.widthPixels() : 0;
            int height = summary.heightPixels() != null ? summary.heightPixels() : 0;
            return pixel.isWithin(width, height, properties.getBoundsMarginPixels());
        } catch (ProjectionException e) {
            log.debug("Projection failed for {} {} (image {}): {}",
                    candidate.variant(), candidate.designation(), imageId, e.getMessage());
            return false;
        }
    }
}
