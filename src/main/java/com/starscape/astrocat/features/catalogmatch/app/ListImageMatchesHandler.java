package com.starscape.astrocat.features.catalogmatch.app;

import com.starscape.astrocat.common.config.MatchingProperties;
import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.common.wcs.AstrometrySummary;
import com.starscape.astrocat.common.wcs.PixelPoint;
import com.starscape.astrocat.common.wcs.ProjectionException;
import com.starscape.astrocat.common.wcs.WcsModel;
import com.starscape.astrocat.common.wcs.WcsModelFactory;
import com.starscape.astrocat.features.catalog.domain.CatalogEntry;
import com.starscape.astrocat.features.catalog.domain.CatalogStore;
import com.starscape.astrocat.features.catalogmatch.api.dto.ImageMatchesResponse;
import com.starscape.astrocat.features.catalogmatch.api.dto.ImageMatchesResponse.MatchItem;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatchRepository;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Handler for listing the matches of an image with their projected pixel positions,
 * used for overlays.
 */
@Service
public class ListImageMatchesHandler {

    private static final Logger log = LoggerFactory.getLogger(ListImageMatchesHandler.class);

    private final ImageRepository imageRepository;
    private final CatalogMatchRepository matchRepository;
    private final CatalogStore catalogStore;
    private final WcsModelFactory wcsModelFactory;
    private final MatchingProperties properties;

    public ListImageMatchesHandler(
            ImageRepository imageRepository,
            CatalogMatchRepository matchRepository,
            CatalogStore catalogStore,
            WcsModelFactory wcsModelFactory,
            MatchingProperties properties) {
        this.imageRepository = imageRepository;
        this.matchRepository = matchRepository;
        this.catalogStore = catalogStore;
        this.wcsModelFactory = wcsModelFactory;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public ImageMatchesResponse handle(Long imageId) {
        Image image = imageRepository.findById(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));

        AstrometrySummary summary = image.toAstrometrySummary();
        Optional<WcsModel> wcs = wcsModelFactory.build(summary);

        List<MatchItem> items = matchRepository.findByImageIdOrderByAngularSeparationDegreesAsc(imageId).stream()
                .map(match -> toItem(match, summary, wcs))
                .toList();

        return new ImageMatchesResponse(imageId, wcs.isPresent(), items);
    }

    private MatchItem toItem(CatalogMatch match, AstrometrySummary summary, Optional<WcsModel> wcs) {
        Optional<CatalogEntry> entry = catalogStore.findEntry(match.getCatalogVariant(), match.getDesignation());

        PixelPoint pixel = null;
        if (wcs.isPresent() && entry.isPresent()) {
            try {
                pixel = wcs.get().skyToPixel(entry.get().raDegrees(), entry.get().decDegrees());
            } catch (ProjectionException e) {
                log.debug("{} {} cannot be projected onto image {}: {}",
                        match.getCatalogVariant(), match.getDesignation(), match.getImageId(), e.getMessage());
            }
        }
        boolean inBounds = pixel != null
                && summary.widthPixels() != null
                && summary.heightPixels() != null
                && pixel.isWithin(summary.widthPixels(), summary.heightPixels(), properties.getBoundsMarginPixels());

        return new MatchItem(
            match.getCatalogVariant().name(),
            match.getDesignation(),
            entry.map(CatalogEntry::commonName).orElse(null),
            entry.map(CatalogEntry::objectType).orElse(null),
            entry.map(CatalogEntry::raDegrees).orElse(null),
            entry.map(CatalogEntry::decDegrees).orElse(null),
            match.getAngularSeparationDegrees(),
            match.getConfidenceScore(),
            match.getSource().name(),
            pixel != null ? pixel.x() : null,
            pixel != null ? pixel.y() : null,
            inBounds,
            match.getMatchedAt()
        );
    }
}
