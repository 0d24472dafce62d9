package com.starscape.astrocat.features.catalogmatch.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.common.wcs.AngularDistance;
import com.starscape.astrocat.features.catalog.domain.CatalogEntry;
import com.starscape.astrocat.features.catalog.domain.CatalogStore;
import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatchRepository;
import com.starscape.astrocat.features.catalogmatch.domain.MatchSource;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Handler for attaching a catalog object to an image by hand.
 * An existing automatic match for the same object is taken over rather than duplicated.
 */
@Service
public class AddManualMatchHandler {

    private static final Logger log = LoggerFactory.getLogger(AddManualMatchHandler.class);

    private final ImageRepository imageRepository;
    private final CatalogStore catalogStore;
    private final CatalogMatchRepository matchRepository;

    public AddManualMatchHandler(
            ImageRepository imageRepository,
            CatalogStore catalogStore,
            CatalogMatchRepository matchRepository) {
        this.imageRepository = imageRepository;
        this.catalogStore = catalogStore;
        this.matchRepository = matchRepository;
    }

    @Transactional
    public CatalogMatch handle(Long imageId, CatalogVariant variant, String designation) {
        String trimmed = designation == null ? "" : designation.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Designation cannot be blank");
        }

        Image image = imageRepository.findByIdForUpdate(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));

        CatalogEntry entry = catalogStore.findEntry(variant, trimmed)
                .orElseThrow(() -> new NotFoundException("Catalog object not found: " + variant + " " + trimmed));

        Optional<CatalogMatch> existing = matchRepository.findByImageIdAndCatalogVariantAndDesignation(
                imageId, variant, entry.designation());
        if (existing.isPresent()) {
            CatalogMatch match = existing.get();
            if (match.getSource() != MatchSource.AUTOMATIC) {
                throw new IllegalStateException("Image " + imageId + " already has a "
                        + match.getSource() + " match for " + entry.designation());
            }
            match.promoteToManual();
            log.info("Promoted automatic match to manual: imageId={}, catalog={}, designation={}",
                    imageId, variant, entry.designation());
            return matchRepository.save(match);
        }

        Double separation = null;
        if (image.getRaCenterDegrees() != null && image.getDecCenterDegrees() != null) {
            separation = AngularDistance.separationDegrees(
                    image.getRaCenterDegrees(), image.getDecCenterDegrees(),
                    entry.raDegrees(), entry.decDegrees());
        }

        CatalogMatch saved = matchRepository.save(
                CatalogMatch.manual(imageId, variant, entry.designation(), separation));
        log.info("Added manual match: imageId={}, catalog={}, designation={}",
                imageId, variant, entry.designation());
        return saved;
    }
}
