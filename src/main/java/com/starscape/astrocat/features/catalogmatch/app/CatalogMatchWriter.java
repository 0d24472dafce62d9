package com.starscape.astrocat.features.catalogmatch.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatchRepository;
import com.starscape.astrocat.features.catalogmatch.domain.MatchKey;
import com.starscape.astrocat.features.catalogmatch.domain.MatchSource;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replaces the automatic matches of one image in a single transaction.
 * The image row lock serialises concurrent recomputations of the same image.
 */
@Service
public class CatalogMatchWriter {

    private static final Logger log = LoggerFactory.getLogger(CatalogMatchWriter.class);

    private final CatalogMatchRepository matchRepository;
    private final ImageRepository imageRepository;

    public CatalogMatchWriter(CatalogMatchRepository matchRepository, ImageRepository imageRepository) {
        this.matchRepository = matchRepository;
        this.imageRepository = imageRepository;
    }

    /**
     * @return number of rows inserted; candidates colliding with a MANUAL or HEADER row are dropped
     */
    @Transactional
    public int replaceAutomaticMatches(Long imageId, Collection<CatalogMatch> matches) {
        imageRepository.findByIdForUpdate(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));

        Set<MatchKey> curatedKeys = matchRepository.findByImageIdAndSourceNot(imageId, MatchSource.AUTOMATIC)
                .stream()
                .map(CatalogMatch::key)
                .collect(Collectors.toSet());

        int removed = matchRepository.deleteByImageIdAndSource(imageId, MatchSource.AUTOMATIC);

        List<CatalogMatch> toInsert = matches.stream()
                .filter(match -> !curatedKeys.contains(match.key()))
                .toList();
        matchRepository.saveAll(toInsert);

        log.info("Replaced automatic matches: imageId={}, removed={}, inserted={}, keptCurated={}",
                imageId, removed, toInsert.size(), curatedKeys.size());
        return toInsert.size();
    }
}
