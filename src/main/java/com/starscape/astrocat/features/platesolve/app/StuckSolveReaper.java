package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails solves that have made no progress for longer than the staleness threshold.
 * Active polling refreshes the image's updated_at, so only abandoned runs are caught.
 */
@Component
public class StuckSolveReaper {

    private static final Logger log = LoggerFactory.getLogger(StuckSolveReaper.class);

    private final ImageRepository imageRepository;
    private final AstrometryProperties properties;

    public StuckSolveReaper(ImageRepository imageRepository, AstrometryProperties properties) {
        this.imageRepository = imageRepository;
        this.properties = properties;
    }

    @Scheduled(
        fixedDelayString = "${app.astrometry.reaper-interval-ms:300000}",
        initialDelayString = "${app.astrometry.reaper-interval-ms:300000}")
    @Transactional
    public int sweep() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getStaleAfterMinutes()));
        List<Image> stuck = imageRepository.findByAstrometryStatusInAndUpdatedAtBefore(AstrometryStatus.IN_FLIGHT, cutoff);
        if (stuck.isEmpty()) {
            return 0;
        }

        for (Image image : stuck) {
            log.warn("Marking image {} as FAILED: stuck in {} since {}",
                    image.getId(), image.getAstrometryStatus(), image.getUpdatedAt());
            image.markSolveFailed("Timed out: no progress since " + image.getUpdatedAt());
            imageRepository.save(image);
        }
        log.info("Stuck solve sweep failed {} image(s)", stuck.size());
        return stuck.size();
    }
}
