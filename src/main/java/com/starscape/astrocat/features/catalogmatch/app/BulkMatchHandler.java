package com.starscape.astrocat.features.catalogmatch.app;

import com.starscape.astrocat.common.progress.BulkProgress;
import com.starscape.astrocat.common.progress.ProgressStore;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Re-runs catalog matching for every plate-solved image under a path prefix.
 * The sweep runs in the background; progress is published to the {@link ProgressStore}.
 */
@Service
public class BulkMatchHandler {

    public static final String KIND = "catalog-match";

    private static final Logger log = LoggerFactory.getLogger(BulkMatchHandler.class);
    private static final int PROGRESS_EVERY = 10;

    private final ImageRepository imageRepository;
    private final CatalogMatcher catalogMatcher;
    private final ProgressStore progressStore;
    private final TaskScheduler taskScheduler;

    public BulkMatchHandler(
            ImageRepository imageRepository,
            CatalogMatcher catalogMatcher,
            ProgressStore progressStore,
            @Qualifier("solveTaskScheduler") TaskScheduler taskScheduler) {
        this.imageRepository = imageRepository;
        this.catalogMatcher = catalogMatcher;
        this.progressStore = progressStore;
        this.taskScheduler = taskScheduler;
    }

    /**
     * @throws IllegalStateException if a sweep over the same prefix is still running
     */
    public BulkProgress start(String pathPrefix) {
        String prefix = pathPrefix == null ? "" : pathPrefix;
        BulkProgress started = BulkProgress.started(KIND, prefix);
        if (!progressStore.putIfAbsentOrFinished(started)) {
            throw new IllegalStateException("Catalog matching is already running for prefix '" + prefix + "'");
        }
        taskScheduler.schedule(() -> run(prefix), Instant.now());
        log.info("Bulk catalog matching scheduled: prefix='{}'", prefix);
        return started;
    }

    public Optional<BulkProgress> progress(String pathPrefix) {
        return progressStore.find(KIND, pathPrefix == null ? "" : pathPrefix);
    }

    BulkProgress run(String prefix) {
        BulkProgress progress = BulkProgress.started(KIND, prefix);
        int processed = 0;
        int matched = 0;
        int skipped = 0;
        int errors = 0;

        try {
            List<Image> images = imageRepository.findByFilePathStartingWithOrderByIdAsc(prefix);
            int total = images.size();
            progress = progress.withCounts(total, 0, 0, 0, 0);
            progressStore.put(progress);

            for (Image image : images) {
                if (!image.isPlateSolved()) {
                    skipped++;
                } else {
                    try {
                        MatchOutcome outcome = catalogMatcher.matchImage(image.getId());
                        if (outcome.skipped()) {
                            skipped++;
                        } else {
                            matched++;
                            if (!outcome.allCatalogsQueried()) {
                                errors++;
                            }
                        }
                    } catch (RuntimeException e) {
                        errors++;
                        log.warn("Catalog matching failed for image {}: {}", image.getId(), e.getMessage());
                    }
                }
                processed++;
                if (processed % PROGRESS_EVERY == 0) {
                    progress = progress.withCounts(total, processed, matched, skipped, errors);
                    progressStore.put(progress);
                }
            }

            progress = progress.withCounts(total, processed, matched, skipped, errors).completed();
            progressStore.put(progress);
            log.info("Bulk catalog matching finished: prefix='{}', total={}, matched={}, skipped={}, errors={}",
                    prefix, total, matched, skipped, errors);
        } catch (RuntimeException e) {
            log.error("Bulk catalog matching aborted for prefix '{}'", prefix, e);
            progress = progress.withCounts(progress.total(), processed, matched, skipped, errors + 1).failed();
            progressStore.put(progress);
        }
        return progress;
    }
}
