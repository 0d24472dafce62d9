package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.progress.BulkProgress;
import com.starscape.astrocat.common.progress.ProgressStore;
import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Queues solve tasks for every eligible image under a path prefix.
 *
 * <p>Images solved from their own headers but never by the solver go first, then unsolved
 * and previously failed images. Planetary images are never queued. With {@code force}, solved
 * images are queued again too. Admission control paces the actual submissions.
 */
@Service
public class BulkSolveHandler {

    public static final String KIND = "plate-solve";

    private static final Logger log = LoggerFactory.getLogger(BulkSolveHandler.class);
    private static final int PROGRESS_EVERY = 50;

    private final ImageRepository imageRepository;
    private final SolveTaskQueue taskQueue;
    private final ProgressStore progressStore;
    private final TaskScheduler taskScheduler;

    public BulkSolveHandler(
            ImageRepository imageRepository,
            SolveTaskQueue taskQueue,
            ProgressStore progressStore,
            @Qualifier("solveTaskScheduler") TaskScheduler taskScheduler) {
        this.imageRepository = imageRepository;
        this.taskQueue = taskQueue;
        this.progressStore = progressStore;
        this.taskScheduler = taskScheduler;
    }

    public BulkProgress start(String pathPrefix, boolean force) {
        String prefix = pathPrefix == null ? "" : pathPrefix;
        BulkProgress started = BulkProgress.started(KIND, prefix);
        if (!progressStore.putIfAbsentOrFinished(started)) {
            throw new IllegalStateException("Bulk plate solve is already running for prefix '" + prefix + "'");
        }
        taskScheduler.schedule(() -> run(prefix, force), Instant.now());
        log.info("Bulk plate solve scheduled: prefix='{}', force={}", prefix, force);
        return started;
    }

    public Optional<BulkProgress> progress(String pathPrefix) {
        return progressStore.find(KIND, pathPrefix == null ? "" : pathPrefix);
    }

    BulkProgress run(String prefix, boolean force) {
        BulkProgress progress = BulkProgress.started(KIND, prefix);
        int processed = 0;
        int queued = 0;
        int skipped = 0;
        int errors = 0;

        try {
            List<Image> images = imageRepository.findByFilePathStartingWithOrderByIdAsc(prefix);
            int total = images.size();
            progress = progress.withCounts(total, 0, 0, 0, 0);
            progressStore.put(progress);

            List<Image> priority = new ArrayList<>();
            List<Image> standard = new ArrayList<>();
            for (Image image : images) {
                if (image.isPlanetary() || image.isSolveInFlight()) {
                    skipped++;
                    processed++;
                } else if (image.isPlateSolved() && image.getAstrometryStatus() != AstrometryStatus.SOLVED) {
                    priority.add(image);
                } else if (force || isUnsolved(image)) {
                    standard.add(image);
                } else {
                    skipped++;
                    processed++;
                }
            }
            log.info("Bulk plate solve for '{}': {} priority, {} standard, {} skipped",
                    prefix, priority.size(), standard.size(), skipped);

            List<Image> ordered = new ArrayList<>(priority);
            ordered.addAll(standard);
            for (Image image : ordered) {
                try {
                    taskQueue.enqueue(SolveTaskMessage.submit(image.getId(), force, 0), Duration.ZERO);
                    queued++;
                } catch (RuntimeException e) {
                    errors++;
                    log.warn("Failed to queue solve for image {}: {}", image.getId(), e.getMessage());
                }
                processed++;
                if (processed % PROGRESS_EVERY == 0) {
                    progress = progress.withCounts(total, processed, queued, skipped, errors);
                    progressStore.put(progress);
                }
            }

            progress = progress.withCounts(total, processed, queued, skipped, errors).completed();
            progressStore.put(progress);
            log.info("Bulk plate solve queued: prefix='{}', total={}, queued={}, skipped={}, errors={}",
                    prefix, total, queued, skipped, errors);
        } catch (RuntimeException e) {
            log.error("Bulk plate solve aborted for prefix '{}'", prefix, e);
            progress = progress.withCounts(progress.total(), processed, queued, skipped, errors + 1).failed();
            progressStore.put(progress);
        }
        return progress;
    }

    private boolean isUnsolved(Image image) {
        return image.getAstrometryStatus() == AstrometryStatus.FAILED
                || (!image.isPlateSolved() && image.getAstrometryStatus() == AstrometryStatus.NONE);
    }
}
