package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.Calibration;
import com.starscape.astrocat.features.platesolve.domain.SolveHints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Every write the solve workflow makes to an image. Each transition locks the image row
 * and re-checks the state it expects, so a stale task (superseded submission, reaped
 * image) becomes a no-op instead of overwriting newer state.
 */
@Service
@Transactional
public class SolveStateTransitions {

    private static final Logger log = LoggerFactory.getLogger(SolveStateTransitions.class);

    private final ImageRepository imageRepository;

    public SolveStateTransitions(ImageRepository imageRepository) {
        this.imageRepository = imageRepository;
    }

    /**
     * Move the image to SUBMITTED unless a run is already in flight, or the image is
     * already solved and {@code force} is false.
     */
    public SolveClaim claim(Long imageId, SolveProvider provider, boolean force) {
        Image image = imageRepository.findByIdForUpdate(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));

        AstrometryStatus previous = image.getAstrometryStatus();
        if (previous.isInFlight() || (previous == AstrometryStatus.SOLVED && !force)) {
            log.info("Solve already started for image {} (status {})", imageId, previous);
            return SolveClaim.alreadyStarted(imageId, previous);
        }

        SolveHints hints;
        if (previous == AstrometryStatus.FAILED) {
            log.info("Previous solve of image {} failed; submitting blind", imageId);
            hints = SolveHints.blind();
        } else {
            hints = SolveHints.fromPrevious(image.toAstrometrySummary());
        }

        image.claimForSolve(provider);
        imageRepository.save(image);
        log.info("Image {} claimed for solving: provider={}, previousStatus={}", imageId, provider, previous);
        return new SolveClaim(SolveClaim.Outcome.CLAIMED, imageId, image.getFilePath(), provider, previous, hints);
    }

    public boolean recordSubmission(Long imageId, String submissionId) {
        Optional<Image> found = imageRepository.findByIdForUpdate(imageId);
        if (found.isEmpty() || found.get().getAstrometryStatus() != AstrometryStatus.SUBMITTED) {
            log.warn("Submission {} arrived for image {} which is no longer SUBMITTED", submissionId, imageId);
            return false;
        }
        Image image = found.get();
        image.recordSubmission(submissionId);
        imageRepository.save(image);
        log.info("Image {} submitted: submissionId={}", imageId, submissionId);
        return true;
    }

    /**
     * Count a poll of {@code submissionId}. Empty when the image has moved on and the
     * poll chain should stop.
     */
    public Optional<PollTicket> beginPoll(Long imageId, String submissionId) {
        Optional<Image> found = findInFlight(imageId, submissionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Image image = found.get();
        int attempt = image.recordPollAttempt();
        imageRepository.save(image);
        return Optional.of(new PollTicket(image.getSolveProvider(), attempt, image.getJobId()));
    }

    public void markProcessing(Long imageId, String submissionId, String jobId) {
        findInFlight(imageId, submissionId).ifPresent(image -> {
            if (!jobId.equals(image.getJobId())) {
                image.markSolveProcessing(jobId);
                imageRepository.save(image);
                log.info("Image {} processing: jobId={}", imageId, jobId);
            }
        });
    }

    /**
     * @param expectedSubmissionId null when the run failed before the solver issued an id
     */
    public boolean markFailed(Long imageId, String expectedSubmissionId, String reason) {
        Optional<Image> found = findInFlight(imageId, expectedSubmissionId);
        if (found.isEmpty()) {
            return false;
        }
        Image image = found.get();
        image.markSolveFailed(reason);
        imageRepository.save(image);
        log.warn("Image {} solve failed: {}", imageId, reason);
        return true;
    }

    public boolean markSolved(Long imageId, String submissionId, Calibration calibration,
                              String wcsHeaderJson, String astrometryUrl) {
        Optional<Image> found = findInFlight(imageId, submissionId);
        if (found.isEmpty()) {
            log.warn("Discarding calibration for image {}: submission {} is no longer current", imageId, submissionId);
            return false;
        }
        Image image = found.get();
        image.markSolved(
                calibration.raDegrees(),
                calibration.decDegrees(),
                calibration.radiusDegrees(),
                calibration.pixelScaleArcsec(),
                calibration.orientationDegrees(),
                calibration.parity(),
                wcsHeaderJson,
                astrometryUrl);
        imageRepository.save(image);
        log.info("Image {} solved: ra={}, dec={}, radius={}, scale={}",
                imageId, calibration.raDegrees(), calibration.decDegrees(),
                calibration.radiusDegrees(), calibration.pixelScaleArcsec());
        return true;
    }

    public void attachAnnotatedPreview(Long imageId, String s3Key) {
        imageRepository.findByIdForUpdate(imageId).ifPresent(image -> {
            image.attachAnnotatedPreview(s3Key);
            imageRepository.save(image);
        });
    }

    private Optional<Image> findInFlight(Long imageId, String submissionId) {
        return imageRepository.findByIdForUpdate(imageId)
                .filter(Image::isSolveInFlight)
                .filter(image -> submissionId == null || Objects.equals(submissionId, image.getSubmissionId()));
    }
}
