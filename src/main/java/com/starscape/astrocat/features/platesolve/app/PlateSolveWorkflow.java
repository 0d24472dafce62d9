package com.starscape.astrocat.features.platesolve.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.catalogmatch.app.CatalogMatcher;
import com.starscape.astrocat.features.catalogmatch.app.MatchOutcome;
import com.starscape.astrocat.features.platesolve.domain.Calibration;
import com.starscape.astrocat.features.platesolve.domain.JobState;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverClient;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import com.starscape.astrocat.features.platesolve.domain.PreparedUpload;
import com.starscape.astrocat.features.platesolve.infra.UploadImagePreparer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The plate-solve state machine: NONE to SUBMITTED to PROCESSING to SOLVED or FAILED.
 *
 * <p>Submission is admitted by {@link SolveAdmissionController}, then the image is uploaded
 * synchronously. Monitoring is a chain of POLL tasks, one per interval, each of which reads and
 * advances state persisted on the image; no worker is held while the solver works. On success
 * the calibration and distortion solution are stored, the catalog matcher runs, and the annotated
 * preview is fetched. Failures after SOLVED are logged and never revert it.
 */
@Service
public class PlateSolveWorkflow {

    private static final Logger log = LoggerFactory.getLogger(PlateSolveWorkflow.class);
    private static final int MAX_RETRY_DELAY_SECONDS = 900;

    private final SolveAdmissionController admissionController;
    private final SolveStateTransitions transitions;
    private final PlateSolverClients clients;
    private final UploadImagePreparer uploadPreparer;
    private final SolveTaskQueue taskQueue;
    private final CatalogMatcher catalogMatcher;
    private final AnnotatedPreviewService annotatedPreviewService;
    private final ObjectMapper objectMapper;
    private final AstrometryProperties properties;

    public PlateSolveWorkflow(
            SolveAdmissionController admissionController,
            SolveStateTransitions transitions,
            PlateSolverClients clients,
            UploadImagePreparer uploadPreparer,
            SolveTaskQueue taskQueue,
            CatalogMatcher catalogMatcher,
            AnnotatedPreviewService annotatedPreviewService,
            ObjectMapper objectMapper,
            AstrometryProperties properties) {
        this.admissionController = admissionController;
        this.transitions = transitions;
        this.clients = clients;
        this.uploadPreparer = uploadPreparer;
        this.taskQueue = taskQueue;
        this.catalogMatcher = catalogMatcher;
        this.annotatedPreviewService = annotatedPreviewService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Admit, claim and upload one image. A denied admission re-enqueues the request.
     *
     * @param attempt number of earlier submissions of this request that failed transiently
     */
    public SolveRequestResult submit(Long imageId, boolean force, int attempt) {
        AdmissionDecision<SolveClaim> decision = admissionController.tryAdmit(settings ->
                transitions.claim(imageId, clients.resolve(settings.getProvider()).provider(), force));

        if (!decision.granted()) {
            taskQueue.enqueue(SolveTaskMessage.submit(imageId, force, attempt),
                    Duration.ofSeconds(decision.retryAfterSeconds()));
            log.info("Solve of image {} deferred {}s: {}", imageId, decision.retryAfterSeconds(), decision.reason());
            return SolveRequestResult.deferred(imageId, decision.retryAfterSeconds(), decision.reason());
        }

        SolveClaim claim = decision.value();
        if (!claim.claimed()) {
            return SolveRequestResult.alreadyStarted(imageId);
        }

        PlateSolverClient client = clients.forProvider(claim.provider());
        String submissionId;
        try {
            PreparedUpload upload = uploadPreparer.prepare(claim.filePath());
            String session = client.login(client.apiKey());
            log.info("Uploading image {} to {} (hints: {})",
                    imageId, client.provider(), claim.hints().isBlind() ? "none" : claim.hints().toRequestFields());
            submissionId = client.upload(session, upload, claim.hints());
        } catch (PlateSolverException e) {
            return handleUploadFailure(imageId, force, attempt, e);
        } catch (RuntimeException e) {
            log.error("Upload of image {} failed unexpectedly", imageId, e);
            transitions.markFailed(imageId, null, "Upload failed: " + e.getMessage());
            return SolveRequestResult.failed(imageId, null, e.getMessage());
        }

        if (!transitions.recordSubmission(imageId, submissionId)) {
            return SolveRequestResult.failed(imageId, null, "Image left SUBMITTED before the upload completed");
        }

        taskQueue.enqueue(SolveTaskMessage.poll(imageId, submissionId), pollInterval());
        return SolveRequestResult.submitted(imageId, submissionId);
    }

    /**
     * Check one submission once. Stops silently if the image no longer carries this submission.
     */
    public void poll(Long imageId, String submissionId) {
        Optional<PollTicket> ticket = transitions.beginPoll(imageId, submissionId);
        if (ticket.isEmpty()) {
            log.debug("Poll of submission {} for image {} is stale; stopping", submissionId, imageId);
            return;
        }

        int attempt = ticket.get().attempt();
        if (attempt > properties.getMaxPollAttempts()) {
            String reason = ticket.get().jobId() == null
                    ? "Timed out waiting for the solver to start a job"
                    : "Timed out waiting for job " + ticket.get().jobId();
            transitions.markFailed(imageId, submissionId, reason);
            return;
        }

        PlateSolverClient client = clients.forProvider(ticket.get().provider());
        log.debug("Polling submission {} for image {} (attempt {})", submissionId, imageId, attempt);
        try {
            List<String> jobs = client.getSubmissionJobs(submissionId);
            if (jobs.isEmpty()) {
                reschedulePoll(imageId, submissionId);
                return;
            }

            String jobId = jobs.get(0);
            transitions.markProcessing(imageId, submissionId, jobId);

            JobState state = client.getJobStatus(jobId);
            switch (state) {
                case SUCCESS -> finalizeSolve(imageId, submissionId, jobId, client);
                case FAILURE -> transitions.markFailed(imageId, submissionId, "Solver job " + jobId + " failed");
                case PENDING -> reschedulePoll(imageId, submissionId);
            }
        } catch (PlateSolverException e) {
            log.warn("Poll of submission {} for image {} failed: {}", submissionId, imageId, e.getMessage());
            reschedulePoll(imageId, submissionId);
        }
    }

    private void finalizeSolve(Long imageId, String submissionId, String jobId, PlateSolverClient client) {
        Calibration calibration;
        try {
            calibration = client.getCalibration(jobId);
        } catch (PlateSolverException e) {
            if (e.isTransient()) {
                log.warn("Calibration fetch for job {} failed, will retry: {}", jobId, e.getMessage());
                reschedulePoll(imageId, submissionId);
            } else {
                transitions.markFailed(imageId, submissionId, "Invalid calibration: " + e.getMessage());
            }
            return;
        }

        String wcsHeaderJson = fetchDistortionJson(imageId, jobId, client);

        if (!transitions.markSolved(imageId, submissionId, calibration, wcsHeaderJson,
                client.statusPageUrl(submissionId))) {
            return;
        }

        try {
            MatchOutcome outcome = catalogMatcher.matchImage(imageId);
            if (!outcome.allCatalogsQueried()) {
                log.warn("Catalog matching for image {} was partial: failed={}", imageId, outcome.catalogsFailed());
            }
        } catch (RuntimeException e) {
            log.error("Catalog matching failed for solved image {}", imageId, e);
        }

        annotatedPreviewService.fetchAndStoreQuietly(imageId, jobId, client);
    }

    private String fetchDistortionJson(Long imageId, String jobId, PlateSolverClient client) {
        try {
            Map<String, Object> header = client.getDistortionSolution(jobId);
            if (header.isEmpty()) {
                return null;
            }
            return objectMapper.writeValueAsString(header);
        } catch (PlateSolverException | JsonProcessingException e) {
            log.error("Failed to fetch WCS file for image {} (job {}): {}", imageId, jobId, e.getMessage());
            return null;
        }
    }

    private SolveRequestResult handleUploadFailure(Long imageId, boolean force, int attempt, PlateSolverException e) {
        transitions.markFailed(imageId, null, "Upload failed: " + e.getMessage());

        if (e.isTransient() && attempt < properties.getSubmitMaxRetries()) {
            int delay = retryDelaySeconds(attempt);
            taskQueue.enqueue(SolveTaskMessage.submit(imageId, force, attempt + 1), Duration.ofSeconds(delay));
            log.warn("Upload of image {} failed (attempt {}), retrying in {}s: {}",
                    imageId, attempt + 1, delay, e.getMessage());
            return SolveRequestResult.failed(imageId, delay, e.getMessage());
        }

        log.error("Upload of image {} failed permanently: {}", imageId, e.getMessage());
        return SolveRequestResult.failed(imageId, null, e.getMessage());
    }

    int retryDelaySeconds(int attempt) {
        long delay = (long) properties.getSubmitRetryBaseSeconds() << Math.min(attempt, 10);
        return (int) Math.min(delay, MAX_RETRY_DELAY_SECONDS);
    }

    private void reschedulePoll(Long imageId, String submissionId) {
        taskQueue.enqueue(SolveTaskMessage.poll(imageId, submissionId), pollInterval());
    }

    private Duration pollInterval() {
        return Duration.ofSeconds(properties.getPollIntervalSeconds());
    }
}
