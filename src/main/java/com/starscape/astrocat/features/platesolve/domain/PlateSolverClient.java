package com.starscape.astrocat.features.platesolve.domain;

import com.starscape.astrocat.features.images.domain.SolveProvider;

import java.util.List;
import java.util.Map;

/**
 * Protocol shared by the public and the self-hosted astrometry endpoints.
 * Every call may throw {@link PlateSolverException}.
 */
public interface PlateSolverClient {

    SolveProvider provider();

    boolean isConfigured();

    String apiKey();

    /**
     * @return session token for subsequent uploads
     */
    String login(String apiKey);

    /**
     * @return the solver's submission id
     */
    String upload(String session, PreparedUpload upload, SolveHints hints);

    /**
     * Job ids created for a submission so far; empty while the solver is still queueing it.
     */
    List<String> getSubmissionJobs(String submissionId);

    JobState getJobStatus(String jobId);

    Calibration getCalibration(String jobId);

    /**
     * FITS header cards of the job's WCS file, including SIP terms when the solver fitted them.
     */
    Map<String, Object> getDistortionSolution(String jobId);

    byte[] downloadAnnotatedPreview(String jobId);

    String statusPageUrl(String submissionId);
}
