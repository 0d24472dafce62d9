package com.starscape.astrocat.features.platesolve.api.dto;

import java.time.Instant;

/**
 * Response DTO for an image's plate-solve state and current solution.
 */
public record PlateSolveStatusResponse(
    Long imageId,
    String status,
    boolean plateSolved,
    String plateSolveSource,
    String provider,
    String submissionId,
    String jobId,
    int pollAttempts,
    String error,
    String astrometryUrl,
    Double raCenterDegrees,
    Double decCenterDegrees,
    Double fieldRadiusDegrees,
    Double pixelScaleArcsec,
    Double rotationDegrees,
    Integer parity,
    boolean hasDistortionSolution,
    boolean hasAnnotatedPreview,
    Instant updatedAt
) {}
