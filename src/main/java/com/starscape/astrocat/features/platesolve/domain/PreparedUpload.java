package com.starscape.astrocat.features.platesolve.domain;

/**
 * Image bytes ready to be posted to a solver.
 */
public record PreparedUpload(
    String fileName,
    String contentType,
    byte[] content
) {}
