package com.starscape.astrocat.common.wcs;

/**
 * Raised when a single coordinate cannot be projected through a WCS model,
 * for example a sky position on the far side of the tangent point.
 */
public class ProjectionException extends RuntimeException {

    public ProjectionException(String message) {
        super(message);
    }
}
