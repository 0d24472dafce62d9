package com.starscape.astrocat.common.wcs;

/**
 * Mapping between raster pixel coordinates of an image and celestial coordinates.
 */
public interface WcsModel {

    /**
     * Project a sky position into raster pixel space.
     * @throws ProjectionException if the position cannot be projected
     */
    PixelPoint skyToPixel(double raDegrees, double decDegrees);

    /**
     * Deproject a raster pixel position onto the sky. RA is normalised into [0, 360).
     */
    SkyPoint pixelToSky(double x, double y);
}
