package com.starscape.astrocat.common.wcs;

/**
 * Raster pixel position: origin at the top-left corner, y grows downward.
 */
public record PixelPoint(double x, double y) {

    public boolean isWithin(int width, int height, double margin) {
        return x >= -margin && x <= width + margin
                && y >= -margin && y <= height + margin;
    }
}
