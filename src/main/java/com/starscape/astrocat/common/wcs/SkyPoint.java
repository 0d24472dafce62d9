package com.starscape.astrocat.common.wcs;

/**
 * Celestial position in degrees (J2000).
 */
public record SkyPoint(double raDegrees, double decDegrees) {
}
