package com.starscape.astrocat.features.platesolve.domain;

import com.starscape.astrocat.common.wcs.AngularDistance;

/**
 * Solver calibration of a successful job.
 */
public record Calibration(
    double raDegrees,
    double decDegrees,
    Double radiusDegrees,
    Double pixelScaleArcsec,
    Double orientationDegrees,
    Integer parity
) {

    /**
     * Normalise the raw solver values: RA and orientation into [0, 360), parity to its sign.
     */
    public static Calibration of(double ra, double dec, Double radius, Double pixelScale,
                                 Double orientation, Double parity) {
        if (dec < -90 || dec > 90) {
            throw new IllegalArgumentException("Declination out of range: " + dec);
        }
        return new Calibration(
            AngularDistance.normalizeDegrees(ra),
            dec,
            radius,
            pixelScale,
            orientation != null ? AngularDistance.normalizeDegrees(orientation) : null,
            parity == null ? null : (parity < 0 ? -1 : 1)
        );
    }
}
