package com.starscape.astrocat.common.wcs;

/**
 * Tangent-plane (gnomonic) projection about a reference sky point.
 * Intermediate world coordinates (xi, eta) are in degrees.
 */
final class GnomonicProjection {

    private final double ra0;
    private final double sinDec0;
    private final double cosDec0;
    private final double ra0Degrees;
    private final double dec0Degrees;

    GnomonicProjection(double ra0Degrees, double dec0Degrees) {
        this.ra0Degrees = ra0Degrees;
        this.dec0Degrees = dec0Degrees;
        this.ra0 = Math.toRadians(ra0Degrees);
        double dec0 = Math.toRadians(dec0Degrees);
        this.sinDec0 = Math.sin(dec0);
        this.cosDec0 = Math.cos(dec0);
    }

    double[] project(double raDegrees, double decDegrees) {
        if (!Double.isFinite(raDegrees) || !Double.isFinite(decDegrees)) {
            throw new ProjectionException("Non-finite sky coordinate: " + raDegrees + ", " + decDegrees);
        }
        double dec = Math.toRadians(decDegrees);
        double dRa = Math.toRadians(raDegrees) - ra0;
        double sinDec = Math.sin(dec);
        double cosDec = Math.cos(dec);
        double cosDRa = Math.cos(dRa);

        double cosC = sinDec0 * sinDec + cosDec0 * cosDec * cosDRa;
        if (cosC <= 1e-12) {
            throw new ProjectionException(String.format(
                    "RA=%.6f Dec=%.6f is not on the visible hemisphere of the tangent point (%.6f, %.6f)",
                    raDegrees, decDegrees, ra0Degrees, dec0Degrees));
        }
        double xi = cosDec * Math.sin(dRa) / cosC;
        double eta = (cosDec0 * sinDec - sinDec0 * cosDec * cosDRa) / cosC;
        return new double[] { Math.toDegrees(xi), Math.toDegrees(eta) };
    }

    SkyPoint deproject(double xiDegrees, double etaDegrees) {
        double xi = Math.toRadians(xiDegrees);
        double eta = Math.toRadians(etaDegrees);
        double denominator = cosDec0 - eta * sinDec0;

        double ra = ra0 + Math.atan2(xi, denominator);
        double dec = Math.atan2(sinDec0 + eta * cosDec0, Math.sqrt(xi * xi + denominator * denominator));
        return new SkyPoint(AngularDistance.normalizeDegrees(Math.toDegrees(ra)), Math.toDegrees(dec));
    }
}
