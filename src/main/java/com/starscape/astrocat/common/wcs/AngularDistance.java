package com.starscape.astrocat.common.wcs;

/**
 * Spherical geometry helpers shared by matching and projection code.
 */
public final class AngularDistance {

    private AngularDistance() {
    }

    /**
     * Great-circle separation in degrees (haversine form, stable for small angles).
     */
    public static double separationDegrees(double ra1, double dec1, double ra2, double dec2) {
        double phi1 = Math.toRadians(dec1);
        double phi2 = Math.toRadians(dec2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(ra2 - ra1);

        double h = Math.pow(Math.sin(dPhi / 2), 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.pow(Math.sin(dLambda / 2), 2);
        return Math.toDegrees(2 * Math.asin(Math.min(1.0, Math.sqrt(h))));
    }

    public static double normalizeDegrees(double degrees) {
        double normalized = degrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        // collapses -0.0, and tiny negatives that round up to 360
        return normalized >= 360.0 ? 0.0 : normalized + 0.0;
    }
}
