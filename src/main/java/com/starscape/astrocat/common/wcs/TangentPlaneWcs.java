package com.starscape.astrocat.common.wcs;

/**
 * Linear gnomonic WCS: reference pixel, reference sky point and a 2x2 CD matrix.
 * Pixel coordinates follow the raster convention (0-based, y downward).
 */
public final class TangentPlaneWcs implements WcsModel {

    private final GnomonicProjection projection;
    private final double crpixX;
    private final double crpixY;
    private final double cd11;
    private final double cd12;
    private final double cd21;
    private final double cd22;
    private final double inv11;
    private final double inv12;
    private final double inv21;
    private final double inv22;

    public TangentPlaneWcs(double crvalRa, double crvalDec, double crpixX, double crpixY,
                           double cd11, double cd12, double cd21, double cd22) {
        double det = cd11 * cd22 - cd12 * cd21;
        if (!Double.isFinite(det) || Math.abs(det) < 1e-20) {
            throw new IllegalArgumentException("Degenerate CD matrix (determinant " + det + ")");
        }
        if (!Double.isFinite(crvalRa) || !Double.isFinite(crvalDec) || Math.abs(crvalDec) > 90.0) {
            throw new IllegalArgumentException("Invalid reference point: " + crvalRa + ", " + crvalDec);
        }
        this.projection = new GnomonicProjection(crvalRa, crvalDec);
        this.crpixX = crpixX;
        this.crpixY = crpixY;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
        this.inv11 = cd22 / det;
        this.inv12 = -cd12 / det;
        this.inv21 = -cd21 / det;
        this.inv22 = cd11 / det;
    }

    /**
     * Build the model from summary parameters. The reference pixel is the image centre.
     * Increasing x moves toward decreasing RA for parity +1 (east left), increasing y
     * moves toward decreasing declination.
     */
    public static TangentPlaneWcs fromSummary(AstrometrySummary summary) {
        if (!summary.hasLinearSolution()) {
            throw new IllegalArgumentException("Summary is missing centre, scale or dimensions");
        }
        double scale = summary.pixelScaleArcsec() / 3600.0;
        double rotation = Math.toRadians(summary.rotationDegrees() != null ? summary.rotationDegrees() : 0.0);
        int parity = summary.parity() != null && summary.parity() < 0 ? -1 : 1;

        double sx = -scale * parity;
        double sy = -scale;
        double cos = Math.cos(rotation);
        double sin = Math.sin(rotation);

        return new TangentPlaneWcs(
                summary.raCenterDegrees(), summary.decCenterDegrees(),
                summary.widthPixels() / 2.0, summary.heightPixels() / 2.0,
                sx * cos, -sy * sin,
                sx * sin, sy * cos);
    }

    @Override
    public PixelPoint skyToPixel(double raDegrees, double decDegrees) {
        double[] plane = projection.project(raDegrees, decDegrees);
        double dx = inv11 * plane[0] + inv12 * plane[1];
        double dy = inv21 * plane[0] + inv22 * plane[1];
        return new PixelPoint(crpixX + dx, crpixY + dy);
    }

    @Override
    public SkyPoint pixelToSky(double x, double y) {
        double dx = x - crpixX;
        double dy = y - crpixY;
        return projection.deproject(cd11 * dx + cd12 * dy, cd21 * dx + cd22 * dy);
    }
}
