package com.starscape.astrocat.common.wcs;

import java.util.Map;

/**
 * Gnomonic WCS with SIP distortion, built from a solver-supplied FITS header.
 *
 * <p>The header describes the image the solver saw, in 1-based FITS pixels whose rows
 * follow the uploaded raster. When the solver worked on a down-scaled copy
 * ({@code IMAGEW}/{@code IMAGEH} differ from the catalogued size) coordinates are
 * rescaled to the catalogued image. Sky-to-pixel uses the solver's inverse
 * polynomials (AP/BP) in closed form.
 */
public final class SipWcs implements WcsModel {

    private final GnomonicProjection projection;
    private final double crpix1;
    private final double crpix2;
    private final double cd11;
    private final double cd12;
    private final double cd21;
    private final double cd22;
    private final double inv11;
    private final double inv12;
    private final double inv21;
    private final double inv22;
    private final SipPolynomial a;
    private final SipPolynomial b;
    private final SipPolynomial ap;
    private final SipPolynomial bp;
    private final double scaleX;
    private final double scaleY;

    private SipWcs(double crval1, double crval2, double crpix1, double crpix2,
                   double cd11, double cd12, double cd21, double cd22,
                   SipPolynomial a, SipPolynomial b, SipPolynomial ap, SipPolynomial bp,
                   double scaleX, double scaleY) {
        double det = cd11 * cd22 - cd12 * cd21;
        if (!Double.isFinite(det) || Math.abs(det) < 1e-20) {
            throw new IllegalArgumentException("Degenerate CD matrix (determinant " + det + ")");
        }
        if (Math.abs(crval2) > 90.0) {
            throw new IllegalArgumentException("CRVAL2 out of range: " + crval2);
        }
        this.projection = new GnomonicProjection(crval1, crval2);
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
        this.inv11 = cd22 / det;
        this.inv12 = -cd12 / det;
        this.inv21 = -cd21 / det;
        this.inv22 = cd11 / det;
        this.a = a;
        this.b = b;
        this.ap = ap;
        this.bp = bp;
        this.scaleX = scaleX;
        this.scaleY = scaleY;
    }

    /**
     * @param header       FITS header cards keyed by upper-case keyword
     * @param widthPixels  catalogued image width, or null when unknown
     * @param heightPixels catalogued image height, or null when unknown
     * @throws IllegalArgumentException if the header is not a usable TAN or TAN-SIP solution
     */
    public static SipWcs fromHeader(Map<String, Object> header, Integer widthPixels, Integer heightPixels) {
        Object ctype = header.get("CTYPE1");
        if (ctype != null && !ctype.toString().contains("TAN")) {
            throw new IllegalArgumentException("Unsupported projection " + ctype);
        }

        boolean distorted = WcsHeaderValues.has(header, "A_ORDER") || WcsHeaderValues.has(header, "B_ORDER");
        SipPolynomial a = SipPolynomial.none();
        SipPolynomial b = SipPolynomial.none();
        SipPolynomial ap = SipPolynomial.none();
        SipPolynomial bp = SipPolynomial.none();
        if (distorted) {
            // Without the inverse polynomials sky-to-pixel would need an iterative solve
            a = SipPolynomial.fromHeader(header, "A");
            b = SipPolynomial.fromHeader(header, "B");
            ap = SipPolynomial.fromHeader(header, "AP");
            bp = SipPolynomial.fromHeader(header, "BP");
        }

        return new SipWcs(
                WcsHeaderValues.requireNumber(header, "CRVAL1"),
                WcsHeaderValues.requireNumber(header, "CRVAL2"),
                WcsHeaderValues.requireNumber(header, "CRPIX1"),
                WcsHeaderValues.requireNumber(header, "CRPIX2"),
                WcsHeaderValues.requireNumber(header, "CD1_1"),
                WcsHeaderValues.optionalNumber(header, "CD1_2", 0.0),
                WcsHeaderValues.optionalNumber(header, "CD2_1", 0.0),
                WcsHeaderValues.requireNumber(header, "CD2_2"),
                a, b, ap, bp,
                axisScale(header, "IMAGEW", widthPixels),
                axisScale(header, "IMAGEH", heightPixels));
    }

    private static double axisScale(Map<String, Object> header, String key, Integer catalogued) {
        double solved = WcsHeaderValues.optionalNumber(header, key, 0.0);
        if (catalogued == null || catalogued <= 0 || solved <= 0) {
            return 1.0;
        }
        return catalogued / solved;
    }

    @Override
    public PixelPoint skyToPixel(double raDegrees, double decDegrees) {
        double[] plane = projection.project(raDegrees, decDegrees);
        double bigU = inv11 * plane[0] + inv12 * plane[1];
        double bigV = inv21 * plane[0] + inv22 * plane[1];
        double u = bigU + ap.evaluate(bigU, bigV);
        double v = bigV + bp.evaluate(bigU, bigV);
        double fitsX = u + crpix1;
        double fitsY = v + crpix2;
        return new PixelPoint((fitsX - 1.0) * scaleX, (fitsY - 1.0) * scaleY);
    }

    @Override
    public SkyPoint pixelToSky(double x, double y) {
        double u = x / scaleX + 1.0 - crpix1;
        double v = y / scaleY + 1.0 - crpix2;
        double bigU = u + a.evaluate(u, v);
        double bigV = v + b.evaluate(u, v);
        return projection.deproject(cd11 * bigU + cd12 * bigV, cd21 * bigU + cd22 * bigV);
    }
}
