package com.starscape.astrocat.common.wcs;

/**
 * Solved astrometry of one image, as stored alongside the image record.
 * Every field is optional until the image has been solved.
 *
 * @param distortionJson full solver WCS header serialised as a JSON object, when one was fetched
 */
public record AstrometrySummary(
    Double raCenterDegrees,
    Double decCenterDegrees,
    Double fieldRadiusDegrees,
    Double pixelScaleArcsec,
    Double rotationDegrees,
    Integer widthPixels,
    Integer heightPixels,
    Integer parity,
    String distortionJson
) {

    public boolean hasCenter() {
        return raCenterDegrees != null && decCenterDegrees != null;
    }

    public boolean hasDistortion() {
        return distortionJson != null && !distortionJson.isBlank();
    }

    /**
     * True when the summary carries everything the linear tangent-plane model needs.
     */
    public boolean hasLinearSolution() {
        return hasCenter()
                && pixelScaleArcsec != null && pixelScaleArcsec > 0
                && widthPixels != null && widthPixels > 0
                && heightPixels != null && heightPixels > 0;
    }
}
