package com.starscape.astrocat.features.platesolve.domain;

import com.starscape.astrocat.common.wcs.AstrometrySummary;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional position and scale hints narrowing the solver's search.
 * A hint with every field null is a blind solve.
 */
public record SolveHints(
    Double centerRaDegrees,
    Double centerDecDegrees,
    Double radiusDegrees,
    Double scaleLowerArcsec,
    Double scaleUpperArcsec
) {

    static final double DEFAULT_RADIUS_DEGREES = 5.0;
    static final double SCALE_TOLERANCE = 0.1;

    public static SolveHints blind() {
        return new SolveHints(null, null, null, null, null);
    }

    /**
     * Hints from a previous solution: centre within the previous radius (or 5 degrees),
     * pixel scale within 10%.
     */
    public static SolveHints fromPrevious(AstrometrySummary summary) {
        Double ra = null;
        Double dec = null;
        Double radius = null;
        if (summary.hasCenter()) {
            ra = summary.raCenterDegrees();
            dec = summary.decCenterDegrees();
            radius = summary.fieldRadiusDegrees() != null && summary.fieldRadiusDegrees() > 0
                    ? summary.fieldRadiusDegrees()
                    : DEFAULT_RADIUS_DEGREES;
        }
        Double lower = null;
        Double upper = null;
        if (summary.pixelScaleArcsec() != null && summary.pixelScaleArcsec() > 0) {
            lower = summary.pixelScaleArcsec() * (1 - SCALE_TOLERANCE);
            upper = summary.pixelScaleArcsec() * (1 + SCALE_TOLERANCE);
        }
        return new SolveHints(ra, dec, radius, lower, upper);
    }

    public boolean isBlind() {
        return centerRaDegrees == null && scaleLowerArcsec == null;
    }

    /**
     * Fields in the solver's upload request vocabulary.
     */
    public Map<String, Object> toRequestFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (centerRaDegrees != null && centerDecDegrees != null) {
            fields.put("center_ra", centerRaDegrees);
            fields.put("center_dec", centerDecDegrees);
            fields.put("radius", radiusDegrees != null ? radiusDegrees : DEFAULT_RADIUS_DEGREES);
        }
        if (scaleLowerArcsec != null && scaleUpperArcsec != null) {
            fields.put("scale_units", "arcsecperpix");
            fields.put("scale_lower", scaleLowerArcsec);
            fields.put("scale_upper", scaleUpperArcsec);
        }
        return fields;
    }
}
