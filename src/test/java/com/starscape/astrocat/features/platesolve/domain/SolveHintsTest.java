package com.starscape.astrocat.features.platesolve.domain;

import com.starscape.astrocat.common.wcs.AstrometrySummary;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SolveHintsTest {

    private static AstrometrySummary summary(Double ra, Double dec, Double radius, Double scale) {
        return new AstrometrySummary(ra, dec, radius, scale, 0.0, 1000, 800, 1, null);
    }

    @Test
    void previousSolutionNarrowsCentreAndScale() {
        SolveHints hints = SolveHints.fromPrevious(summary(83.8, -5.4, 1.2, 2.0));

        assertThat(hints.isBlind()).isFalse();
        assertThat(hints.centerRaDegrees()).isEqualTo(83.8);
        assertThat(hints.centerDecDegrees()).isEqualTo(-5.4);
        assertThat(hints.radiusDegrees()).isEqualTo(1.2);
        assertThat(hints.scaleLowerArcsec()).isCloseTo(1.8, within(1e-9));
        assertThat(hints.scaleUpperArcsec()).isCloseTo(2.2, within(1e-9));
    }

    @Test
    void missingRadiusDefaultsToFiveDegrees() {
        SolveHints hints = SolveHints.fromPrevious(summary(10.0, 41.0, null, null));

        assertThat(hints.radiusDegrees()).isEqualTo(5.0);
        assertThat(hints.scaleLowerArcsec()).isNull();
        assertThat(hints.toRequestFields()).containsOnlyKeys("center_ra", "center_dec", "radius");
    }

    @Test
    void scaleOnlyHintsOmitThePosition() {
        Map<String, Object> fields = SolveHints.fromPrevious(summary(null, null, null, 1.5)).toRequestFields();

        assertThat(fields).containsOnlyKeys("scale_units", "scale_lower", "scale_upper");
        assertThat(fields.get("scale_units")).isEqualTo("arcsecperpix");
    }

    @Test
    void emptySummaryIsABlindSolve() {
        SolveHints hints = SolveHints.fromPrevious(summary(null, null, null, null));

        assertThat(hints).isEqualTo(SolveHints.blind());
        assertThat(hints.isBlind()).isTrue();
        assertThat(hints.toRequestFields()).isEmpty();
    }
}
