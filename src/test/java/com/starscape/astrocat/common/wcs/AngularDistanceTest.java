package com.starscape.astrocat.common.wcs;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AngularDistanceTest {

    @Test
    void separationAlongDeclinationIsTheDeclinationDifference() {
        assertThat(AngularDistance.separationDegrees(10.0, 41.0, 10.0, 42.0)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void separationAlongEquatorIsTheRaDifference() {
        assertThat(AngularDistance.separationDegrees(0.0, 0.0, 1.0, 0.0)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void separationHandlesRaWrapAround() {
        assertThat(AngularDistance.separationDegrees(359.5, 0.0, 0.5, 0.0)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void raSeparationShrinksTowardThePole() {
        double atDec60 = AngularDistance.separationDegrees(0.0, 60.0, 1.0, 60.0);

        assertThat(atDec60).isCloseTo(0.5, within(1e-3));
    }

    @Test
    void identicalPointsHaveZeroSeparation() {
        assertThat(AngularDistance.separationDegrees(83.82, -5.39, 83.82, -5.39)).isZero();
    }

    @Test
    void normalizeWrapsIntoZeroTo360() {
        assertThat(AngularDistance.normalizeDegrees(-10.0)).isEqualTo(350.0);
        assertThat(AngularDistance.normalizeDegrees(360.0)).isEqualTo(0.0);
        assertThat(AngularDistance.normalizeDegrees(725.0)).isCloseTo(5.0, within(1e-9));
        assertThat(AngularDistance.normalizeDegrees(-0.0)).isEqualTo(0.0);
    }
}
