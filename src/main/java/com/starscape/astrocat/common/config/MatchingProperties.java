package com.starscape.astrocat.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for catalog matching.
 * Binds to app.matching.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.matching")
public class MatchingProperties {

    private double defaultRadiusDegrees = 1.0;
    private double boundsMarginPixels = 100;
    private double confidenceNormalizationDegrees = 5.0;
    private int messierLimit = 0;
    private int ngcLimit = 50;
    private int namedStarLimit = 50;

    public double getDefaultRadiusDegrees() {
        return defaultRadiusDegrees;
    }

    public void setDefaultRadiusDegrees(double defaultRadiusDegrees) {
        this.defaultRadiusDegrees = defaultRadiusDegrees;
    }

    public double getBoundsMarginPixels() {
        return boundsMarginPixels;
    }

    public void setBoundsMarginPixels(double boundsMarginPixels) {
        this.boundsMarginPixels = boundsMarginPixels;
    }

    public double getConfidenceNormalizationDegrees() {
        return confidenceNormalizationDegrees;
    }

    public void setConfidenceNormalizationDegrees(double confidenceNormalizationDegrees) {
        this.confidenceNormalizationDegrees = confidenceNormalizationDegrees;
    }

    public int getMessierLimit() {
        return messierLimit;
    }

    public void setMessierLimit(int messierLimit) {
        this.messierLimit = messierLimit;
    }

    public int getNgcLimit() {
        return ngcLimit;
    }

    public void setNgcLimit(int ngcLimit) {
        this.ngcLimit = ngcLimit;
    }

    public int getNamedStarLimit() {
        return namedStarLimit;
    }

    public void setNamedStarLimit(int namedStarLimit) {
        this.namedStarLimit = namedStarLimit;
    }

    /**
     * Linear confidence decay with separation from the image centre, clamped to [0, 1].
     */
    public double confidenceFor(double separationDegrees) {
        return Math.max(0.0, Math.min(1.0, 1.0 - separationDegrees / confidenceNormalizationDegrees));
    }
}
