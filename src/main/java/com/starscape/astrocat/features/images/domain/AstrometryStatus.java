package com.starscape.astrocat.features.images.domain;

import java.util.EnumSet;
import java.util.Set;

public enum AstrometryStatus {
    NONE,
    SUBMITTED,
    PROCESSING,
    SOLVED,
    FAILED;

    public static final Set<AstrometryStatus> IN_FLIGHT = EnumSet.of(SUBMITTED, PROCESSING);

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }
}
