package com.starscape.astrocat.features.platesolve.domain;

public enum JobState {
    PENDING,
    SUCCESS,
    FAILURE
}
