package com.starscape.astrocat.features.images.domain;

/**
 * Plate-solver backend. Both speak the same API; NOVA is the shared public service,
 * LOCAL a self-hosted instance.
 */
public enum SolveProvider {
    NOVA,
    LOCAL
}
