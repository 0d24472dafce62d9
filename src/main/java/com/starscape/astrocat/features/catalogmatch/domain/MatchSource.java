package com.starscape.astrocat.features.catalogmatch.domain;

/**
 * Provenance of a match. AUTOMATIC rows are owned by the matcher and replaced on every
 * recomputation; the others are never touched by it.
 */
public enum MatchSource {
    AUTOMATIC,
    MANUAL,
    HEADER
}
