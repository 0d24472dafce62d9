package com.starscape.astrocat.features.platesolve.domain;

import java.util.Optional;

public interface SolveSettingsRepository {
    SolveSettings save(SolveSettings settings);
    Optional<SolveSettings> findCurrent();

    /**
     * Load the settings row holding a row lock until the surrounding transaction ends.
     */
    Optional<SolveSettings> findCurrentForUpdate();
}
