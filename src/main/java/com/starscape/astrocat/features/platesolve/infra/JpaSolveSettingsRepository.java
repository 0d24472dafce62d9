package com.starscape.astrocat.features.platesolve.infra;

import com.starscape.astrocat.features.platesolve.domain.SolveSettings;
import com.starscape.astrocat.features.platesolve.domain.SolveSettingsRepository;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaSolveSettingsRepository extends JpaRepository<SolveSettings, Integer>, SolveSettingsRepository {

    @Override
    @Query("SELECT s FROM SolveSettings s WHERE s.id = 1")
    Optional<SolveSettings> findCurrent();

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SolveSettings s WHERE s.id = 1")
    Optional<SolveSettings> findCurrentForUpdate();
}
