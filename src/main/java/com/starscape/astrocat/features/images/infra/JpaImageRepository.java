package com.starscape.astrocat.features.images.infra;

import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface JpaImageRepository extends JpaRepository<Image, Long>, ImageRepository {

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Image i WHERE i.id = :id")
    Optional<Image> findByIdForUpdate(@Param("id") Long id);

    /**
     * Locks the rows so a sweep waits for, then re-evaluates against, any transition in progress.
     */
    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<Image> findByAstrometryStatusInAndUpdatedAtBefore(Collection<AstrometryStatus> statuses, Instant cutoff);
}
