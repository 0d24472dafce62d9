package com.starscape.astrocat.features.images.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ImageRepository {
    Image save(Image image);
    Optional<Image> findById(Long id);

    /**
     * Load the image holding a row lock until the surrounding transaction ends.
     */
    Optional<Image> findByIdForUpdate(Long id);

    long countByAstrometryStatusIn(Collection<AstrometryStatus> statuses);
    List<Image> findByAstrometryStatusInAndUpdatedAtBefore(Collection<AstrometryStatus> statuses, Instant cutoff);
    List<Image> findByFilePathStartingWithOrderByIdAsc(String pathPrefix);
}
