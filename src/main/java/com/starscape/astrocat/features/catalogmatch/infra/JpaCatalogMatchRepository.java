package com.starscape.astrocat.features.catalogmatch.infra;

import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatchRepository;
import com.starscape.astrocat.features.catalogmatch.domain.MatchSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCatalogMatchRepository extends JpaRepository<CatalogMatch, Long>, CatalogMatchRepository {

    @Override
    @Modifying
    @Query("DELETE FROM CatalogMatch m WHERE m.imageId = :imageId AND m.source = :source")
    int deleteByImageIdAndSource(@Param("imageId") Long imageId, @Param("source") MatchSource source);
}
