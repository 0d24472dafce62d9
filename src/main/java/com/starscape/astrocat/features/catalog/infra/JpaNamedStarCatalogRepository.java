package com.starscape.astrocat.features.catalog.infra;

import com.starscape.astrocat.features.catalog.domain.NamedStar;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaNamedStarCatalogRepository extends JpaRepository<NamedStar, Integer> {

    Optional<NamedStar> findByDesignation(String designation);

    @Query(value = "SELECT designation, separation FROM ("
            + "SELECT designation, DEGREES(2 * ASIN(LEAST(1.0, SQRT("
            + "POWER(SIN(RADIANS(dec_degrees - :dec) / 2), 2) "
            + "+ COS(RADIANS(:dec)) * COS(RADIANS(dec_degrees)) * POWER(SIN(RADIANS(ra_degrees - :ra) / 2), 2)"
            + ")))) AS separation "
            + "FROM named_star_catalog WHERE dec_degrees BETWEEN :decMin AND :decMax) hits "
            + "WHERE separation <= :radius ORDER BY separation, designation LIMIT :maxResults",
            nativeQuery = true)
    List<CatalogHitView> findWithinRadius(
            @Param("ra") double ra,
            @Param("dec") double dec,
            @Param("radius") double radius,
            @Param("decMin") double decMin,
            @Param("decMax") double decMax,
            @Param("maxResults") int maxResults);

    @Query(value = "SELECT * FROM named_star_catalog "
            + "WHERE UPPER(REPLACE(designation, ' ', '')) = :normalized ORDER BY id LIMIT 1",
            nativeQuery = true)
    Optional<NamedStar> findByNormalizedDesignation(@Param("normalized") String normalized);
}
