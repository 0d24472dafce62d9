package com.starscape.astrocat.features.catalog.infra;

import com.starscape.astrocat.features.catalog.domain.NgcObject;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JpaNgcCatalogRepository extends JpaRepository<NgcObject, Integer> {

    Optional<NgcObject> findByDesignation(String designation);

    @Query(value = "SELECT designation, separation FROM ("
            + "SELECT designation, DEGREES(2 * ASIN(LEAST(1.0, SQRT("
            + "POWER(SIN(RADIANS(dec_degrees - :dec) / 2), 2) "
            + "+ COS(RADIANS(:dec)) * COS(RADIANS(dec_degrees)) * POWER(SIN(RADIANS(ra_degrees - :ra) / 2), 2)"
            + ")))) AS separation "
            + "FROM ngc_catalog WHERE dec_degrees BETWEEN :decMin AND :decMax) hits "
            + "WHERE separation <= :radius ORDER BY separation, designation LIMIT :maxResults",
            nativeQuery = true)
    List<CatalogHitView> findWithinRadius(
            @Param("ra") double ra,
            @Param("dec") double dec,
            @Param("radius") double radius,
            @Param("decMin") double decMin,
            @Param("decMax") double decMax,
            @Param("maxResults") int maxResults);

    @Query("SELECT n FROM NgcObject n WHERE n.icDesignation = :designation ORDER BY n.id")
    List<NgcObject> findByIcDesignation(@Param("designation") String designation);
}
