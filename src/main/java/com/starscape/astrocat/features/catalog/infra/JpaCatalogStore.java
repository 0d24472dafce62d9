package com.starscape.astrocat.features.catalog.infra;

import com.starscape.astrocat.common.config.MatchingProperties;
import com.starscape.astrocat.features.catalog.domain.CatalogCandidate;
import com.starscape.astrocat.features.catalog.domain.CatalogEntry;
import com.starscape.astrocat.features.catalog.domain.CatalogStore;
import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import com.starscape.astrocat.features.catalog.domain.MessierObject;
import com.starscape.astrocat.features.catalog.domain.NamedStar;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Catalog store backed by the three catalog tables. Radius searches use a haversine
 * expression with a declination band prefilter.
 */
@Component
@Transactional(readOnly = true)
public class JpaCatalogStore implements CatalogStore {

    private final JpaMessierCatalogRepository messierRepository;
    private final JpaNgcCatalogRepository ngcRepository;
    private final JpaNamedStarCatalogRepository namedStarRepository;
    private final MatchingProperties matchingProperties;

    public JpaCatalogStore(
            JpaMessierCatalogRepository messierRepository,
            JpaNgcCatalogRepository ngcRepository,
            JpaNamedStarCatalogRepository namedStarRepository,
            MatchingProperties matchingProperties) {
        this.messierRepository = messierRepository;
        this.ngcRepository = ngcRepository;
        this.namedStarRepository = namedStarRepository;
        this.matchingProperties = matchingProperties;
    }

    @Override
    public List<CatalogCandidate> findWithinRadius(CatalogVariant variant, double raDegrees, double decDegrees,
                                                   double radiusDegrees) {
        if (!(radiusDegrees > 0) || radiusDegrees > 180) {
            throw new IllegalArgumentException("Search radius must be in (0, 180] degrees: " + radiusDegrees);
        }
        if (decDegrees < -90 || decDegrees > 90) {
            throw new IllegalArgumentException("Declination out of range: " + decDegrees);
        }
        double decMin = Math.max(-90.0, decDegrees - radiusDegrees);
        double decMax = Math.min(90.0, decDegrees + radiusDegrees);

        List<CatalogHitView> hits = switch (variant) {
            case MESSIER -> messierRepository.findWithinRadius(raDegrees, decDegrees, radiusDegrees,
                    decMin, decMax, cap(matchingProperties.getMessierLimit()));
            case NGC -> ngcRepository.findWithinRadius(raDegrees, decDegrees, radiusDegrees,
                    decMin, decMax, cap(matchingProperties.getNgcLimit()));
            case NAMED_STAR -> namedStarRepository.findWithinRadius(raDegrees, decDegrees, radiusDegrees,
                    decMin, decMax, cap(matchingProperties.getNamedStarLimit()));
            case IC -> throw new IllegalArgumentException("Catalog " + variant + " is not searchable");
        };

        return hits.stream()
                .map(hit -> new CatalogCandidate(variant, hit.getDesignation(), hit.getSeparation()))
                .toList();
    }

    @Override
    public Optional<CatalogEntry> findEntry(CatalogVariant variant, String designation) {
        if (designation == null || designation.isBlank()) {
            return Optional.empty();
        }
        return switch (variant) {
            case MESSIER -> messierRepository.findByDesignation(designation).map(MessierObject::toEntry);
            case NGC -> ngcRepository.findByDesignation(designation).map(n -> n.toEntry(CatalogVariant.NGC));
            case IC -> ngcRepository.findByDesignation(designation)
                    .or(() -> ngcRepository.findByIcDesignation(designation).stream().findFirst())
                    .map(n -> n.toEntry(CatalogVariant.IC));
            case NAMED_STAR -> namedStarRepository.findByDesignation(designation)
                    .or(() -> namedStarRepository.findByNormalizedDesignation(
                            CatalogVariant.normalizeDesignation(designation)))
                    .map(NamedStar::toEntry);
        };
    }

    private static int cap(int limit) {
        return limit <= 0 ? Integer.MAX_VALUE : limit;
    }
}
