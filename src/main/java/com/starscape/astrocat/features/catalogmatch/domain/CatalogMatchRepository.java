package com.starscape.astrocat.features.catalogmatch.domain;

import com.starscape.astrocat.features.catalog.domain.CatalogVariant;

import java.util.List;
import java.util.Optional;

public interface CatalogMatchRepository {
    CatalogMatch save(CatalogMatch match);
    <S extends CatalogMatch> List<S> saveAll(Iterable<S> matches);
    List<CatalogMatch> findByImageIdOrderByAngularSeparationDegreesAsc(Long imageId);
    List<CatalogMatch> findByImageIdAndSourceNot(Long imageId, MatchSource source);
    Optional<CatalogMatch> findByImageIdAndCatalogVariantAndDesignation(Long imageId, CatalogVariant variant,
                                                                        String designation);
    int deleteByImageIdAndSource(Long imageId, MatchSource source);
}
