package com.starscape.astrocat.features.catalogmatch.domain;

import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "image_catalog_matches")
public class CatalogMatch {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "catalog_match_seq")
    @SequenceGenerator(name = "catalog_match_seq", sequenceName = "image_catalog_matches_id_seq", allocationSize = 1)
    private Long id;

    @Column(name = "image_id", nullable = false, updatable = false)
    private Long imageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "catalog_type", nullable = false, updatable = false)
    private CatalogVariant catalogVariant;

    @Column(name = "catalog_designation", nullable = false, updatable = false)
    private String designation;

    @Column(name = "angular_separation_degrees")
    private Double angularSeparationDegrees;

    @Column(name = "is_in_field", nullable = false)
    private boolean inField;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_source", nullable = false)
    private MatchSource source;

    @Column(name = "confidence_score")
    private Double confidenceScore;

    @Column(name = "matched_at", nullable = false)
    private Instant matchedAt;

    protected CatalogMatch() {
        // JPA constructor
    }

    private CatalogMatch(Long imageId, CatalogVariant catalogVariant, String designation,
                         Double angularSeparationDegrees, MatchSource source, Double confidenceScore) {
        if (imageId == null) {
            throw new IllegalArgumentException("Image ID is required");
        }
        if (catalogVariant == null) {
            throw new IllegalArgumentException("Catalog is required");
        }
        if (designation == null || designation.isBlank()) {
            throw new IllegalArgumentException("Designation cannot be blank");
        }
        if (confidenceScore != null && (confidenceScore < 0 || confidenceScore > 1)) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]");
        }
        this.imageId = imageId;
        this.catalogVariant = catalogVariant;
        this.designation = designation;
        this.angularSeparationDegrees = angularSeparationDegrees;
        this.inField = true;
        this.source = source;
        this.confidenceScore = confidenceScore;
        this.matchedAt = Instant.now();
    }

    public static CatalogMatch automatic(Long imageId, CatalogVariant variant, String designation,
                                         double separationDegrees, double confidence) {
        return new CatalogMatch(imageId, variant, designation, separationDegrees, MatchSource.AUTOMATIC, confidence);
    }

    public static CatalogMatch manual(Long imageId, CatalogVariant variant, String designation,
                                      Double separationDegrees) {
        return new CatalogMatch(imageId, variant, designation, separationDegrees, MatchSource.MANUAL, 1.0);
    }

    // Getters
    public Long getId() { return id; }
    public Long getImageId() { return imageId; }
    public CatalogVariant getCatalogVariant() { return catalogVariant; }
    public String getDesignation() { return designation; }
    public Double getAngularSeparationDegrees() { return angularSeparationDegrees; }
    public boolean isInField() { return inField; }
    public MatchSource getSource() { return source; }
    public Double getConfidenceScore() { return confidenceScore; }
    public Instant getMatchedAt() { return matchedAt; }

    public MatchKey key() {
        return new MatchKey(catalogVariant, designation);
    }

    /**
     * Take ownership of an automatic match so later recomputations keep it.
     */
    public void promoteToManual() {
        if (source == MatchSource.AUTOMATIC) {
            this.source = MatchSource.MANUAL;
            this.confidenceScore = 1.0;
            this.matchedAt = Instant.now();
        }
    }
}
