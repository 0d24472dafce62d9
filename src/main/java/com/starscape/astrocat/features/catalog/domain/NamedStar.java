package com.starscape.astrocat.features.catalog.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "named_star_catalog")
public class NamedStar {

    @Id
    private Integer id;

    @Column(nullable = false)
    private String designation;

    @Column(name = "common_name")
    private String commonName;

    @Column(name = "hip_id")
    private String hipId;

    @Column(name = "hd_id")
    private String hdId;

    @Column(name = "ra_degrees", nullable = false)
    private double raDegrees;

    @Column(name = "dec_degrees", nullable = false)
    private double decDegrees;

    @Column(name = "magnitude")
    private Double magnitude;

    @Column(name = "spectral_type")
    private String spectralType;

    protected NamedStar() {
        // JPA constructor
    }

    public Integer getId() { return id; }
    public String getDesignation() { return designation; }
    public String getCommonName() { return commonName; }
    public String getHipId() { return hipId; }
    public String getHdId() { return hdId; }
    public double getRaDegrees() { return raDegrees; }
    public double getDecDegrees() { return decDegrees; }
    public Double getMagnitude() { return magnitude; }
    public String getSpectralType() { return spectralType; }

    public CatalogEntry toEntry() {
        return new CatalogEntry(CatalogVariant.NAMED_STAR, designation, commonName, "Star",
                raDegrees, decDegrees, magnitude);
    }
}
