package com.starscape.astrocat.features.catalog.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "messier_catalog")
public class MessierObject {

    @Id
    private Integer id;

    @Column(nullable = false)
    private String designation;

    @Column(name = "messier_number", nullable = false)
    private Integer messierNumber;

    @Column(name = "common_name")
    private String commonName;

    @Column(name = "ngc_designation")
    private String ngcDesignation;

    @Column(name = "ra_degrees", nullable = false)
    private double raDegrees;

    @Column(name = "dec_degrees", nullable = false)
    private double decDegrees;

    @Column(name = "object_type", nullable = false)
    private String objectType;

    @Column(name = "constellation")
    private String constellation;

    @Column(name = "apparent_magnitude")
    private Double apparentMagnitude;

    @Column(name = "angular_size_arcmin")
    private String angularSizeArcmin;

    @Column(name = "distance_light_years")
    private Double distanceLightYears;

    @Column(name = "description")
    private String description;

    protected MessierObject() {
        // JPA constructor
    }

    public Integer getId() { return id; }
    public String getDesignation() { return designation; }
    public Integer getMessierNumber() { return messierNumber; }
    public String getCommonName() { return commonName; }
    public String getNgcDesignation() { return ngcDesignation; }
    public double getRaDegrees() { return raDegrees; }
    public double getDecDegrees() { return decDegrees; }
    public String getObjectType() { return objectType; }
    public String getConstellation() { return constellation; }
    public Double getApparentMagnitude() { return apparentMagnitude; }
    public String getAngularSizeArcmin() { return angularSizeArcmin; }
    public Double getDistanceLightYears() { return distanceLightYears; }
    public String getDescription() { return description; }

    public CatalogEntry toEntry() {
        return new CatalogEntry(CatalogVariant.MESSIER, designation, commonName, objectType,
                raDegrees, decDegrees, apparentMagnitude);
    }
}
