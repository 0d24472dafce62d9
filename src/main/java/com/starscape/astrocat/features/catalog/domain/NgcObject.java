package com.starscape.astrocat.features.catalog.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "ngc_catalog")
public class NgcObject {

    @Id
    private Integer id;

    @Column(nullable = false)
    private String designation;

    @Column(name = "ngc_number", nullable = false)
    private Integer ngcNumber;

    @Column(name = "common_name")
    private String commonName;

    @Column(name = "messier_designation")
    private String messierDesignation;

    @Column(name = "ic_designation")
    private String icDesignation;

    @Column(name = "ra_degrees", nullable = false)
    private double raDegrees;

    @Column(name = "dec_degrees", nullable = false)
    private double decDegrees;

    @Column(name = "object_type")
    private String objectType;

    @Column(name = "hubble_type")
    private String hubbleType;

    @Column(name = "constellation")
    private String constellation;

    @Column(name = "apparent_magnitude")
    private Double apparentMagnitude;

    @Column(name = "major_axis_arcmin")
    private Double majorAxisArcmin;

    @Column(name = "minor_axis_arcmin")
    private Double minorAxisArcmin;

    @Column(name = "position_angle")
    private Double positionAngle;

    @Column(name = "notes")
    private String notes;

    protected NgcObject() {
        // JPA constructor
    }

    public Integer getId() { return id; }
    public String getDesignation() { return designation; }
    public Integer getNgcNumber() { return ngcNumber; }
    public String getCommonName() { return commonName; }
    public String getMessierDesignation() { return messierDesignation; }
    public String getIcDesignation() { return icDesignation; }
    public double getRaDegrees() { return raDegrees; }
    public double getDecDegrees() { return decDegrees; }
    public String getObjectType() { return objectType; }
    public String getHubbleType() { return hubbleType; }
    public String getConstellation() { return constellation; }
    public Double getApparentMagnitude() { return apparentMagnitude; }
    public Double getMajorAxisArcmin() { return majorAxisArcmin; }
    public Double getMinorAxisArcmin() { return minorAxisArcmin; }
    public Double getPositionAngle() { return positionAngle; }
    public String getNotes() { return notes; }

    public CatalogEntry toEntry(CatalogVariant variant) {
        return new CatalogEntry(variant, designation, commonName, objectType,
                raDegrees, decDegrees, apparentMagnitude);
    }
}
