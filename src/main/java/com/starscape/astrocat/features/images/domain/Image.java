package com.starscape.astrocat.features.images.domain;

import com.starscape.astrocat.common.wcs.AstrometrySummary;
import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Image record as seen by the plate-solve workflow and the catalog matcher.
 * Rows are created by the indexer; this service only mutates the astrometry columns.
 * Dynamic updates keep writes limited to the columns that actually changed.
 */
@Entity
@Table(name = "images")
@DynamicUpdate
public class Image {

    private static final int MAX_ERROR_LENGTH = 1024;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "file_path", nullable = false, updatable = false)
    private String filePath;

    @Column(name = "file_name", nullable = false, updatable = false)
    private String fileName;

    @Enumerated(EnumType.STRING)
    @Column(name = "subtype")
    private ImageSubtype subtype;

    @Column(name = "width_pixels")
    private Integer widthPixels;

    @Column(name = "height_pixels")
    private Integer heightPixels;

    @Column(name = "is_plate_solved", nullable = false)
    private boolean plateSolved;

    @Column(name = "plate_solve_source")
    private String plateSolveSource;

    @Enumerated(EnumType.STRING)
    @Column(name = "plate_solve_provider")
    private SolveProvider solveProvider;

    @Column(name = "ra_center_degrees")
    private Double raCenterDegrees;

    @Column(name = "dec_center_degrees")
    private Double decCenterDegrees;

    @Column(name = "field_radius_degrees")
    private Double fieldRadiusDegrees;

    @Column(name = "pixel_scale_arcsec")
    private Double pixelScaleArcsec;

    @Column(name = "rotation_degrees")
    private Double rotationDegrees;

    @Column(name = "parity")
    private Integer parity;

    @Enumerated(EnumType.STRING)
    @Column(name = "astrometry_status", nullable = false)
    private AstrometryStatus astrometryStatus;

    @Column(name = "astrometry_submission_id")
    private String submissionId;

    @Column(name = "astrometry_job_id")
    private String jobId;

    @Column(name = "astrometry_url")
    private String astrometryUrl;

    @Column(name = "astrometry_poll_attempts", nullable = false)
    private int pollAttempts;

    @Column(name = "astrometry_error")
    private String astrometryError;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "wcs_header", columnDefinition = "jsonb")
    private String wcsHeader;

    @Column(name = "annotated_s3_key")
    private String annotatedS3Key;

    @Column(name = "indexed_at", nullable = false, updatable = false)
    private Instant indexedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Image() {
        // JPA constructor
    }

    public Image(String filePath, String fileName, ImageSubtype subtype, Integer widthPixels, Integer heightPixels) {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path cannot be blank");
        }
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("File name cannot be blank");
        }
        if ((widthPixels != null && widthPixels <= 0) || (heightPixels != null && heightPixels <= 0)) {
            throw new IllegalArgumentException("Image dimensions must be positive");
        }
        this.filePath = filePath;
        this.fileName = fileName;
        this.subtype = subtype;
        this.widthPixels = widthPixels;
        this.heightPixels = heightPixels;
        this.astrometryStatus = AstrometryStatus.NONE;
        this.indexedAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    // Getters
    public Long getId() { return id; }
    public String getFilePath() { return filePath; }
    public String getFileName() { return fileName; }
    public ImageSubtype getSubtype() { return subtype; }
    public Integer getWidthPixels() { return widthPixels; }
    public Integer getHeightPixels() { return heightPixels; }
    public boolean isPlateSolved() { return plateSolved; }
    public String getPlateSolveSource() { return plateSolveSource; }
    public SolveProvider getSolveProvider() { return solveProvider; }
    public Double getRaCenterDegrees() { return raCenterDegrees; }
    public Double getDecCenterDegrees() { return decCenterDegrees; }
    public Double getFieldRadiusDegrees() { return fieldRadiusDegrees; }
    public Double getPixelScaleArcsec() { return pixelScaleArcsec; }
    public Double getRotationDegrees() { return rotationDegrees; }
    public Integer getParity() { return parity; }
    public AstrometryStatus getAstrometryStatus() { return astrometryStatus; }
    public String getSubmissionId() { return submissionId; }
    public String getJobId() { return jobId; }
    public String getAstrometryUrl() { return astrometryUrl; }
    public int getPollAttempts() { return pollAttempts; }
    public String getAstrometryError() { return astrometryError; }
    public String getWcsHeader() { return wcsHeader; }
    public String getAnnotatedS3Key() { return annotatedS3Key; }
    public Instant getIndexedAt() { return indexedAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean isSolveInFlight() {
        return astrometryStatus.isInFlight();
    }

    public boolean isPlanetary() {
        return subtype == ImageSubtype.PLANETARY;
    }

    public AstrometrySummary toAstrometrySummary() {
        return new AstrometrySummary(
            raCenterDegrees,
            decCenterDegrees,
            fieldRadiusDegrees,
            pixelScaleArcsec,
            rotationDegrees,
            widthPixels,
            heightPixels,
            parity,
            wcsHeader
        );
    }

    /**
     * Start a new solver run. Identifiers of any previous run are cleared.
     */
    public void claimForSolve(SolveProvider provider) {
        this.astrometryStatus = AstrometryStatus.SUBMITTED;
        this.solveProvider = provider;
        this.submissionId = null;
        this.jobId = null;
        this.pollAttempts = 0;
        this.astrometryError = null;
        this.updatedAt = Instant.now();
    }

    public void recordSubmission(String submissionId) {
        if (astrometryStatus != AstrometryStatus.SUBMITTED) {
            throw new IllegalStateException("Cannot record a submission while " + astrometryStatus);
        }
        this.submissionId = submissionId;
        this.updatedAt = Instant.now();
    }

    public void markSolveProcessing(String jobId) {
        if (astrometryStatus == AstrometryStatus.SUBMITTED) {
            this.astrometryStatus = AstrometryStatus.PROCESSING;
        }
        this.jobId = jobId;
        this.updatedAt = Instant.now();
    }

    /**
     * Count one poll of the solver. Also refreshes updatedAt, which keeps an actively
     * polled image away from the stuck-work sweep.
     */
    public int recordPollAttempt() {
        this.pollAttempts++;
        this.updatedAt = Instant.now();
        return pollAttempts;
    }

    public void markSolved(double raCenter, double decCenter, Double fieldRadius, Double pixelScale,
                           Double rotation, Integer parity, String wcsHeaderJson, String astrometryUrl) {
        if (!isSolveInFlight()) {
            throw new IllegalStateException("Cannot mark solved while " + astrometryStatus);
        }
        this.raCenterDegrees = raCenter;
        this.decCenterDegrees = decCenter;
        this.fieldRadiusDegrees = fieldRadius;
        this.pixelScaleArcsec = pixelScale;
        this.rotationDegrees = rotation;
        this.parity = parity;
        this.wcsHeader = wcsHeaderJson;
        this.astrometryUrl = astrometryUrl;
        this.plateSolved = true;
        this.plateSolveSource = "SOLVER";
        this.astrometryStatus = AstrometryStatus.SOLVED;
        this.astrometryError = null;
        this.updatedAt = Instant.now();
    }

    public void markSolveFailed(String reason) {
        this.astrometryStatus = AstrometryStatus.FAILED;
        this.astrometryError = reason != null && reason.length() > MAX_ERROR_LENGTH
                ? reason.substring(0, MAX_ERROR_LENGTH)
                : reason;
        this.updatedAt = Instant.now();
    }

    public void attachAnnotatedPreview(String s3Key) {
        this.annotatedS3Key = s3Key;
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
