package com.starscape.astrocat.features.platesolve.domain;

import com.starscape.astrocat.features.images.domain.SolveProvider;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Operator-adjustable solver settings. Exactly one row exists; locking it serialises
 * admission decisions across workers.
 */
@Entity
@Table(name = "solve_settings")
public class SolveSettings {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id;

    @Column(name = "max_in_flight", nullable = false)
    private int maxInFlight;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false)
    private SolveProvider provider;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected SolveSettings() {
        // JPA constructor
    }

    public SolveSettings(int maxInFlight, SolveProvider provider) {
        this.id = SINGLETON_ID;
        update(maxInFlight, provider);
    }

    public Integer getId() { return id; }
    public int getMaxInFlight() { return maxInFlight; }
    public SolveProvider getProvider() { return provider; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void update(int maxInFlight, SolveProvider provider) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("Max in-flight must be at least 1");
        }
        if (provider == null) {
            throw new IllegalArgumentException("Provider is required");
        }
        this.maxInFlight = maxInFlight;
        this.provider = provider;
        this.updatedAt = Instant.now();
    }
}
