package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.platesolve.domain.SolveSettings;
import com.starscape.astrocat.features.platesolve.domain.SolveSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Bounds the number of images in flight with the solver.
 *
 * <p>The check and the reservation run in one transaction that holds the row lock on
 * {@code solve_settings}, so concurrent workers see each other's reservations. Waiting for
 * the lock is bounded by a Postgres {@code lock_timeout}; a worker that times out is told
 * to come back shortly instead of blocking.
 */
@Service
public class SolveAdmissionController {

    private static final Logger log = LoggerFactory.getLogger(SolveAdmissionController.class);

    private final SolveSettingsRepository settingsRepository;
    private final ImageRepository imageRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final AstrometryProperties properties;

    public SolveAdmissionController(
            SolveSettingsRepository settingsRepository,
            ImageRepository imageRepository,
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            AstrometryProperties properties) {
        this.settingsRepository = settingsRepository;
        this.imageRepository = imageRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
    }

    /**
     * Admit one reservation if the in-flight count is below the ceiling.
     *
     * @param reservation runs inside the locked transaction; whatever it writes counts
     *                    toward the ceiling for every later caller
     */
    public <T> AdmissionDecision<T> tryAdmit(Function<SolveSettings, T> reservation) {
        try {
            return transactionTemplate.execute(status -> {
                jdbcTemplate.execute("SET LOCAL lock_timeout TO '" + properties.getLockTimeoutMs() + "'");

                SolveSettings settings = settingsRepository.findCurrentForUpdate()
                        .orElseThrow(() -> new IllegalStateException("Solve settings row is missing"));

                long inFlight = imageRepository.countByAstrometryStatusIn(AstrometryStatus.IN_FLIGHT);
                if (inFlight >= settings.getMaxInFlight()) {
                    log.info("Admission throttled: {} in flight, limit {}", inFlight, settings.getMaxInFlight());
                    return AdmissionDecision.<T>denied(properties.getThrottleRetrySeconds(),
                            "Solver busy: " + inFlight + " of " + settings.getMaxInFlight() + " slots in use");
                }

                return AdmissionDecision.granted(reservation.apply(settings));
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Admission lock not acquired within {} ms: {}", properties.getLockTimeoutMs(), e.getMessage());
            return AdmissionDecision.denied(properties.getLockRetrySeconds(), "Admission lock timeout");
        }
    }
}
