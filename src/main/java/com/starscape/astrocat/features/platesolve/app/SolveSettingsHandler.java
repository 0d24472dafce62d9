package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.api.dto.SolveSettingsResponse;
import com.starscape.astrocat.features.platesolve.domain.SolveSettings;
import com.starscape.astrocat.features.platesolve.domain.SolveSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for reading and changing the operator solve settings.
 */
@Service
public class SolveSettingsHandler {

    private static final Logger log = LoggerFactory.getLogger(SolveSettingsHandler.class);

    private final SolveSettingsRepository settingsRepository;
    private final ImageRepository imageRepository;
    private final PlateSolverClients clients;

    public SolveSettingsHandler(
            SolveSettingsRepository settingsRepository,
            ImageRepository imageRepository,
            PlateSolverClients clients) {
        this.settingsRepository = settingsRepository;
        this.imageRepository = imageRepository;
        this.clients = clients;
    }

    @Transactional(readOnly = true)
    public SolveSettingsResponse get() {
        return toResponse(current(false));
    }

    @Transactional
    public SolveSettingsResponse update(int maxInFlight, SolveProvider provider) {
        SolveSettings settings = current(true);
        settings.update(maxInFlight, provider);
        settingsRepository.save(settings);
        log.info("Solve settings updated: maxInFlight={}, provider={}", maxInFlight, provider);
        return toResponse(settings);
    }

    private SolveSettings current(boolean forUpdate) {
        return (forUpdate ? settingsRepository.findCurrentForUpdate() : settingsRepository.findCurrent())
                .orElseThrow(() -> new IllegalStateException("Solve settings row is missing"));
    }

    private SolveSettingsResponse toResponse(SolveSettings settings) {
        return new SolveSettingsResponse(
            settings.getMaxInFlight(),
            settings.getProvider().name(),
            clients.resolve(settings.getProvider()).provider().name(),
            imageRepository.countByAstrometryStatusIn(AstrometryStatus.IN_FLIGHT),
            settings.getUpdatedAt()
        );
    }
}
