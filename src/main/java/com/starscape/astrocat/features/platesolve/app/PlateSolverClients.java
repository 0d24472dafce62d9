package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the solver client for a provider.
 */
@Component
public class PlateSolverClients {

    private static final Logger log = LoggerFactory.getLogger(PlateSolverClients.class);

    private final Map<SolveProvider, PlateSolverClient> clients = new EnumMap<>(SolveProvider.class);

    public PlateSolverClients(List<PlateSolverClient> clients) {
        for (PlateSolverClient client : clients) {
            this.clients.put(client.provider(), client);
        }
    }

    /**
     * Client for a new submission. A self-hosted solver without URL or key falls back to NOVA.
     */
    public PlateSolverClient resolve(SolveProvider requested) {
        PlateSolverClient client = forProvider(requested);
        if (requested == SolveProvider.LOCAL && !client.isConfigured()) {
            log.error("Local solver selected but not configured; falling back to NOVA");
            return forProvider(SolveProvider.NOVA);
        }
        return client;
    }

    /**
     * Client for a submission already made with {@code provider}. Null means NOVA, the
     * provider of rows that predate provider tracking.
     */
    public PlateSolverClient forProvider(SolveProvider provider) {
        PlateSolverClient client = clients.get(provider == null ? SolveProvider.NOVA : provider);
        if (client == null) {
            throw new IllegalStateException("No solver client registered for " + provider);
        }
        return client;
    }
}
