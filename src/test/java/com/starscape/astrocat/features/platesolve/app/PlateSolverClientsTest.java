package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverClient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlateSolverClientsTest {

    private static PlateSolverClient client(SolveProvider provider, boolean configured) {
        PlateSolverClient client = mock(PlateSolverClient.class);
        when(client.provider()).thenReturn(provider);
        when(client.isConfigured()).thenReturn(configured);
        return client;
    }

    @Test
    void resolvesTheRequestedProvider() {
        PlateSolverClient nova = client(SolveProvider.NOVA, true);
        PlateSolverClient local = client(SolveProvider.LOCAL, true);
        PlateSolverClients clients = new PlateSolverClients(List.of(nova, local));

        assertThat(clients.resolve(SolveProvider.LOCAL)).isSameAs(local);
        assertThat(clients.resolve(SolveProvider.NOVA)).isSameAs(nova);
    }

    @Test
    void unconfiguredLocalSolverFallsBackToNova() {
        PlateSolverClient nova = client(SolveProvider.NOVA, true);
        PlateSolverClients clients = new PlateSolverClients(List.of(nova, client(SolveProvider.LOCAL, false)));

        assertThat(clients.resolve(SolveProvider.LOCAL)).isSameAs(nova);
    }

    @Test
    void recordsWithoutAProviderAreTreatedAsNova() {
        PlateSolverClient nova = client(SolveProvider.NOVA, true);
        PlateSolverClients clients = new PlateSolverClients(List.of(nova));

        assertThat(clients.forProvider(null)).isSameAs(nova);
    }

    @Test
    void unknownProviderIsAnError() {
        PlateSolverClients clients = new PlateSolverClients(List.of(client(SolveProvider.NOVA, true)));

        assertThatThrownBy(() -> clients.forProvider(SolveProvider.LOCAL)).isInstanceOf(IllegalStateException.class);
    }
}
