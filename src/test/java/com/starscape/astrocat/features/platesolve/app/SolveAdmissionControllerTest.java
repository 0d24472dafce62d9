package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.SolveSettings;
import com.starscape.astrocat.features.platesolve.domain.SolveSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolveAdmissionControllerTest {

    @Mock
    private SolveSettingsRepository settingsRepository;

    @Mock
    private ImageRepository imageRepository;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SolveAdmissionController controller;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        controller = new SolveAdmissionController(settingsRepository, imageRepository, jdbcTemplate,
                transactionManager, new AstrometryProperties());
    }

    @Test
    void admitsBelowTheCeilingAndRunsTheReservationUnderTheLock() {
        when(settingsRepository.findCurrentForUpdate()).thenReturn(Optional.of(new SolveSettings(3, SolveProvider.NOVA)));
        when(imageRepository.countByAstrometryStatusIn(AstrometryStatus.IN_FLIGHT)).thenReturn(2L);

        AdmissionDecision<String> decision = controller.tryAdmit(settings -> "reserved for " + settings.getProvider());

        assertThat(decision.granted()).isTrue();
        assertThat(decision.value()).isEqualTo("reserved for NOVA");
        verify(jdbcTemplate).execute("SET LOCAL lock_timeout TO '10000'");
    }

    @Test
    void deniesAtTheCeilingWithoutReserving() {
        AtomicInteger reservations = new AtomicInteger();
        when(settingsRepository.findCurrentForUpdate()).thenReturn(Optional.of(new SolveSettings(3, SolveProvider.NOVA)));
        when(imageRepository.countByAstrometryStatusIn(AstrometryStatus.IN_FLIGHT)).thenReturn(3L);

        AdmissionDecision<Integer> decision = controller.tryAdmit(settings -> reservations.incrementAndGet());

        assertThat(decision.granted()).isFalse();
        assertThat(decision.retryAfterSeconds()).isEqualTo(20);
        assertThat(decision.reason()).contains("3 of 3");
        assertThat(reservations).hasValue(0);
    }

    @Test
    void lockTimeoutIsADeferralNotAnError() {
        when(settingsRepository.findCurrentForUpdate())
                .thenThrow(new PessimisticLockingFailureException("canceling statement due to lock timeout"));

        AdmissionDecision<String> decision = controller.tryAdmit(settings -> "never");

        assertThat(decision.granted()).isFalse();
        assertThat(decision.retryAfterSeconds()).isEqualTo(5);
        verify(transactionManager).rollback(any());
    }

    @Test
    void missingSettingsRowIsAConfigurationError() {
        when(settingsRepository.findCurrentForUpdate()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.tryAdmit(settings -> "never"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("settings");
    }
}
