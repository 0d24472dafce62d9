package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.progress.BulkProgress;
import com.starscape.astrocat.common.progress.InMemoryProgressStore;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageFixtures;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.images.domain.ImageSubtype;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkSolveHandlerTest {

    @Mock
    private ImageRepository imageRepository;

    @Mock
    private SolveTaskQueue taskQueue;

    @Mock
    private TaskScheduler taskScheduler;

    private BulkSolveHandler handler;

    @BeforeEach
    void setUp() {
        handler = new BulkSolveHandler(imageRepository, taskQueue, new InMemoryProgressStore(), taskScheduler);
    }

    private static Image planetary(Long id, String path) {
        Image image = ImageFixtures.unsolved(id, path);
        ReflectionTestUtils.setField(image, "subtype", ImageSubtype.PLANETARY);
        return image;
    }

    private static Image headerSolved(Long id, String path) {
        return ImageFixtures.headerSolved(id, path, 0.5, 1.8, 0.0);
    }

    private List<Long> queuedImageIds(int expected) {
        ArgumentCaptor<SolveTaskMessage> messages = ArgumentCaptor.forClass(SolveTaskMessage.class);
        verify(taskQueue, times(expected)).enqueue(messages.capture(), eq(Duration.ZERO));
        return messages.getAllValues().stream().map(SolveTaskMessage::imageId).toList();
    }

    @Test
    void queuesHeaderSolvedImagesFirstThenUnsolvedOnes() {
        when(imageRepository.findByFilePathStartingWithOrderByIdAsc("/data/")).thenReturn(List.of(
                ImageFixtures.unsolved(1L, "/data/a.fits"),
                ImageFixtures.failed(2L, "/data/b.fits"),
                headerSolved(3L, "/data/c.fits"),
                ImageFixtures.solved(4L, "/data/d.fits"),
                ImageFixtures.inFlight(5L, "/data/e.fits", "sub-5"),
                planetary(6L, "/data/jupiter.avi")));

        BulkProgress result = handler.run("/data/", false);

        assertThat(queuedImageIds(3)).containsExactly(3L, 1L, 2L);
        assertThat(result.status()).isEqualTo(BulkProgress.Status.COMPLETED);
        assertThat(result.total()).isEqualTo(6);
        assertThat(result.processed()).isEqualTo(6);
        assertThat(result.queued()).isEqualTo(3);
        assertThat(result.skipped()).isEqualTo(3);
        assertThat(result.errors()).isZero();
    }

    @Test
    void forceAlsoQueuesSolvedImages() {
        when(imageRepository.findByFilePathStartingWithOrderByIdAsc("/data/")).thenReturn(List.of(
                ImageFixtures.solved(4L, "/data/d.fits"),
                ImageFixtures.inFlight(5L, "/data/e.fits", "sub-5")));

        BulkProgress result = handler.run("/data/", true);

        assertThat(queuedImageIds(1)).containsExactly(4L);
        assertThat(result.skipped()).isEqualTo(1);
    }

    @Test
    void queueFailureIsCountedAndTheSweepContinues() {
        when(imageRepository.findByFilePathStartingWithOrderByIdAsc("/data/")).thenReturn(List.of(
                ImageFixtures.unsolved(1L, "/data/a.fits"),
                ImageFixtures.unsolved(2L, "/data/b.fits")));
        doThrow(new IllegalStateException("queue unavailable"))
                .doNothing()
                .when(taskQueue).enqueue(any(), any());

        BulkProgress result = handler.run("/data/", false);

        assertThat(result.queued()).isEqualTo(1);
        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.processed()).isEqualTo(2);
    }

    @Test
    void startRunsInTheBackgroundAndGuardsThePrefix() {
        BulkProgress started = handler.start("/data/", false);

        assertThat(started.status()).isEqualTo(BulkProgress.Status.RUNNING);
        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        verifyNoInteractions(taskQueue);
        assertThatThrownBy(() -> handler.start("/data/", true)).isInstanceOf(IllegalStateException.class);
    }
}
