package com.starscape.astrocat.features.platesolve.infra;

import com.starscape.astrocat.features.platesolve.app.SolveTaskDispatcher;
import com.starscape.astrocat.features.platesolve.app.SolveTaskMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocalSolveTaskQueueTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ObjectProvider<SolveTaskDispatcher> dispatcherProvider;

    @Mock
    private SolveTaskDispatcher dispatcher;

    private LocalSolveTaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = new LocalSolveTaskQueue(taskScheduler, dispatcherProvider);
    }

    private Runnable scheduled(Instant lowerBound, Duration expectedDelay) {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler).schedule(task.capture(), at.capture());
        assertThat(at.getValue()).isBetween(lowerBound.plus(expectedDelay), Instant.now().plus(expectedDelay));
        return task.getValue();
    }

    @Test
    void delayedTaskIsDispatchedWhenItRuns() {
        SolveTaskMessage message = SolveTaskMessage.poll(3L, "sub-3");
        when(dispatcherProvider.getObject()).thenReturn(dispatcher);
        Instant before = Instant.now();

        queue.enqueue(message, Duration.ofSeconds(15));
        scheduled(before, Duration.ofSeconds(15)).run();

        verify(dispatcher).dispatch(message);
    }

    @Test
    void negativeDelayRunsImmediately() {
        Instant before = Instant.now();

        queue.enqueue(SolveTaskMessage.submit(3L, false, 0), Duration.ofSeconds(-5));

        scheduled(before, Duration.ZERO);
    }

    @Test
    void failingTaskDoesNotEscapeTheScheduler() {
        SolveTaskMessage message = SolveTaskMessage.submit(3L, false, 0);
        when(dispatcherProvider.getObject()).thenReturn(dispatcher);
        doThrow(new IllegalStateException("database down")).when(dispatcher).dispatch(message);
        Instant before = Instant.now();

        queue.enqueue(message, Duration.ZERO);
        Runnable task = scheduled(before, Duration.ZERO);

        assertThatCode(task::run).doesNotThrowAnyException();
    }
}
