package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolveTaskDispatcherTest {

    @Mock
    private PlateSolveWorkflow workflow;

    @InjectMocks
    private SolveTaskDispatcher dispatcher;

    @Test
    void routesSubmitAndPollTasks() {
        dispatcher.dispatch(SolveTaskMessage.submit(1L, true, 2));
        dispatcher.dispatch(SolveTaskMessage.poll(1L, "sub-1"));

        verify(workflow).submit(1L, true, 2);
        verify(workflow).poll(1L, "sub-1");
    }

    @Test
    void dropsTasksForDeletedImages() {
        when(workflow.submit(9L, false, 0)).thenThrow(new NotFoundException("Image not found: 9"));

        assertThatCode(() -> dispatcher.dispatch(SolveTaskMessage.submit(9L, false, 0))).doesNotThrowAnyException();
    }
}
