package com.starscape.astrocat.features.platesolve.infra;

import com.starscape.astrocat.features.platesolve.app.SolveTaskDispatcher;
import com.starscape.astrocat.features.platesolve.app.SolveTaskMessage;
import com.starscape.astrocat.features.platesolve.app.SolveTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * In-process queue used when SQS is disabled. Tasks are lost on restart; the stuck-solve
 * reaper eventually fails any image left in flight.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "false", matchIfMissing = true)
public class LocalSolveTaskQueue implements SolveTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(LocalSolveTaskQueue.class);

    private final TaskScheduler taskScheduler;
    private final ObjectProvider<SolveTaskDispatcher> dispatcher;

    public LocalSolveTaskQueue(
            @Qualifier("solveTaskScheduler") TaskScheduler taskScheduler,
            ObjectProvider<SolveTaskDispatcher> dispatcher) {
        this.taskScheduler = taskScheduler;
        this.dispatcher = dispatcher;
    }

    @Override
    public void enqueue(SolveTaskMessage message, Duration delay) {
        Duration effective = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        log.debug("Scheduling {} for image {} in {}s", message.type(), message.imageId(), effective.toSeconds());
        taskScheduler.schedule(() -> run(message), Instant.now().plus(effective));
    }

    private void run(SolveTaskMessage message) {
        try {
            dispatcher.getObject().dispatch(message);
        } catch (RuntimeException e) {
            log.error("Solve task {} for image {} failed", message.type(), message.imageId(), e);
        }
    }
}
