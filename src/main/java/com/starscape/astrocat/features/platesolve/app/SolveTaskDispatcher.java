package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes dequeued solve tasks to the workflow. Tasks for images that no longer exist are dropped.
 */
@Component
public class SolveTaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SolveTaskDispatcher.class);

    private final PlateSolveWorkflow workflow;

    public SolveTaskDispatcher(PlateSolveWorkflow workflow) {
        this.workflow = workflow;
    }

    public void dispatch(SolveTaskMessage message) {
        log.debug("Dispatching solve task: {}", message);
        try {
            switch (message.type()) {
                case SUBMIT -> workflow.submit(message.imageId(), message.force(), message.attempt());
                case POLL -> workflow.poll(message.imageId(), message.submissionId());
            }
        } catch (NotFoundException e) {
            log.warn("Dropping {} task: {}", message.type(), e.getMessage());
        }
    }
}
