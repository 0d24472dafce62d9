package com.starscape.astrocat.features.platesolve.app;

import java.time.Duration;

public interface SolveTaskQueue {

    /**
     * Deliver {@code message} to the dispatcher no earlier than {@code delay} from now.
     */
    void enqueue(SolveTaskMessage message, Duration delay);
}
