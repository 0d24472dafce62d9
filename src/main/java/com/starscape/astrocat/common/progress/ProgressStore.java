package com.starscape.astrocat.common.progress;

import java.util.Optional;

/**
 * Short-lived progress records for bulk operations, keyed by operation kind and path prefix.
 */
public interface ProgressStore {

    void put(BulkProgress progress);

    /**
     * Stores {@code progress} unless a RUNNING entry already exists for the same kind and prefix.
     * The check and the write happen atomically.
     *
     * @return true if the slot was claimed
     */
    boolean putIfAbsentOrFinished(BulkProgress progress);

    Optional<BulkProgress> find(String kind, String pathPrefix);
}
