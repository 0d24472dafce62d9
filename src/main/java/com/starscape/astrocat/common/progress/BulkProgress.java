package com.starscape.astrocat.common.progress;

import java.time.Instant;

/**
 * Snapshot of a bulk operation over a path prefix.
 */
public record BulkProgress(
    String kind,
    String pathPrefix,
    Status status,
    int total,
    int processed,
    int queued,
    int skipped,
    int errors,
    Instant updatedAt
) {

    public enum Status {
        RUNNING,
        COMPLETED,
        FAILED
    }

    public static BulkProgress started(String kind, String pathPrefix) {
        return new BulkProgress(kind, pathPrefix, Status.RUNNING, 0, 0, 0, 0, 0, Instant.now());
    }

    public BulkProgress withCounts(int total, int processed, int queued, int skipped, int errors) {
        return new BulkProgress(kind, pathPrefix, status, total, processed, queued, skipped, errors, Instant.now());
    }

    public BulkProgress completed() {
        return new BulkProgress(kind, pathPrefix, Status.COMPLETED, total, processed, queued, skipped, errors, Instant.now());
    }

    public BulkProgress failed() {
        return new BulkProgress(kind, pathPrefix, Status.FAILED, total, processed, queued, skipped, errors, Instant.now());
    }
}
