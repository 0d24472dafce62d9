package com.starscape.astrocat.common.progress;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local progress store. Entries expire one hour after their last update.
 */
@Component
public class InMemoryProgressStore implements ProgressStore {

    static final Duration TTL = Duration.ofHours(1);
    private static final long MAX_ENTRIES = 1_000;

    private final Cache<String, BulkProgress> entries;

    @Autowired
    public InMemoryProgressStore() {
        this(Ticker.systemTicker());
    }

    InMemoryProgressStore(Ticker ticker) {
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(TTL)
                .maximumSize(MAX_ENTRIES)
                .ticker(ticker)
                .build();
    }

    @Override
    public void put(BulkProgress progress) {
        entries.put(key(progress.kind(), progress.pathPrefix()), progress);
    }

    @Override
    public boolean putIfAbsentOrFinished(BulkProgress progress) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        entries.asMap().compute(key(progress.kind(), progress.pathPrefix()), (key, current) -> {
            if (current != null && current.status() == BulkProgress.Status.RUNNING) {
                return current;
            }
            claimed.set(true);
            return progress;
        });
        return claimed.get();
    }

    @Override
    public Optional<BulkProgress> find(String kind, String pathPrefix) {
        return Optional.ofNullable(entries.getIfPresent(key(kind, pathPrefix)));
    }

    static String key(String kind, String pathPrefix) {
        return "bulk:" + kind + ":" + DigestUtils.md5Hex(pathPrefix == null ? "" : pathPrefix);
    }
}
