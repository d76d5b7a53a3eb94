package com.sensorstats.cache;

import com.sensorstats.model.AggregateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory, thread-safe memo of computed results, keyed by {@link CacheKey}.
 *
 * <p>Backed by a {@link ConcurrentHashMap}. No eviction and no expiry: entries live until
 * {@link #invalidateAll()} or shutdown. When two misses for the same key race, the last
 * {@link #put} wins; both computed the same result.
 */
@Repository
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final ConcurrentMap<CacheKey, AggregateResult> entries = new ConcurrentHashMap<>();

    public Optional<AggregateResult> get(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void put(CacheKey key, AggregateResult result) {
        entries.put(key, result);
        log.debug("Cached result for key={} count={}", key, result.count());
    }

    /**
     * Drop every entry. Used when the dataset behind the cached results is replaced.
     */
    public void invalidateAll() {
        int dropped = entries.size();
        entries.clear();
        log.info("Invalidated {} cached results", dropped);
    }

    public int size() {
        return entries.size();
    }
}
