package com.sensorstats.service;

import com.sensorstats.aggregate.StatsAggregator;
import com.sensorstats.cache.CacheKey;
import com.sensorstats.cache.CacheKeyBuilder;
import com.sensorstats.cache.InvalidDateException;
import com.sensorstats.cache.ResultCache;
import com.sensorstats.model.AggregateResult;
import com.sensorstats.model.QueryFilter;
import com.sensorstats.model.SensorReading;
import com.sensorstats.query.FilterEngine;
import com.sensorstats.store.DataLoadException;
import com.sensorstats.store.Dataset;
import com.sensorstats.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Answers stats queries: normalize, look up the cache, and on a miss filter, aggregate and store.
 *
 * <p>This is the only writer of the {@link ResultCache}. Queries run under a shared read lock;
 * a dataset reload swaps the dataset and clears the cache under the write lock, so no query
 * can pair post-reload data with a pre-reload cache entry (or the reverse).
 * Racing misses for the same key may both compute; the results are identical.
 */
@Service
public class StatsQueryService {

    private static final Logger log = LoggerFactory.getLogger(StatsQueryService.class);

    private final DatasetStore datasetStore;
    private final FilterEngine filterEngine;
    private final StatsAggregator aggregator;
    private final CacheKeyBuilder keyBuilder;
    private final ResultCache resultCache;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public StatsQueryService(DatasetStore datasetStore,
                             FilterEngine filterEngine,
                             StatsAggregator aggregator,
                             CacheKeyBuilder keyBuilder,
                             ResultCache resultCache) {
        this.datasetStore = datasetStore;
        this.filterEngine = filterEngine;
        this.aggregator = aggregator;
        this.keyBuilder = keyBuilder;
        this.resultCache = resultCache;
    }

    /**
     * Stats for the readings matching the given raw parameters. Any parameter may be null.
     *
     * @throws InvalidDateException if a start or end bound cannot be parsed
     */
    public StatsQueryResult query(String location, String sensor, String startDate, String endDate) {
        QueryFilter filter = keyBuilder.buildFilter(location, sensor, startDate, endDate);
        CacheKey key = keyBuilder.keyFor(filter);

        lock.readLock().lock();
        try {
            Optional<AggregateResult> cached = resultCache.get(key);
            if (cached.isPresent()) {
                log.debug("Cache hit: key={} filter={}", key, filter);
                return new StatsQueryResult(cached.get(), true);
            }

            Dataset dataset = datasetStore.current();
            List<SensorReading> matching = filterEngine.apply(dataset, filter);
            AggregateResult result = aggregator.aggregate(matching);
            resultCache.put(key, result);
            log.debug("Cache miss: key={} filter={} matched={} count={}",
                    key, filter, matching.size(), result.count());
            return new StatsQueryResult(result, false);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Freshness check: reload the dataset if its source changed, and invalidate the cache with it.
     * A failed reload keeps serving the previous dataset and is not retried until the source changes again.
     *
     * @return true if a new dataset was installed
     */
    public boolean refreshIfStale() {
        Optional<Dataset> reloaded;
        try {
            reloaded = datasetStore.loadIfModified();
        } catch (DataLoadException e) {
            log.error("Dataset reload failed, keeping previous dataset: {}", e.getMessage(), e);
            return false;
        }
        if (reloaded.isEmpty()) {
            return false;
        }

        lock.writeLock().lock();
        try {
            datasetStore.install(reloaded.get());
            resultCache.invalidateAll();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Dataset reloaded: {} readings", reloaded.get().size());
        return true;
    }

    public Dataset currentDataset() {
        return datasetStore.current();
    }

    public int cachedResults() {
        return resultCache.size();
    }
}
