package com.sensorstats.store;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Owns the current {@link Dataset} snapshot.
 *
 * <p>The snapshot is immutable and published through a volatile field, so readers never lock.
 * Reloads build a complete new snapshot and swap it in with {@link #install(Dataset)};
 * pairing the swap with cache invalidation is the caller's job.
 */
@Repository
public class DatasetStore {

    private static final Logger log = LoggerFactory.getLogger(DatasetStore.class);

    private final DatasetLoader loader;
    private final Resource source;

    private volatile Dataset current;
    private volatile long failedMarker = -1L;

    public DatasetStore(DatasetLoader loader,
                        @Value("${sensorstats.dataset.location:file:sensor-readings.csv}") Resource source) {
        this.loader = loader;
        this.source = source;
    }

    @PostConstruct
    void init() {
        load();
    }

    /**
     * Initial load: read the source and make it the current dataset. Runs once at startup; a failure
     * there aborts startup. Later reloads go through {@link #loadIfModified()} and {@link #install(Dataset)}
     * so they can be paired with cache invalidation.
     *
     * @throws DataLoadException if the source cannot be loaded
     * @throws IllegalStateException if a dataset is already loaded
     */
    public synchronized Dataset load() {
        if (current != null) {
            throw new IllegalStateException("Dataset already loaded from " + source.getDescription());
        }
        Dataset dataset = loader.load(source);
        this.current = dataset;
        return dataset;
    }

    /**
     * Load a fresh dataset if the source changed since the current one was loaded.
     * The result is not installed.
     *
     * <p>A version of the source that failed to load is not retried until its marker changes again.
     *
     * @return the new dataset, or empty if the source is unchanged, already failed at this marker,
     *         or reports no modification marker
     * @throws DataLoadException if the source changed but cannot be loaded
     */
    public Optional<Dataset> loadIfModified() {
        long marker = loader.lastModified(source);
        Dataset dataset = current;
        if (marker < 0 || marker == failedMarker || (dataset != null && marker == dataset.sourceMarker())) {
            return Optional.empty();
        }
        log.info("Dataset source {} changed (marker {} -> {}), reloading",
                source.getDescription(), dataset == null ? "none" : dataset.sourceMarker(), marker);
        try {
            Dataset reloaded = loader.load(source);
            failedMarker = -1L;
            return Optional.of(reloaded);
        } catch (DataLoadException e) {
            failedMarker = marker;
            throw e;
        }
    }

    /**
     * Replace the current dataset. Callers must invalidate results computed from the previous one.
     */
    public void install(Dataset dataset) {
        this.current = dataset;
    }

    /**
     * @throws IllegalStateException if nothing has been loaded yet
     */
    public Dataset current() {
        Dataset dataset = current;
        if (dataset == null) {
            throw new IllegalStateException("Dataset has not been loaded");
        }
        return dataset;
    }

    public Resource getSource() {
        return source;
    }
}
