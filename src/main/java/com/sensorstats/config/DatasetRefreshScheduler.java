package com.sensorstats.config;

import com.sensorstats.service.StatsQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically compares the dataset source's last-modified marker with the loaded one and
 * reloads on change. Enabled unless {@code sensorstats.dataset.freshness-check.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "sensorstats.dataset.freshness-check.enabled", havingValue = "true", matchIfMissing = true)
public class DatasetRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(DatasetRefreshScheduler.class);

    private final StatsQueryService queryService;

    public DatasetRefreshScheduler(StatsQueryService queryService) {
        this.queryService = queryService;
        log.info("Dataset freshness check enabled");
    }

    @Scheduled(fixedDelayString = "${sensorstats.dataset.freshness-check.interval-ms:5000}",
            initialDelayString = "${sensorstats.dataset.freshness-check.interval-ms:5000}")
    public void checkFreshness() {
        queryService.refreshIfStale();
    }
}
