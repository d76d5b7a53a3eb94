package com.sensorstats.controller;

import com.sensorstats.service.StatsQueryResult;
import com.sensorstats.service.StatsQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the stats API.
 *
 * <pre>
 * GET /stats?location=lab-1&amp;sensor=temperature&amp;start_date=2025-01-01&amp;end_date=2025-01-31
 * </pre>
 *
 * Every parameter is optional. The {@code X-Cache} header reports {@code HIT} or {@code MISS}.
 */
@RestController
@RequestMapping("/stats")
@CrossOrigin(origins = "*", exposedHeaders = StatsController.CACHE_HEADER)
public class StatsController {

    static final String CACHE_HEADER = "X-Cache";

    private static final Logger log = LoggerFactory.getLogger(StatsController.class);

    private final StatsQueryService queryService;

    public StatsController(StatsQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<StatsResponse> getStats(
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String sensor,
            @RequestParam(name = "start_date", required = false) String startDate,
            @RequestParam(name = "end_date", required = false) String endDate
    ) {
        log.info("Stats request: location={} sensor={} start_date={} end_date={}",
                location, sensor, startDate, endDate);

        StatsQueryResult result = queryService.query(location, sensor, startDate, endDate);

        return ResponseEntity.ok()
                .header(CACHE_HEADER, result.cacheHit() ? "HIT" : "MISS")
                .body(new StatsResponse(result.stats()));
    }
}
