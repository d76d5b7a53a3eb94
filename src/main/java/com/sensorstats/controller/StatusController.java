package com.sensorstats.controller;

import com.sensorstats.service.StatsQueryService;
import com.sensorstats.store.Dataset;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and dataset introspection.
 */
@RestController
public class StatusController {

    private final StatsQueryService queryService;

    public StatusController(StatsQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Simple liveness probe.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Dataset and cache status.
     * GET /status → reading counts, load time, cached result count
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Dataset dataset = queryService.currentDataset();
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "readings", dataset.size(),
                "readingsWithValue", dataset.readingsWithValue(),
                "droppedRows", dataset.droppedRows(),
                "loadedAt", dataset.loadedAt().toString(),
                "cachedResults", queryService.cachedResults()
        ));
    }

    /**
     * GET /locations → ["lab-1", "lab-2", ...]
     */
    @GetMapping("/locations")
    public ResponseEntity<List<String>> locations() {
        return ResponseEntity.ok(queryService.currentDataset().distinctLocations());
    }

    /**
     * GET /sensors → ["humidity", "temperature", ...]
     */
    @GetMapping("/sensors")
    public ResponseEntity<List<String>> sensors() {
        return ResponseEntity.ok(queryService.currentDataset().distinctSensors());
    }
}
