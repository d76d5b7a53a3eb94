package com.sensorstats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SensorStatsApplication {

    private static final Logger log = LoggerFactory.getLogger(SensorStatsApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SensorStatsApplication.class, args);
        log.info("Sensor Stats Service started.");
        log.info("Stats API:  GET http://localhost:8080/stats?location=<loc>&sensor=<type>&start_date=<date>&end_date=<date>");
        log.info("Status:     GET http://localhost:8080/status");
        log.info("Health:     GET http://localhost:8080/actuator/health");
    }
}
