package com.flow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowDetectionApplication {

    private static final Logger log = LoggerFactory.getLogger(FlowDetectionApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FlowDetectionApplication.class, args);
        log.info("Institutional Flow Detector started.");
        log.info("Signals:      GET http://localhost:8080/signals/recent?limit=20");
        log.info("Summary:      GET http://localhost:8080/signals/summary");
        log.info("Status:       GET http://localhost:8080/status");
        log.info("Health:       GET http://localhost:8080/actuator/health");
    }
}
