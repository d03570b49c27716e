package com.transittracker.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Real-Time Transit Engine.
 *
 * Flow:
 * 1. Bus (JSON) and train (GTFS-Realtime) feeds are fetched on demand
 * 2. Positions are decoded, filtered to the service area and cached per feed
 * 3. Clients poll over REST or receive the scheduled WebSocket broadcast
 * 4. Client locations are checked against the zone snapshot for alerts
 *
 * @EnableScheduling drives zone refresh and the vehicle broadcast.
 */
@SpringBootApplication
@EnableScheduling
public class TransitEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransitEngineApplication.class, args);
    }
}
