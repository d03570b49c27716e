package com.transittracker.engine.integration;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs against the mock feeds and the zones in the test application.yml.
 */
@SpringBootTest
@AutoConfigureMockMvc
class TransitEngineIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldReturnHealthy() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.mockMode").value(true));
    }

    @Test
    void shouldServeMockVehicles() throws Exception {
        mockMvc.perform(get("/api/vehicles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("mock"))
                .andExpect(jsonPath("$.buses", hasSize(5)))
                .andExpect(jsonPath("$.trains", hasSize(3)))
                .andExpect(jsonPath("$.buses[0].vehicleClass").value("bus"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void shouldServeSingleFeedSnapshot() throws Exception {
        mockMvc.perform(get("/api/vehicles/trains"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vehicleClass").value("train"))
                .andExpect(jsonPath("$.provenance").value("mock"))
                .andExpect(jsonPath("$.positions", hasSize(3)));
    }

    @Test
    void shouldRejectUnknownVehicleClass() throws Exception {
        mockMvc.perform(get("/api/vehicles/planes"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("ERROR"));
    }

    @Test
    void shouldExposeFeedCacheStatistics() throws Exception {
        mockMvc.perform(get("/api/vehicles/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(post("/api/vehicles/cache/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"));
    }

    @Test
    void shouldReturnAlertsOrderedByPriority() throws Exception {
        mockMvc.perform(get("/api/geofence/check")
                        .param("lat", "33.7545")
                        .param("lng", "-84.4025"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.triggeredZoneIds", contains("stadium", "plaza")))
                .andExpect(jsonPath("$.alerts[0].priority").value("urgent"));
    }

    @Test
    void shouldReturnNoAlertsFarFromZones() throws Exception {
        mockMvc.perform(get("/api/geofence/check")
                        .param("lat", "33.6407")
                        .param("lng", "-84.4277"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alerts", hasSize(0)));
    }

    @Test
    void shouldRejectOutOfRangeLatitude() throws Exception {
        mockMvc.perform(get("/api/geofence/check")
                        .param("lat", "95.0")
                        .param("lng", "-84.4025"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldListAllZonesAndRefresh() throws Exception {
        mockMvc.perform(get("/api/geofence/zones"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)));

        mockMvc.perform(post("/api/geofence/zones/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeZones").value(2));

        mockMvc.perform(get("/api/geofence/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeZones").value(2))
                .andExpect(jsonPath("$.cacheHitRate").exists());
    }
}
