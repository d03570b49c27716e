package com.transittracker.engine.config;

import com.transittracker.engine.exception.MissingConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitPropertiesTest {

    private TransitProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TransitProperties();
        properties.getFeeds().setBusUrl("http://feed.test/bus");
        properties.getFeeds().setTrainUrl("http://feed.test/rail");
        properties.getServiceArea().setMinLatitude(33.40);
        properties.getServiceArea().setMaxLatitude(34.20);
        properties.getServiceArea().setMinLongitude(-84.85);
        properties.getServiceArea().setMaxLongitude(-84.00);
    }

    @Test
    void shouldAcceptCompleteConfiguration() {
        assertThatCode(properties::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldRequireFeedUrlsOutsideMockMode() {
        properties.getFeeds().setTrainUrl(" ");

        assertThatThrownBy(properties::validate)
            .isInstanceOfSatisfying(MissingConfigurationException.class,
                e -> assertThat(e.getParameter()).isEqualTo("transit.feeds.train-url"));
    }

    @Test
    void shouldNotRequireFeedUrlsInMockMode() {
        properties.getFeeds().setBusUrl(null);
        properties.getFeeds().setTrainUrl(null);
        properties.getFeeds().setMockMode(true);

        assertThatCode(properties::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldRequireRelayUrlWhenRelayed() {
        properties.getFeeds().setRelayed(true);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(MissingConfigurationException.class)
            .hasMessageContaining("transit.feeds.relay-url");
    }

    @Test
    void shouldRequireServiceArea() {
        properties.getServiceArea().setMaxLongitude(null);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(MissingConfigurationException.class)
            .hasMessageContaining("transit.service-area.max-longitude");
    }

    @Test
    void shouldRejectNonPositiveTimings() {
        properties.getCache().setTtl(Duration.ZERO);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(MissingConfigurationException.class)
            .hasMessageContaining("transit.cache.ttl");
    }

    @Test
    void shouldRequireZoneRadius() {
        TransitProperties.Zone zone = new TransitProperties.Zone();
        zone.setId("stadium");
        zone.setLatitude(33.7545);
        zone.setLongitude(-84.4025);
        properties.getGeofence().getZones().add(zone);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(MissingConfigurationException.class)
            .hasMessageContaining("transit.geofence.zones[0].radius-meters");
    }
}
