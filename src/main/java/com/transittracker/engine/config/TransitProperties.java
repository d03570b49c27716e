package com.transittracker.engine.config;

import com.transittracker.engine.dto.GeofenceZone;
import com.transittracker.engine.dto.ServiceArea;
import com.transittracker.engine.dto.ZonePriority;
import com.transittracker.engine.exception.MissingConfigurationException;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All externally supplied settings of the engine, bound from {@code transit.*}.
 *
 * Nothing in the core hardcodes feed locations, the service area or zone
 * definitions; they all come through here. {@link #validate()} runs once
 * after binding and stops startup when something required is missing.
 */
@Data
@ConfigurationProperties(prefix = "transit")
public class TransitProperties implements InitializingBean {

    private Feeds feeds = new Feeds();
    private Cache cache = new Cache();
    private Area serviceArea = new Area();
    private Geofence geofence = new Geofence();
    private Broadcast broadcast = new Broadcast();

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * Fails fast on missing or nonsensical parameters.
     *
     * @throws MissingConfigurationException naming the first offending parameter
     */
    public void validate() {
        if (!feeds.isMockMode()) {
            requireText(feeds.getBusUrl(), "transit.feeds.bus-url");
            requireText(feeds.getTrainUrl(), "transit.feeds.train-url");
            if (feeds.isRelayed()) {
                requireText(feeds.getRelayUrl(), "transit.feeds.relay-url");
                requireText(feeds.getRelayParam(), "transit.feeds.relay-param");
            }
        }

        requireValue(serviceArea.getMinLatitude(), "transit.service-area.min-latitude");
        requireValue(serviceArea.getMaxLatitude(), "transit.service-area.max-latitude");
        requireValue(serviceArea.getMinLongitude(), "transit.service-area.min-longitude");
        requireValue(serviceArea.getMaxLongitude(), "transit.service-area.max-longitude");
        if (serviceArea.getMinLatitude() > serviceArea.getMaxLatitude()
            || serviceArea.getMinLongitude() > serviceArea.getMaxLongitude()) {
            throw new MissingConfigurationException("transit.service-area",
                "minimum bounds must not exceed maximum bounds");
        }

        requirePositive(cache.getTtl(), "transit.cache.ttl");
        requirePositive(cache.getFetchTimeout(), "transit.cache.fetch-timeout");
        if (cache.getGraceMultiplier() < 1) {
            throw new MissingConfigurationException("transit.cache.grace-multiplier", "must be >= 1");
        }

        requirePositive(geofence.getResultTtl(), "transit.geofence.result-ttl");
        if (!(geofence.getBucketResolutionMeters() > 0)) {
            throw new MissingConfigurationException("transit.geofence.bucket-resolution-meters", "must be > 0");
        }
        for (int i = 0; i < geofence.getZones().size(); i++) {
            Zone zone = geofence.getZones().get(i);
            String prefix = "transit.geofence.zones[" + i + "]";
            requireText(zone.getId(), prefix + ".id");
            requireValue(zone.getLatitude(), prefix + ".latitude");
            requireValue(zone.getLongitude(), prefix + ".longitude");
            requireValue(zone.getRadiusMeters(), prefix + ".radius-meters");
        }
    }

    private static void requireText(String value, String parameter) {
        if (value == null || value.isBlank()) {
            throw new MissingConfigurationException(parameter, "value is required");
        }
    }

    private static void requireValue(Object value, String parameter) {
        if (value == null) {
            throw new MissingConfigurationException(parameter, "value is required");
        }
    }

    private static void requirePositive(Duration value, String parameter) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new MissingConfigurationException(parameter, "must be a positive duration");
        }
    }

    @Data
    public static class Feeds {
        /** Deployment context: true routes the train feed through the HTTP relay. */
        private boolean relayed = false;
        private String relayUrl;
        /** Query parameter carrying the percent-encoded upstream URL. */
        private String relayParam = "url";
        private boolean mockMode = false;
        private long mockSeed = 42L;
        private int mockBusCount = 12;
        private int mockTrainCount = 8;
        private String busUrl;
        private String trainUrl;
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(30);
        /** Last live snapshot is still served (as "cached") up to ttl x multiplier old. */
        private int graceMultiplier = 5;
        private Duration fetchTimeout = Duration.ofSeconds(10);

        public Duration graceWindow() {
            return ttl.multipliedBy(graceMultiplier);
        }
    }

    @Data
    public static class Area {
        private Double minLatitude;
        private Double maxLatitude;
        private Double minLongitude;
        private Double maxLongitude;

        public ServiceArea toServiceArea() {
            return new ServiceArea(minLatitude, maxLatitude, minLongitude, maxLongitude);
        }
    }

    @Data
    public static class Geofence {
        /** "config" reads {@link #zones}; "redis" reads the Redis zone store. */
        private String zoneStore = "config";
        private double bucketResolutionMeters = 75.0;
        private Duration resultTtl = Duration.ofSeconds(60);
        private int maxCachedBuckets = 10_000;
        private Duration refreshInterval = Duration.ofMinutes(5);
        private List<Zone> zones = new ArrayList<>();
    }

    @Data
    public static class Zone {
        private String id;
        private Double latitude;
        private Double longitude;
        private Double radiusMeters;
        private ZonePriority priority = ZonePriority.NORMAL;
        private String message;
        private boolean active = true;

        public GeofenceZone toGeofenceZone() {
            return new GeofenceZone(id, latitude, longitude, radiusMeters, priority, message, active);
        }
    }

    @Data
    public static class Broadcast {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);
    }
}
