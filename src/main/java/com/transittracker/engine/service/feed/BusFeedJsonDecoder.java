package com.transittracker.engine.service.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;
import com.transittracker.engine.exception.FeedDecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes the JSON bus feed.
 *
 * Accepted shapes: a top-level array of vehicle objects, or an object with
 * a {@code vehicles} array. Field names vary between upstream versions, so
 * each field is looked up under a few aliases.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BusFeedJsonDecoder implements FeedFormatDecoder {

    static final String VEHICLES_FIELD = "vehicles";

    // Epoch values above this are milliseconds (1e11 s is in the year 5138)
    private static final double EPOCH_MILLIS_THRESHOLD = 1e11;

    private final ObjectMapper objectMapper;

    @Override
    public List<VehiclePosition> decode(byte[] raw, VehicleClass vehicleClass, Instant capturedAt)
        throws FeedDecodeException {

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (IOException e) {
            throw new FeedDecodeException(FeedDecodeException.Reason.MALFORMED,
                "Bus feed is not valid JSON: " + e.getMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new FeedDecodeException(FeedDecodeException.Reason.MALFORMED, "Bus feed payload is empty");
        }

        JsonNode vehicles = root.isArray() ? root : root.path(VEHICLES_FIELD);
        if (!vehicles.isArray()) {
            throw new FeedDecodeException(FeedDecodeException.Reason.SCHEMA_VIOLATION,
                "Bus feed has no vehicle array");
        }

        List<VehiclePosition> positions = new ArrayList<>(vehicles.size());
        int skipped = 0;
        for (JsonNode entry : vehicles) {
            Optional<VehiclePosition> position = parseEntry(entry, vehicleClass, capturedAt);
            if (position.isPresent()) {
                positions.add(position.get());
            } else {
                skipped++;
            }
        }

        if (skipped > 0) {
            log.debug("Skipped {} malformed bus feed entries out of {}", skipped, vehicles.size());
        }
        return positions;
    }

    private Optional<VehiclePosition> parseEntry(JsonNode entry, VehicleClass vehicleClass, Instant capturedAt) {
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }

        String id = text(entry, "id", "vehicle", "vehicleId");
        Double latitude = number(entry, "lat", "latitude");
        Double longitude = number(entry, "lon", "lng", "longitude");
        if (id == null || latitude == null || longitude == null) {
            return Optional.empty();
        }

        Instant observedAt;
        try {
            observedAt = timestamp(entry, capturedAt);
        } catch (DateTimeException e) {
            log.debug("Unparsable timestamp for bus {}: {}", id, e.getMessage());
            return Optional.empty();
        }

        try {
            return Optional.of(new VehiclePosition(
                id,
                vehicleClass,
                text(entry, "route", "routeId"),
                latitude,
                longitude,
                number(entry, "heading", "bearing"),
                number(entry, "speed"),
                observedAt
            ));
        } catch (IllegalArgumentException e) {
            log.debug("Rejected bus feed entry {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private static JsonNode field(JsonNode entry, String... names) {
        for (String name : names) {
            JsonNode value = entry.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode entry, String... names) {
        JsonNode value = field(entry, names);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Double number(JsonNode entry, String... names) {
        JsonNode value = field(entry, names);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant timestamp(JsonNode entry, Instant capturedAt) {
        JsonNode value = field(entry, "timestamp", "time", "observedAt");
        if (value == null) {
            return capturedAt;
        }

        Double epoch = number(entry, "timestamp", "time", "observedAt");
        if (epoch != null) {
            return epoch > EPOCH_MILLIS_THRESHOLD
                ? Instant.ofEpochMilli(epoch.longValue())
                : Instant.ofEpochSecond(epoch.longValue());
        }

        return Instant.parse(value.asText().trim());
    }
}
