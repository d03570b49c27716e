package com.transittracker.engine.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Alert priority of a geofence zone. Declaration order is sort order:
 * URGENT sorts first, LOW last.
 */
public enum ZonePriority {
    URGENT,
    HIGH,
    NORMAL,
    LOW;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ZonePriority fromString(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return ZonePriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
