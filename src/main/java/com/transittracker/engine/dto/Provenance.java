package com.transittracker.engine.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a snapshot was obtained. Clients render a "data may be delayed"
 * indicator from anything other than LIVE or MOCK.
 */
public enum Provenance {
    LIVE,
    CACHED,
    MOCK,
    PARTIAL,
    ERROR;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isDegraded() {
        return this == CACHED || this == ERROR;
    }
}
