package com.transittracker.engine.dto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wire names must not depend on the JVM default locale. Turkish maps
 * 'I' to a dotless 'ı' under default-locale case conversion.
 */
class WireEnumLocaleTest {

    private static final Locale TURKISH = Locale.forLanguageTag("tr-TR");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Locale previousLocale;

    @BeforeEach
    void useTurkishLocale() {
        previousLocale = Locale.getDefault();
        Locale.setDefault(TURKISH);
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previousLocale);
    }

    @Test
    void shouldSerializeProvenanceAndPriorityWithAsciiNames() throws JsonProcessingException {
        assertThat(objectMapper.writeValueAsString(Provenance.LIVE)).isEqualTo("\"live\"");
        assertThat(objectMapper.writeValueAsString(ZonePriority.HIGH)).isEqualTo("\"high\"");
        assertThat(objectMapper.writeValueAsString(VehicleClass.TRAIN)).isEqualTo("\"train\"");
    }

    @Test
    void shouldParseLowercaseNamesUnderTurkishLocale() throws JsonProcessingException {
        assertThat(ZonePriority.fromString("high")).isEqualTo(ZonePriority.HIGH);
        assertThat(objectMapper.readValue("\"high\"", ZonePriority.class)).isEqualTo(ZonePriority.HIGH);
        assertThat(VehicleClass.fromString("trains")).isEqualTo(VehicleClass.TRAIN);
    }
}
