package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Macro reading of the whole composition: where the recent tension and
 * curvature trends are heading.
 */
public enum ConductorReading {
    CRESCENDO("crescendo"),
    DECRESCENDO("decrescendo"),
    SUSTAINED_TENSION("sustained_tension"),
    REST_PHASE("rest_phase"),
    TRANSITIONAL("transitional");

    private final String value;

    ConductorReading(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConductorReading fromValue(String value) {
        for (ConductorReading reading : values()) {
            if (reading.value.equals(value)) return reading;
        }
        throw new IllegalArgumentException("Unknown conductor reading: " + value);
    }
}
