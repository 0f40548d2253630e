package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Micro reading of the current phrase: whether the latest sample "holds"
 * or is about to crack.
 */
public enum SingerReading {
    RESONANT_STABLE("resonant_stable"),
    TENSION_CRACKLING("tension_crackling"),
    HARMONIOUS_FLOW("harmonious_flow"),
    DISSONANT_STRAIN("dissonant_strain");

    private final String value;

    SingerReading(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SingerReading fromValue(String value) {
        for (SingerReading reading : values()) {
            if (reading.value.equals(value)) return reading;
        }
        throw new IllegalArgumentException("Unknown singer reading: " + value);
    }
}
