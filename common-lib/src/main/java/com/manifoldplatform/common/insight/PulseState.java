package com.manifoldplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse state label used by the pulse summary. */
public enum PulseState {
    HIGH_TENSION("high_tension"),
    COMPRESSED("compressed"),
    CHAOTIC("chaotic"),
    STABLE("stable"),
    TRANSITIONAL("transitional");

    private final String value;

    PulseState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
