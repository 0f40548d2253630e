package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.manifoldplatform.common.exception.InvalidConfigurationException;

/**
 * Temporal resolution a {@link ManifoldMetrics} snapshot was computed at.
 *
 * <p>The stride is the fixed decimation factor applied to a full-resolution
 * series when re-analysing it at this scale. Decimation keeps every
 * {@code stride}-th sample; it does not aggregate the samples in between.
 */
public enum TimeScale {
    MONTHLY("monthly", 20),
    WEEKLY("weekly", 5),
    DAILY("daily", 1),
    INTRADAY("intraday", 1);

    private final String value;
    private final int stride;

    TimeScale(String value, int stride) {
        this.value = value;
        this.stride = stride;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int stride() {
        return stride;
    }

    /**
     * @throws InvalidConfigurationException for a null or unknown tag
     */
    @JsonCreator
    public static TimeScale fromValue(String value) {
        if (value != null) {
            for (TimeScale scale : values()) {
                if (scale.value.equalsIgnoreCase(value.trim())) {
                    return scale;
                }
            }
        }
        throw new InvalidConfigurationException("timescale", "unsupported timescale '" + value + "'");
    }
}
