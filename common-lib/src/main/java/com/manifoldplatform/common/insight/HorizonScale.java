package com.manifoldplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.manifoldplatform.common.exception.InvalidConfigurationException;
import com.manifoldplatform.common.model.TimeScale;

/**
 * Projection horizon. Each horizon analyses at a {@link TimeScale} and widens
 * the projected range by its multiplier.
 */
public enum HorizonScale {
    MICRO("micro", TimeScale.INTRADAY, 0.5),
    SHORT("short", TimeScale.INTRADAY, 1.0),
    MEDIUM("medium", TimeScale.DAILY, 2.0),
    LONG("long", TimeScale.WEEKLY, 4.0),
    MACRO("macro", TimeScale.MONTHLY, 8.0);

    private final String value;
    private final TimeScale timescale;
    private final double rangeMultiplier;

    HorizonScale(String value, TimeScale timescale, double rangeMultiplier) {
        this.value = value;
        this.timescale = timescale;
        this.rangeMultiplier = rangeMultiplier;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public TimeScale timescale() {
        return timescale;
    }

    public double rangeMultiplier() {
        return rangeMultiplier;
    }

    @JsonCreator
    public static HorizonScale fromValue(String value) {
        if (value != null) {
            for (HorizonScale horizon : values()) {
                if (horizon.value.equalsIgnoreCase(value.trim())) return horizon;
            }
        }
        throw new InvalidConfigurationException("horizon", "unsupported horizon '" + value + "'");
    }
}
