package com.manifoldplatform.common.model;

import com.manifoldplatform.common.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimeScaleTest {

    @Test
    @DisplayName("tags parse case-insensitively with surrounding whitespace")
    void parse() {
        assertEquals(TimeScale.WEEKLY, TimeScale.fromValue(" Weekly "));
        assertEquals(TimeScale.INTRADAY, TimeScale.fromValue("intraday"));
    }

    @Test
    @DisplayName("unknown or null tag → InvalidConfigurationException")
    void unknown() {
        assertThrows(InvalidConfigurationException.class, () -> TimeScale.fromValue("hourly"));
        assertThrows(InvalidConfigurationException.class, () -> TimeScale.fromValue(null));
    }

    @Test
    @DisplayName("decimation strides: monthly 20, weekly 5, daily and intraday 1")
    void strides() {
        assertEquals(20, TimeScale.MONTHLY.stride());
        assertEquals(5, TimeScale.WEEKLY.stride());
        assertEquals(1, TimeScale.DAILY.stride());
        assertEquals(1, TimeScale.INTRADAY.stride());
    }
}
