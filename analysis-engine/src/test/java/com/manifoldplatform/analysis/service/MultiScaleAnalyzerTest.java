package com.manifoldplatform.analysis.service;

import com.manifoldplatform.common.engine.ManifoldEngine;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.model.PriceSeries;
import com.manifoldplatform.common.model.TimeScale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MultiScaleAnalyzerTest {

    private final MultiScaleAnalyzer analyzer = new MultiScaleAnalyzer(new ManifoldEngine());

    static PriceSeries wave(int n) {
        double[] prices = new double[n];
        double[] volume = new double[n];
        for (int i = 0; i < n; i++) {
            prices[i] = 100.0 + 8.0 * Math.sin(i / 9.0) + 0.05 * i;
            volume[i] = 1000.0 + 100.0 * Math.cos(i / 5.0);
        }
        return PriceSeries.of(prices, volume);
    }

    @Test
    @DisplayName("all four scales by default, coarse to fine")
    void allScales() {
        Map<TimeScale, ManifoldMetrics> result = analyzer.analyzeMultiscale(wave(200)).block();

        assertNotNull(result);
        assertEquals(List.of(TimeScale.MONTHLY, TimeScale.WEEKLY, TimeScale.DAILY, TimeScale.INTRADAY),
            List.copyOf(result.keySet()));
        assertEquals(10, result.get(TimeScale.MONTHLY).size());
        assertEquals(40, result.get(TimeScale.WEEKLY).size());
        assertEquals(200, result.get(TimeScale.DAILY).size());
        assertEquals(TimeScale.WEEKLY, result.get(TimeScale.WEEKLY).timescale());
    }

    @Test
    @DisplayName("a scale that cannot be analysed is skipped without aborting the others")
    void failingScaleSkipped() {
        Map<TimeScale, ManifoldMetrics> result = analyzer.analyzeMultiscale(wave(15)).block();

        assertNotNull(result);
        assertFalse(result.containsKey(TimeScale.MONTHLY));
        assertEquals(3, result.size());
        assertEquals(3, result.get(TimeScale.WEEKLY).size());
    }

    @Test
    @DisplayName("requested subset only")
    void subset() {
        Map<TimeScale, ManifoldMetrics> result =
            analyzer.analyzeMultiscale(wave(50), List.of(TimeScale.DAILY, TimeScale.WEEKLY)).block();

        assertNotNull(result);
        assertEquals(List.of(TimeScale.WEEKLY, TimeScale.DAILY), List.copyOf(result.keySet()));
    }

    @Test
    @DisplayName("every scale failing → empty map")
    void allFail() {
        Map<TimeScale, ManifoldMetrics> result =
            analyzer.analyzeMultiscale(wave(3), List.of(TimeScale.MONTHLY, TimeScale.WEEKLY)).block();
        assertNotNull(result);
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("resample() decimates prices, volume and timestamps together")
    void resample() {
        PriceSeries weekly = analyzer.resample(wave(50), TimeScale.WEEKLY);

        assertEquals(10, weekly.size());
        assertArrayEquals(new double[]{0, 5, 10, 15, 20, 25, 30, 35, 40, 45}, weekly.timestamps(), 0.0);
        assertEquals(10, weekly.volume().length);
        assertEquals(50, analyzer.resample(wave(50), TimeScale.DAILY).size());
    }
}
