package com.manifoldplatform.common.engine;

import com.manifoldplatform.common.exception.InsufficientDataException;
import com.manifoldplatform.common.exception.InvalidConfigurationException;
import com.manifoldplatform.common.exception.MalformedSeriesException;
import com.manifoldplatform.common.model.Attractor;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.model.PriceSeries;
import com.manifoldplatform.common.model.TimeScale;
import com.manifoldplatform.common.numeric.SeriesMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural properties of {@link ManifoldEngine} on synthetic series.
 */
class ManifoldEngineTest {

    private final ManifoldEngine engine = new ManifoldEngine();

    static double[] randomWalk(int n, long seed) {
        Random random = new Random(seed);
        double[] prices = new double[n];
        prices[0] = 100.0;
        for (int i = 1; i < n; i++) {
            prices[i] = prices[i - 1] * (1.0 + 0.02 * random.nextGaussian());
        }
        return prices;
    }

    static double[] linear(int n, double from, double to) {
        double[] prices = new double[n];
        for (int i = 0; i < n; i++) prices[i] = from + (to - from) * i / (n - 1);
        return prices;
    }

    static double[] constant(int n, double value) {
        double[] prices = new double[n];
        Arrays.fill(prices, value);
        return prices;
    }

    /** 0 and 100 fix the range; 40 samples at 21, 2 at 81. */
    static double[] denseAndSparseBands() {
        double[] prices = new double[44];
        Arrays.fill(prices, 1, 41, 21.0);
        prices[41] = 81.0;
        prices[42] = 81.0;
        prices[43] = 100.0;
        return prices;
    }

    // ── construction ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("sensitivity")
    class Sensitivity {

        @Test
        @DisplayName("default is 1.0")
        void defaultSensitivity() {
            assertEquals(1.0, engine.sensitivity());
        }

        @Test
        @DisplayName("zero, negative, above 10 and NaN are rejected")
        void outOfRange() {
            assertThrows(InvalidConfigurationException.class, () -> new ManifoldEngine(0.0));
            assertThrows(InvalidConfigurationException.class, () -> new ManifoldEngine(-1.0));
            assertThrows(InvalidConfigurationException.class, () -> new ManifoldEngine(10.5));
            assertThrows(InvalidConfigurationException.class, () -> new ManifoldEngine(Double.NaN));
        }

        @Test
        @DisplayName("higher sensitivity never reports more singularities")
        void higherSensitivityFewerSingularities() {
            double[] prices = randomWalk(300, 7L);
            int relaxed = new ManifoldEngine(0.5).analyze(prices, null, TimeScale.DAILY, null).singularities().size();
            int strict = new ManifoldEngine(5.0).analyze(prices, null, TimeScale.DAILY, null).singularities().size();
            assertTrue(strict <= relaxed, "strict=" + strict + " relaxed=" + relaxed);
        }
    }

    // ── analyze() ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("analyze() - full snapshot")
    class Analyze {

        @Test
        @DisplayName("every per-sample array has the input length")
        void lengthsMatchInput() {
            double[] prices = randomWalk(150, 1L);
            ManifoldMetrics m = engine.analyze(prices, null, TimeScale.DAILY, null);

            assertEquals(150, m.size());
            assertEquals(150, m.curvature().length);
            assertEquals(150, m.tension().length);
            assertEquals(150, m.localEntropy().length);
            assertEquals(150, m.ricciFlow().length);
            assertEquals(150, m.timestamp().length);
            assertEquals(TimeScale.DAILY, m.timescale());
        }

        @Test
        @DisplayName("missing timestamps → sequential index")
        void syntheticTimestamps() {
            ManifoldMetrics m = engine.analyze(new double[]{1, 2, 3}, null, TimeScale.WEEKLY, null);
            assertArrayEquals(new double[]{0, 1, 2}, m.timestamp(), 0.0);
        }

        @Test
        @DisplayName("null timescale → DAILY")
        void nullTimescale() {
            assertEquals(TimeScale.DAILY, engine.analyze(PriceSeries.of(randomWalk(30, 3L)), null).timescale());
        }

        @Test
        @DisplayName("fewer than two prices → InsufficientDataException")
        void tooShort() {
            assertThrows(InsufficientDataException.class,
                () -> engine.analyze(new double[]{100.0}, null, TimeScale.DAILY, null));
            assertThrows(InsufficientDataException.class,
                () -> engine.analyze(new double[0], null, TimeScale.DAILY, null));
        }

        @Test
        @DisplayName("two prices are enough")
        void twoPrices() {
            ManifoldMetrics m = engine.analyze(new double[]{100.0, 101.0}, null, TimeScale.DAILY, null);
            assertEquals(2, m.size());
            assertFalse(m.attractors().isEmpty());
        }

        @Test
        @DisplayName("volume length mismatch → MalformedSeriesException")
        void volumeMismatch() {
            assertThrows(MalformedSeriesException.class,
                () -> engine.analyze(new double[]{1, 2, 3}, null, TimeScale.DAILY, new double[]{1, 2}));
        }

        @Test
        @DisplayName("caller arrays are never modified")
        void inputsUntouched() {
            double[] prices = randomWalk(60, 11L);
            double[] copy = prices.clone();
            engine.analyze(prices, null, TimeScale.DAILY, null);
            assertArrayEquals(copy, prices, 0.0);
        }
    }

    // ── curvature / entropy ────────────────────────────────────────────────

    @Nested
    @DisplayName("degenerate series")
    class Degenerate {

        @Test
        @DisplayName("constant prices → zero curvature, zero tension, finite entropy")
        void constantSeries() {
            ManifoldMetrics m = engine.analyze(constant(80, 50.0), null, TimeScale.DAILY, null);

            for (double c : m.curvature()) assertEquals(0.0, c, 1e-12);
            for (double t : m.tension()) assertEquals(0.0, t, 1e-12);
            for (double f : m.ricciFlow()) assertEquals(0.0, f, 1e-12);
            assertTrue(Double.isFinite(m.entropy()));
            assertTrue(m.singularities().isEmpty());
        }

        @Test
        @DisplayName("constant prices → single attractor at that price")
        void constantAttractor() {
            List<Attractor> attractors = engine.findAttractors(constant(40, 5.0), null);
            assertEquals(1, attractors.size());
            assertEquals(5.0, attractors.get(0).price(), 0.05);
            assertEquals(1.0, attractors.get(0).strength(), 1e-12);
        }

        @Test
        @DisplayName("linear 100→200 → near-zero curvature, no singularities")
        void linearSeries() {
            ManifoldMetrics m = engine.analyze(linear(100, 100.0, 200.0), null, TimeScale.DAILY, null);
            for (double c : m.curvature()) assertEquals(0.0, c, 1e-9);
            assertTrue(m.singularities().isEmpty());
        }
    }

    @Nested
    @DisplayName("calculateLocalEntropy()")
    class LocalEntropy {

        @Test
        @DisplayName("series no longer than the window → zeros")
        void shortSeries() {
            double[] local = engine.calculateLocalEntropy(randomWalk(20, 5L), 20);
            for (double v : local) assertEquals(0.0, v);
        }

        @Test
        @DisplayName("leading window is back-filled with the first computed value")
        void backfill() {
            double[] local = engine.calculateLocalEntropy(randomWalk(60, 5L), 20);
            for (int i = 0; i < 20; i++) assertEquals(local[20], local[i]);
        }

        @Test
        @DisplayName("never looks ahead: changing the last price leaves every value unchanged")
        void noLookAhead() {
            double[] prices = randomWalk(80, 9L);
            double[] before = engine.calculateLocalEntropy(prices, 20);
            prices[79] *= 3.0;
            assertArrayEquals(before, engine.calculateLocalEntropy(prices, 20), 0.0);
        }

        @Test
        @DisplayName("window below 4 → InvalidConfigurationException")
        void tinyWindow() {
            assertThrows(InvalidConfigurationException.class,
                () -> engine.calculateLocalEntropy(randomWalk(30, 5L), 3));
        }
    }

    @Nested
    @DisplayName("calculateTension()")
    class Tension {

        @Test
        @DisplayName("output is z-scored")
        void zScored() {
            double[] tension = engine.calculateTension(randomWalk(200, 13L), null);
            assertEquals(0.0, SeriesMath.mean(tension), 1e-9);
            assertEquals(1.0, SeriesMath.std(tension), 1e-4);
        }

        @Test
        @DisplayName("uniform volume leaves tension unchanged")
        void uniformVolume() {
            double[] prices = randomWalk(120, 17L);
            double[] volume = constant(120, 1000.0);
            assertArrayEquals(engine.calculateTension(prices, null),
                engine.calculateTension(prices, volume), 1e-6);
        }
    }

    @Nested
    @DisplayName("critical points")
    class CriticalPoints {

        @Test
        @DisplayName("singularities are ascending and at least 10 samples apart")
        void singularitySpacing() {
            for (long seed = 1; seed <= 5; seed++) {
                ManifoldMetrics m = new ManifoldEngine(0.2).analyze(randomWalk(400, seed), null, TimeScale.DAILY, null);
                List<Integer> s = m.singularities();
                for (int i = 1; i < s.size(); i++) {
                    assertTrue(s.get(i) - s.get(i - 1) >= ManifoldEngine.SINGULARITY_MIN_DISTANCE,
                        "seed " + seed + ": " + s);
                }
            }
        }

        @Test
        @DisplayName("mismatched curvature/tension → MalformedSeriesException")
        void mismatchedSingularityInput() {
            assertThrows(MalformedSeriesException.class,
                () -> engine.detectSingularities(new double[5], new double[4]));
        }

        @Test
        @DisplayName("attractors: 1..5, strongest first, strengths in [0, 1]")
        void attractorShape() {
            double[] prices = randomWalk(300, 21L);
            List<Attractor> attractors = engine.findAttractors(prices, null);

            assertFalse(attractors.isEmpty());
            assertTrue(attractors.size() <= ManifoldEngine.DEFAULT_ATTRACTOR_COUNT);
            assertEquals(1.0, attractors.get(0).strength(), 1e-12);
            for (int i = 0; i < attractors.size(); i++) {
                Attractor a = attractors.get(i);
                assertTrue(a.strength() >= 0.0 && a.strength() <= 1.0);
                assertTrue(a.price() >= SeriesMath.min(prices) && a.price() <= SeriesMath.max(prices));
                if (i > 0) assertTrue(attractors.get(i - 1).strength() >= a.strength());
            }
        }

        @Test
        @DisplayName("heavy volume on a sparse band moves the strongest attractor there")
        void volumeWeightedAttractors() {
            double[] prices = denseAndSparseBands();
            double[] volume = constant(prices.length, 1.0);
            volume[41] = 1000.0;
            volume[42] = 1000.0;

            List<Attractor> byCount = engine.findAttractors(prices, null);
            assertEquals(21.0, byCount.get(0).price(), 1e-12);
            assertEquals(1.0, byCount.get(0).strength(), 1e-12);

            List<Attractor> byVolume = engine.findAttractors(prices, volume);
            assertEquals(81.0, byVolume.get(0).price(), 1e-12);
            assertEquals(1.0, byVolume.get(0).strength(), 1e-12);

            ManifoldMetrics m = engine.analyze(PriceSeries.of(prices, volume), TimeScale.DAILY);
            assertEquals(81.0, m.attractors().get(0).price(), 1e-12);
        }

        @Test
        @DisplayName("uniform volume keeps the count-based attractors")
        void uniformVolumeAttractors() {
            double[] prices = denseAndSparseBands();
            assertEquals(engine.findAttractors(prices, null),
                engine.findAttractors(prices, constant(prices.length, 250.0)));
        }

        @Test
        @DisplayName("all-zero volume → (last price, 1.0)")
        void zeroVolumeAttractors() {
            double[] prices = denseAndSparseBands();
            List<Attractor> attractors = engine.findAttractors(prices, new double[prices.length]);

            assertEquals(List.of(Attractor.of(prices[prices.length - 1], 1.0)), attractors);
        }

        @Test
        @DisplayName("attractor count below 1 → InvalidConfigurationException")
        void invalidAttractorCount() {
            assertThrows(InvalidConfigurationException.class,
                () -> engine.findAttractors(randomWalk(30, 1L), null, 0));
        }

        @Test
        @DisplayName("zero curvature → zero flow")
        void zeroCurvatureFlow() {
            double[] flow = engine.calculateRicciFlow(new double[30], randomWalk(30, 2L));
            for (double f : flow) assertEquals(0.0, f, 1e-15);
        }
    }
}
