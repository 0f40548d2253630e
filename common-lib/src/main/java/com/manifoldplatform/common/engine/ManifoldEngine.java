package com.manifoldplatform.common.engine;

import com.manifoldplatform.common.exception.InsufficientDataException;
import com.manifoldplatform.common.exception.InvalidConfigurationException;
import com.manifoldplatform.common.exception.MalformedSeriesException;
import com.manifoldplatform.common.model.Attractor;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.model.PriceSeries;
import com.manifoldplatform.common.model.TimeScale;
import com.manifoldplatform.common.numeric.Histogram;
import com.manifoldplatform.common.numeric.PeakFinder;
import com.manifoldplatform.common.numeric.SeriesMath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.manifoldplatform.common.numeric.SeriesMath.EPSILON;

/**
 * Geometric reading of a price series treated as a manifold.
 *
 * <ul>
 *   <li><b>Curvature</b>   - smoothed second derivative of the normalised price</li>
 *   <li><b>Entropy</b>     - Shannon entropy of the return distribution, global and rolling</li>
 *   <li><b>Tension</b>     - accumulated momentum scaled by distance from a long average</li>
 *   <li><b>Singularity</b> - joint curvature/tension extreme</li>
 *   <li><b>Attractor</b>   - densely visited price level</li>
 *   <li><b>Ricci flow</b>  - smoothed rate at which curvature is relaxing</li>
 * </ul>
 *
 * <p>The only configuration is {@code sensitivity}, which scales the
 * singularity threshold. Zero-variance input is absorbed by adding
 * {@link SeriesMath#EPSILON} to denominators; it is never reported as an error.
 *
 * <p>Stateless apart from the immutable sensitivity; safe for concurrent callers
 * that each pass their own arrays. No logging. No I/O.
 */
public final class ManifoldEngine {

    public static final double DEFAULT_SENSITIVITY = 1.0;
    public static final double MAX_SENSITIVITY = 10.0;

    public static final int DEFAULT_SMOOTH_WINDOW = 5;
    public static final int DEFAULT_ENTROPY_BINS = 50;
    public static final int DEFAULT_ENTROPY_WINDOW = 20;
    public static final int MIN_ENTROPY_WINDOW = 4;
    public static final int MAX_LOCAL_ENTROPY_BINS = 10;

    /** σ of the long equilibrium average used for tension. */
    public static final double LONG_AVERAGE_SIGMA = 20.0;

    public static final double DEFAULT_SINGULARITY_THRESHOLD = 2.0;
    public static final int SINGULARITY_MIN_DISTANCE = 10;

    public static final int ATTRACTOR_BINS = 50;
    public static final int DEFAULT_ATTRACTOR_COUNT = 5;
    public static final double ATTRACTOR_PROMINENCE_FACTOR = 0.5;
    public static final int ATTRACTOR_MIN_DISTANCE = 3;

    public static final double DEFAULT_FLOW_DT = 0.1;
    public static final double FLOW_SMOOTHING_SIGMA = 3.0;

    private final double sensitivity;

    public ManifoldEngine() {
        this(DEFAULT_SENSITIVITY);
    }

    /**
     * @param sensitivity multiplier for the singularity threshold, in (0, {@value #MAX_SENSITIVITY}]
     * @throws InvalidConfigurationException when out of range or not finite
     */
    public ManifoldEngine(double sensitivity) {
        if (!Double.isFinite(sensitivity) || sensitivity <= 0.0 || sensitivity > MAX_SENSITIVITY) {
            throw new InvalidConfigurationException("sensitivity",
                "must be in (0, " + MAX_SENSITIVITY + "] but was " + sensitivity);
        }
        this.sensitivity = sensitivity;
    }

    public double sensitivity() {
        return sensitivity;
    }

    // ── Full analysis ───────────────────────────────────────────────────────

    public ManifoldMetrics analyze(PriceSeries series, TimeScale timescale) {
        double[] prices = series.prices();
        double[] volume = series.volume();

        double[] curvature = calculateCurvature(prices);
        double entropy = calculateGlobalEntropy(prices);
        double[] localEntropy = calculateLocalEntropy(prices);
        double[] tension = calculateTension(prices, volume);

        List<Integer> singularities = detectSingularities(curvature, tension);
        List<Attractor> attractors = findAttractors(prices, volume);

        double[] ricciFlow = calculateRicciFlow(curvature, tension);

        return new ManifoldMetrics(
            series.timestamps(), prices, curvature, entropy, localEntropy,
            singularities, attractors, ricciFlow, tension,
            timescale == null ? TimeScale.DAILY : timescale);
    }

    /**
     * Array form of {@link #analyze(PriceSeries, TimeScale)}.
     *
     * @param timestamps nullable; sequential index when absent
     * @param volume     nullable
     * @throws InsufficientDataException when fewer than two prices are supplied
     * @throws MalformedSeriesException  when the parallel arrays disagree
     */
    public ManifoldMetrics analyze(double[] prices, double[] timestamps, TimeScale timescale, double[] volume) {
        return analyze(new PriceSeries(prices, volume, timestamps), timescale);
    }

    // ── Curvature ───────────────────────────────────────────────────────────

    public double[] calculateCurvature(double[] prices) {
        return calculateCurvature(prices, DEFAULT_SMOOTH_WINDOW);
    }

    /**
     * Second discrete derivative of the z-normalised price, Gaussian-smoothed
     * with σ = smoothWindow / 3 when {@code smoothWindow > 1}.
     */
    public double[] calculateCurvature(double[] prices, int smoothWindow) {
        requireSamples("calculateCurvature", prices, PriceSeries.MIN_SAMPLES);

        double[] normalized = SeriesMath.zScore(prices);
        double[] velocity = SeriesMath.gradient(normalized);
        double[] curvature = SeriesMath.gradient(velocity);

        if (smoothWindow > 1) {
            curvature = SeriesMath.gaussianFilter(curvature, smoothWindow / 3.0);
        }
        return curvature;
    }

    // ── Entropy ─────────────────────────────────────────────────────────────

    public double calculateGlobalEntropy(double[] prices) {
        return calculateGlobalEntropy(prices, DEFAULT_ENTROPY_BINS);
    }

    /** Shannon entropy (bits) of the density histogram of simple returns. */
    public double calculateGlobalEntropy(double[] prices, int bins) {
        requireSamples("calculateGlobalEntropy", prices, PriceSeries.MIN_SAMPLES);
        if (bins < 1) {
            throw new InvalidConfigurationException("entropy.bins", "must be >= 1 but was " + bins);
        }
        return Histogram.counts(simpleReturns(prices, 0, prices.length), bins).shannonEntropy();
    }

    public double[] calculateLocalEntropy(double[] prices) {
        return calculateLocalEntropy(prices, DEFAULT_ENTROPY_WINDOW);
    }

    /**
     * Rolling entropy over the trailing {@code window} samples (index i uses
     * {@code [i - window, i)}, so no value looks ahead). Leading indices are
     * backfilled with the first computed value; a series no longer than the
     * window yields all zeros.
     */
    public double[] calculateLocalEntropy(double[] prices, int window) {
        requireSamples("calculateLocalEntropy", prices, PriceSeries.MIN_SAMPLES);
        if (window < MIN_ENTROPY_WINDOW) {
            throw new InvalidConfigurationException("entropy.window",
                "must be >= " + MIN_ENTROPY_WINDOW + " but was " + window);
        }

        int n = prices.length;
        double[] local = new double[n];
        int bins = Math.min(MAX_LOCAL_ENTROPY_BINS, window / 2);

        for (int i = window; i < n; i++) {
            local[i] = Histogram.counts(simpleReturns(prices, i - window, i), bins).shannonEntropy();
        }

        if (window < n) {
            for (int i = 0; i < window; i++) local[i] = local[window];
        }
        return local;
    }

    // ── Tension ─────────────────────────────────────────────────────────────

    /**
     * |cumulative return| × relative distance from the σ=20 Gaussian average,
     * optionally weighted by volume relative to its mean, then z-scored.
     *
     * @param volume nullable; must match the price length when present
     */
    public double[] calculateTension(double[] prices, double[] volume) {
        requireSamples("calculateTension", prices, PriceSeries.MIN_SAMPLES);
        requireSameLength("calculateTension", prices, volume);

        int n = prices.length;
        double[] returns = new double[n];
        for (int i = 1; i < n; i++) {
            returns[i] = (prices[i] - prices[i - 1]) / (prices[i] + EPSILON);
        }
        double[] momentum = SeriesMath.cumulativeSum(returns);

        double[] longAverage = SeriesMath.gaussianFilter(prices, LONG_AVERAGE_SIGMA);

        double[] tension = new double[n];
        for (int i = 0; i < n; i++) {
            double distance = Math.abs(prices[i] - longAverage[i]) / (longAverage[i] + EPSILON);
            tension[i] = Math.abs(momentum[i]) * distance;
        }

        if (volume != null) {
            double meanVolume = SeriesMath.mean(volume) + EPSILON;
            for (int i = 0; i < n; i++) tension[i] *= volume[i] / meanVolume;
        }

        return SeriesMath.zScore(tension);
    }

    // ── Critical points ─────────────────────────────────────────────────────

    public List<Integer> detectSingularities(double[] curvature, double[] tension) {
        return detectSingularities(curvature, tension, DEFAULT_SINGULARITY_THRESHOLD);
    }

    /**
     * Indices where |curvature|/σ × |tension|/σ peaks at or above
     * {@code threshold × sensitivity}, at least {@value #SINGULARITY_MIN_DISTANCE}
     * samples apart. Ascending.
     */
    public List<Integer> detectSingularities(double[] curvature, double[] tension, double threshold) {
        requireSamples("detectSingularities", tension, 1);
        requireSameLength("detectSingularities", curvature, tension);

        double curvatureScale = SeriesMath.std(curvature) + EPSILON;
        double tensionScale = SeriesMath.std(tension) + EPSILON;

        double[] score = new double[curvature.length];
        for (int i = 0; i < score.length; i++) {
            score[i] = (Math.abs(curvature[i]) / curvatureScale) * (Math.abs(tension[i]) / tensionScale);
        }

        int[] peaks = PeakFinder.withHeight(threshold * sensitivity, SINGULARITY_MIN_DISTANCE).find(score);
        List<Integer> indices = new ArrayList<>(peaks.length);
        for (int peak : peaks) indices.add(peak);
        return indices;
    }

    public List<Attractor> findAttractors(double[] prices, double[] volume) {
        return findAttractors(prices, volume, DEFAULT_ATTRACTOR_COUNT);
    }

    /**
     * Densest price buckets (volume-weighted when volume is given), strongest
     * first, at most {@code numAttractors}. Falls back to the last price with
     * strength 1.0 when the histogram has no qualifying peak, so the result is
     * never empty.
     */
    public List<Attractor> findAttractors(double[] prices, double[] volume, int numAttractors) {
        requireSamples("findAttractors", prices, 1);
        requireSameLength("findAttractors", prices, volume);
        if (numAttractors < 1) {
            throw new InvalidConfigurationException("attractors.count", "must be >= 1 but was " + numAttractors);
        }

        Histogram histogram = Histogram.weighted(prices, volume, ATTRACTOR_BINS);
        double[] heights = histogram.heights();

        double prominence = SeriesMath.std(heights) * ATTRACTOR_PROMINENCE_FACTOR;
        int[] peaks = PeakFinder.withProminence(prominence, ATTRACTOR_MIN_DISTANCE).find(heights);

        if (peaks.length == 0) {
            return List.of(Attractor.of(prices[prices.length - 1], 1.0));
        }

        double strongest = 0.0;
        for (int peak : peaks) strongest = Math.max(strongest, heights[peak]);

        List<Attractor> attractors = new ArrayList<>(peaks.length);
        for (int peak : peaks) {
            attractors.add(Attractor.of(histogram.center(peak), heights[peak] / strongest));
        }
        attractors.sort(Comparator.comparingDouble(Attractor::strength).reversed());
        return List.copyOf(attractors.subList(0, Math.min(numAttractors, attractors.size())));
    }

    // ── Flow ────────────────────────────────────────────────────────────────

    public double[] calculateRicciFlow(double[] curvature, double[] tension) {
        return calculateRicciFlow(curvature, tension, DEFAULT_FLOW_DT);
    }

    /** Gaussian-smoothed (σ=3) gradient of −dt · curvature · (1 + tension). */
    public double[] calculateRicciFlow(double[] curvature, double[] tension, double dt) {
        requireSamples("calculateRicciFlow", curvature, PriceSeries.MIN_SAMPLES);
        requireSamples("calculateRicciFlow", tension, PriceSeries.MIN_SAMPLES);
        requireSameLength("calculateRicciFlow", curvature, tension);

        double[] flow = new double[curvature.length];
        for (int i = 0; i < flow.length; i++) {
            flow[i] = -dt * curvature[i] * (1.0 + tension[i]);
        }
        return SeriesMath.gaussianFilter(SeriesMath.gradient(flow), FLOW_SMOOTHING_SIGMA);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    /** (p[i] - p[i-1]) / (p[i-1] + ε) for i in (from, to). */
    private static double[] simpleReturns(double[] prices, int from, int to) {
        int count = Math.max(0, to - from - 1);
        double[] returns = new double[count];
        for (int k = 0; k < count; k++) {
            double previous = prices[from + k];
            returns[k] = (prices[from + k + 1] - previous) / (previous + EPSILON);
        }
        return returns;
    }

    private static void requireSamples(String operation, double[] values, int required) {
        int actual = values == null ? 0 : values.length;
        if (actual < required) {
            throw new InsufficientDataException(operation, required, actual);
        }
    }

    private static void requireSameLength(String operation, double[] reference, double[] other) {
        if (reference == null) {
            throw new InsufficientDataException(operation, PriceSeries.MIN_SAMPLES, 0);
        }
        if (other != null && other.length != reference.length) {
            throw new MalformedSeriesException(operation,
                "array lengths differ: " + reference.length + " vs " + other.length);
        }
    }
}
