package com.manifoldplatform.common.numeric;

/**
 * Pure array arithmetic shared by the engine and the interpreters.
 * Inputs are ordered oldest-first and are never modified.
 */
public final class SeriesMath {

    /** Additive guard for every denominator that could be zero. */
    public static final double EPSILON = 1e-8;

    /** Gaussian kernels extend to this many standard deviations. */
    private static final double KERNEL_TRUNCATE = 4.0;

    private SeriesMath() {}

    // ── Moments ─────────────────────────────────────────────────────────────

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population standard deviation (divides by N). */
    public static double std(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        double variance = 0.0;
        for (double v : values) {
            double diff = v - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / values.length);
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) max = Math.max(max, v);
        return max;
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) min = Math.min(min, v);
        return min;
    }

    // ── Element-wise transforms ─────────────────────────────────────────────

    /** (x - mean) / (std + EPSILON). */
    public static double[] zScore(double[] values) {
        double mean = mean(values);
        double scale = std(values) + EPSILON;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = (values[i] - mean) / scale;
        return out;
    }

    public static double[] abs(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = Math.abs(values[i]);
        return out;
    }

    public static double[] cumulativeSum(double[] values) {
        double[] out = new double[values.length];
        double running = 0.0;
        for (int i = 0; i < values.length; i++) {
            running += values[i];
            out[i] = running;
        }
        return out;
    }

    /** Successive differences; length N-1. */
    public static double[] diff(double[] values) {
        if (values.length < 2) return new double[0];
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) out[i - 1] = values[i] - values[i - 1];
        return out;
    }

    /**
     * Discrete derivative with unit spacing: central differences for interior
     * points, one-sided differences at both ends. Length N; needs N ≥ 2.
     */
    public static double[] gradient(double[] values) {
        int n = values.length;
        if (n < 2) return new double[n];
        double[] out = new double[n];
        out[0] = values[1] - values[0];
        out[n - 1] = values[n - 1] - values[n - 2];
        for (int i = 1; i < n - 1; i++) {
            out[i] = (values[i + 1] - values[i - 1]) / 2.0;
        }
        return out;
    }

    // ── Windows ─────────────────────────────────────────────────────────────

    /** The last {@code count} values (all of them when fewer exist). */
    public static double[] tail(double[] values, int count) {
        int from = Math.max(0, values.length - count);
        double[] out = new double[values.length - from];
        System.arraycopy(values, from, out, 0, out.length);
        return out;
    }

    /** Mean successive difference over the last {@code window} values; 0 when fewer than two. */
    public static double trend(double[] values, int window) {
        double[] recent = diff(tail(values, window));
        return recent.length == 0 ? 0.0 : mean(recent);
    }

    // ── Smoothing ───────────────────────────────────────────────────────────

    /**
     * One-dimensional Gaussian filter. The kernel radius is
     * {@code (int) (4σ + 0.5)} and the signal is extended by half-sample
     * symmetric reflection ({@code d c b a | a b c d | d c b a}), so a constant
     * or linear signal passes through unchanged away from curvature.
     */
    public static double[] gaussianFilter(double[] values, double sigma) {
        int n = values.length;
        if (n == 0 || sigma <= 0.0) return values.clone();

        int radius = (int) (KERNEL_TRUNCATE * sigma + 0.5);
        double[] kernel = new double[2 * radius + 1];
        double norm = 0.0;
        for (int k = -radius; k <= radius; k++) {
            double w = Math.exp(-0.5 * k * k / (sigma * sigma));
            kernel[k + radius] = w;
            norm += w;
        }
        for (int k = 0; k < kernel.length; k++) kernel[k] /= norm;

        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double acc = 0.0;
            for (int k = -radius; k <= radius; k++) {
                acc += kernel[k + radius] * values[reflect(i + k, n)];
            }
            out[i] = acc;
        }
        return out;
    }

    static int reflect(int index, int n) {
        if (n == 1) return 0;
        int period = 2 * n;
        int m = index % period;
        if (m < 0) m += period;
        return m < n ? m : period - m - 1;
    }
}
