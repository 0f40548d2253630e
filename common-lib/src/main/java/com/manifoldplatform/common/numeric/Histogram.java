package com.manifoldplatform.common.numeric;

/**
 * Equal-width histogram over the observed range of a sample.
 *
 * <p>Bins are half-open {@code [edge_k, edge_k+1)} except the last, which also
 * holds the maximum. A zero-width range is widened to {@code ±0.5} around the
 * single value so a constant sample still lands in one well-defined bin.
 */
public final class Histogram {

    private final double[] heights;
    private final double[] edges;
    private final int sampleCount;

    private Histogram(double[] heights, double[] edges, int sampleCount) {
        this.heights = heights;
        this.edges = edges;
        this.sampleCount = sampleCount;
    }

    /** Bucket counts. */
    public static Histogram counts(double[] values, int bins) {
        return weighted(values, null, bins);
    }

    /**
     * Bucket heights are the sum of {@code weights} of the values falling in
     * each bucket; {@code null} weights count occurrences.
     */
    public static Histogram weighted(double[] values, double[] weights, int bins) {
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be >= 1 but was " + bins);
        }
        double[] edges = edges(values, bins);
        double[] heights = new double[bins];
        for (int i = 0; i < values.length; i++) {
            int bin = binOf(values[i], edges);
            if (bin >= 0) heights[bin] += weights == null ? 1.0 : weights[i];
        }
        return new Histogram(heights, edges, values.length);
    }

    public double[] heights() {
        return heights.clone();
    }

    public double[] edges() {
        return edges.clone();
    }

    public int bins() {
        return heights.length;
    }

    public double center(int bin) {
        return (edges[bin] + edges[bin + 1]) / 2.0;
    }

    /**
     * Heights scaled so the histogram integrates to one over its range
     * (count / (N · binWidth)). All zeros for an empty sample.
     */
    public double[] density() {
        double[] out = new double[heights.length];
        double total = 0.0;
        for (double h : heights) total += h;
        if (total == 0.0 || sampleCount == 0) return out;
        for (int i = 0; i < heights.length; i++) {
            out[i] = heights[i] / (total * (edges[i + 1] - edges[i]));
        }
        return out;
    }

    /** Shannon entropy in bits of the non-empty density buckets: −Σ h·log2(h + ε). */
    public double shannonEntropy() {
        double entropy = 0.0;
        for (double h : density()) {
            if (h > 0.0) {
                entropy -= h * (Math.log(h + SeriesMath.EPSILON) / Math.log(2.0));
            }
        }
        return entropy;
    }

    private static double[] edges(double[] values, int bins) {
        double first;
        double last;
        if (values.length == 0) {
            first = 0.0;
            last = 1.0;
        } else {
            first = SeriesMath.min(values);
            last = SeriesMath.max(values);
        }
        if (first == last) {
            first -= 0.5;
            last += 0.5;
        }
        double[] edges = new double[bins + 1];
        double width = (last - first) / bins;
        for (int k = 0; k <= bins; k++) edges[k] = first + k * width;
        edges[bins] = last;
        return edges;
    }

    private static int binOf(double value, double[] edges) {
        int bins = edges.length - 1;
        double first = edges[0];
        double last = edges[bins];
        if (value < first || value > last || Double.isNaN(value)) return -1;
        if (value == last) return bins - 1;
        int bin = (int) ((value - first) / (last - first) * bins);
        if (bin >= bins) bin = bins - 1;
        if (value < edges[bin]) bin--;
        else if (bin + 1 < bins && value >= edges[bin + 1]) bin++;
        return bin;
    }
}
