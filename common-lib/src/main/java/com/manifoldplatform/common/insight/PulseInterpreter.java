package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.Attractor;
import com.manifoldplatform.common.model.ManifoldMetrics;

/**
 * Pure logic class - condenses a snapshot into a {@link PulseReading}.
 *
 * <pre>
 * |tension| &gt; 1.5 → HIGH_TENSION when entropy &gt; 5, else COMPRESSED
 * entropy &gt; 5      → CHAOTIC
 * |tension| &lt; 0.5 and entropy &lt; 3 → STABLE
 * otherwise         → TRANSITIONAL
 * </pre>
 *
 * Entropy is the latest local entropy. A singularity is recent when its index
 * lies in the last fifth of the series.
 */
public final class PulseInterpreter {

    private static final double HIGH_ENTROPY   = 5.0;
    private static final double MEDIUM_ENTROPY = 3.0;
    private static final double HIGH_TENSION   = 1.5;
    private static final double MEDIUM_TENSION = 0.5;
    private static final double RECENT_FRACTION = 0.8;

    private PulseInterpreter() {}

    public static PulseReading read(ManifoldMetrics metrics) {
        double price = metrics.latestPrice();
        double entropy = metrics.latestLocalEntropy();
        double tension = metrics.latestTension();

        Double nearest = null;
        double distance = 0.0;
        double distancePct = 0.0;
        for (Attractor a : metrics.attractors()) {
            if (nearest == null || Math.abs(a.price() - price) < Math.abs(nearest - price)) {
                nearest = a.price();
            }
        }
        if (nearest != null) {
            distance = nearest - price;
            distancePct = price != 0.0 ? distance / price * 100.0 : 0.0;
        }

        return new PulseReading(price, entropy, entropyLevel(entropy), tension, tensionLevel(tension),
            nearest, distance, distancePct, recentSingularities(metrics), state(entropy, tension));
    }

    static int recentSingularities(ManifoldMetrics metrics) {
        double cutoff = metrics.size() * RECENT_FRACTION;
        int recent = 0;
        for (int index : metrics.singularities()) {
            if (index >= cutoff) recent++;
        }
        return recent;
    }

    static PulseState state(double entropy, double tension) {
        double magnitude = Math.abs(tension);
        if (magnitude > HIGH_TENSION) {
            return entropy > HIGH_ENTROPY ? PulseState.HIGH_TENSION : PulseState.COMPRESSED;
        }
        if (entropy > HIGH_ENTROPY) return PulseState.CHAOTIC;
        if (magnitude < MEDIUM_TENSION && entropy < MEDIUM_ENTROPY) return PulseState.STABLE;
        return PulseState.TRANSITIONAL;
    }

    static String entropyLevel(double entropy) {
        if (entropy > HIGH_ENTROPY) return "high";
        if (entropy > MEDIUM_ENTROPY) return "medium";
        return "low";
    }

    static String tensionLevel(double tension) {
        double magnitude = Math.abs(tension);
        if (magnitude > HIGH_TENSION) return "high";
        if (magnitude > MEDIUM_TENSION) return "medium";
        return "low";
    }
}
