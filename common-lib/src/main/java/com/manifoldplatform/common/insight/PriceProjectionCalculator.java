package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.Attractor;
import com.manifoldplatform.common.model.ManifoldMetrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure logic class - projects a price envelope from the latest local entropy
 * and tension, with attractors as targets.
 *
 * <pre>
 * range%   = |entropy / 10| × horizon multiplier × (1 + 0.2·|tension|) × 100
 * bias     = bullish when tension &gt; 0.5, bearish when tension &lt; −0.5, else neutral
 * targets  = up to five attractors, strongest first
 * </pre>
 */
public final class PriceProjectionCalculator {

    private static final int MAX_TARGETS = 5;
    private static final double ENTROPY_SCALE = 10.0;
    private static final double TENSION_RANGE_FACTOR = 0.2;
    private static final double BIAS_TENSION = 0.5;

    private PriceProjectionCalculator() {}

    public static PriceProjection project(ManifoldMetrics metrics, double currentPrice, HorizonScale horizon) {
        double tension = metrics.latestTension();
        double volatility = Math.abs(metrics.latestLocalEntropy()) / ENTROPY_SCALE;
        double tensionFactor = 1.0 + Math.abs(tension) * TENSION_RANGE_FACTOR;
        double rangePct = volatility * horizon.rangeMultiplier() * tensionFactor * 100.0;

        PriceProjection.Range range = new PriceProjection.Range(
            round2(currentPrice * (1.0 - rangePct / 100.0)),
            round2(currentPrice * (1.0 + rangePct / 100.0)),
            round2(rangePct));

        return new PriceProjection(round2(currentPrice), range,
            targets(metrics.attractors(), currentPrice), bias(tension), horizon);
    }

    static List<PriceProjection.Target> targets(List<Attractor> attractors, double currentPrice) {
        List<Attractor> byStrength = new ArrayList<>(attractors);
        byStrength.sort(Comparator.comparingDouble(Attractor::strength).reversed());

        List<PriceProjection.Target> targets = new ArrayList<>();
        for (Attractor a : byStrength.subList(0, Math.min(MAX_TARGETS, byStrength.size()))) {
            double distancePct = currentPrice != 0.0 ? (a.price() - currentPrice) / currentPrice * 100.0 : 0.0;
            targets.add(new PriceProjection.Target(
                round2(a.price()), round2(a.strength()), round2(distancePct),
                a.price() > currentPrice ? "above" : "below"));
        }
        return targets;
    }

    static PriceProjection.Bias bias(double tension) {
        if (tension > BIAS_TENSION) {
            return new PriceProjection.Bias("bullish", Math.min(100, (int) (tension * 50)));
        }
        if (tension < -BIAS_TENSION) {
            return new PriceProjection.Bias("bearish", Math.min(100, (int) (Math.abs(tension) * 50)));
        }
        return new PriceProjection.Bias("neutral", (int) (50 - Math.abs(tension) * 30));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
