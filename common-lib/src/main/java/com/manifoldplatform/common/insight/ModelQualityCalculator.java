package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.Attractor;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.numeric.SeriesMath;

import java.util.List;

/**
 * Pure logic class - grades a {@link ManifoldMetrics} snapshot.
 *
 * <ul>
 *   <li><b>Consistency</b> (40%) - low recent curvature/tension dispersion</li>
 *   <li><b>Signal clarity</b> (30%) - separation of the three strongest attractors</li>
 *   <li><b>Sample sufficiency</b> (30%) - one point per two samples, capped at 100</li>
 * </ul>
 */
public final class ModelQualityCalculator {

    private static final int RECENT_WINDOW = 20;
    private static final int CLARITY_ATTRACTORS = 3;
    private static final int DEFAULT_CLARITY = 50;

    private static final double CONSISTENCY_WEIGHT = 0.4;
    private static final double CLARITY_WEIGHT     = 0.3;
    private static final double SAMPLE_WEIGHT      = 0.3;

    private ModelQualityCalculator() {}

    public static ModelQuality evaluate(ManifoldMetrics metrics) {
        double curvatureStd = SeriesMath.std(SeriesMath.tail(metrics.curvature(), RECENT_WINDOW));
        double tensionStd = SeriesMath.std(SeriesMath.tail(metrics.tension(), RECENT_WINDOW));
        int consistency = clamp((int) (100 * (1.0 / (1.0 + curvatureStd + tensionStd))));

        int clarity = signalClarity(metrics.attractors(), SeriesMath.mean(metrics.prices()));
        int sample = Math.min(100, metrics.size() / 2);

        int overall = (int) (consistency * CONSISTENCY_WEIGHT + clarity * CLARITY_WEIGHT + sample * SAMPLE_WEIGHT);
        return new ModelQuality(overall, consistency, clarity, sample, grade(overall));
    }

    static int signalClarity(List<Attractor> attractors, double meanPrice) {
        if (attractors.size() < 2) return DEFAULT_CLARITY;

        List<Attractor> strongest = attractors.subList(0, Math.min(CLARITY_ATTRACTORS, attractors.size()));
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (Attractor a : strongest) {
            high = Math.max(high, a.price());
            low = Math.min(low, a.price());
        }
        double separation = meanPrice > 0 ? (high - low) / meanPrice : 0.0;
        return Math.min(100, (int) (separation * 1000));
    }

    static String grade(int overall) {
        if (overall >= 80) return "A";
        if (overall >= 60) return "B";
        if (overall >= 40) return "C";
        return "D";
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
