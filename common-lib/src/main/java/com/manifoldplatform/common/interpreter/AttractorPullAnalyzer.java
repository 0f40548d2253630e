package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.Attractor;
import com.manifoldplatform.common.model.NearestAttractor;
import com.manifoldplatform.common.numeric.SeriesMath;

import java.util.List;
import java.util.Locale;

/**
 * Locates the attractor closest to the current price and estimates how
 * strongly it pulls: {@code strength / (1 + distance%)}.
 */
public final class AttractorPullAnalyzer {

    /** Distances below this percentage read as converging on the basin. */
    public static final double CONVERGING_DISTANCE_PCT = 1.0;

    private AttractorPullAnalyzer() {}

    /**
     * @param nearest         null when there are no attractors
     * @param pullStrength    0 when there are no attractors
     * @param distancePercent absolute distance to the nearest attractor in percent of the current price
     */
    public record AttractorPull(
        NearestAttractor nearest,
        double pullStrength,
        double distancePercent
    ) {
        public static AttractorPull none() {
            return new AttractorPull(null, 0.0, Double.NaN);
        }
    }

    public static AttractorPull analyze(double currentPrice, List<Attractor> attractors) {
        if (attractors == null || attractors.isEmpty() || !Double.isFinite(currentPrice)) {
            return AttractorPull.none();
        }

        Attractor nearest = attractors.get(0);
        for (Attractor candidate : attractors) {
            if (Math.abs(candidate.price() - currentPrice) < Math.abs(nearest.price() - currentPrice)) {
                nearest = candidate;
            }
        }

        double distancePct = distancePercent(nearest.price(), currentPrice);
        double pull = nearest.strength() * (1.0 / (1.0 + distancePct));

        String description;
        if (distancePct < CONVERGING_DISTANCE_PCT) {
            description = String.format(Locale.US, "converging on basin at $%,.2f", nearest.price());
        } else if (currentPrice > nearest.price()) {
            description = String.format(Locale.US, "above attractor at $%,.2f (%.1f%% away)", nearest.price(), distancePct);
        } else {
            description = String.format(Locale.US, "below attractor at $%,.2f (%.1f%% away)", nearest.price(), distancePct);
        }

        return new AttractorPull(new NearestAttractor(nearest.price(), description), pull, distancePct);
    }

    /** |attractor − current| as a percentage of the current price; a zero price is guarded. */
    public static double distancePercent(double attractorPrice, double currentPrice) {
        double base = currentPrice != 0.0 ? Math.abs(currentPrice) : SeriesMath.EPSILON;
        return Math.abs(attractorPrice - currentPrice) / base * 100.0;
    }
}
