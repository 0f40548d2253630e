package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.ManifoldPhase;

/**
 * Banded phrase lookups for the latest curvature, tension and entropy, plus
 * the wave position implied by a phase. Every lookup is total: non-finite
 * input returns {@link #TRANSITIONAL}.
 */
public final class ManifoldDescriptions {

    public static final String TRANSITIONAL = "transitional";

    /** Trailing samples used for the curvature direction. */
    public static final int CURVATURE_TREND_WINDOW = 10;

    private ManifoldDescriptions() {}

    /**
     * @param curvature      latest curvature
     * @param curvatureTrend mean successive difference of the last
     *                       {@value #CURVATURE_TREND_WINDOW} curvature samples
     */
    public static String describeCurvature(double curvature, double curvatureTrend) {
        if (!Double.isFinite(curvature)) return TRANSITIONAL;
        double abs = Math.abs(curvature);

        if (abs > 1.5) return "tight - singularity imminent";
        if (abs > 0.8) {
            return curvatureTrend > 0
                ? "sharpening - psychological heat accumulating"
                : "loosening - tension releasing";
        }
        if (abs > 0.3) return "moderate - normal flow";
        return "gentle - calm surface";
    }

    public static String describeTension(double tension) {
        if (!Double.isFinite(tension)) return TRANSITIONAL;
        double abs = Math.abs(tension);

        if (abs > 2.0) return "extreme - structure cannot hold";
        if (abs > 1.5) return "critical - collapse imminent";
        if (abs > 1.0) return "high - pressure building";
        if (abs > 0.5) return "accumulating - directional pressure";
        return "minimal - relaxed state";
    }

    public static String describeEntropy(double entropy) {
        if (!Double.isFinite(entropy)) return TRANSITIONAL;

        if (entropy > 7.0) return "chaotic - panic/euphoria";
        if (entropy > 6.0) return "frothy - unstable belief";
        if (entropy > 4.0) return "elevated - active movement";
        if (entropy > 2.0) return "calm - stable belief";
        return "crystalline - locked structure";
    }

    /** Elliott-wave reading of a phase; phases without a wave analogue are transitional. */
    public static String wavePosition(ManifoldPhase phase) {
        if (phase == null) return "Transitional - between wave structures";
        return switch (phase) {
            case IMPULSE_LEG_SHARPENING -> "Impulse wave (1, 3, or 5) - curvature sharpening";
            case RICCI_FLOW_SMOOTHING   -> "Corrective wave (2, 4, or A-B-C) - Ricci flow smoothing";
            case SINGULARITY_FORMING    -> "Wave peak - singularity forming";
            case STABLE_EQUILIBRIUM     -> "Wave 4 consolidation or end of correction";
            default                     -> "Transitional - between wave structures";
        };
    }
}
