package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.exception.InvalidConfigurationException;

/**
 * Tunable breakpoints of the phase cascade and the warning channel.
 *
 * <p>All curvature, tension and flow thresholds are compared against absolute
 * values of the latest sample; entropy is compared as-is.
 */
public record InterpreterThresholds(
    double singularityCurvature,
    double highTension,
    double flowSmoothing,
    double flowTension,
    double impulseCurvature,
    double impulseTension,
    double impulseFlowCeiling,
    double compressionTension,
    double compressionCurvatureCeiling,
    double stableCurvature,
    double stableTension,
    double stableEntropy,
    int singularityCountWarning
) {
    public InterpreterThresholds {
        requireNonNegative("singularity-curvature", singularityCurvature);
        requireNonNegative("high-tension", highTension);
        requireNonNegative("flow-smoothing", flowSmoothing);
        requireNonNegative("flow-tension", flowTension);
        requireNonNegative("impulse-curvature", impulseCurvature);
        requireNonNegative("impulse-tension", impulseTension);
        requireNonNegative("impulse-flow-ceiling", impulseFlowCeiling);
        requireNonNegative("compression-tension", compressionTension);
        requireNonNegative("compression-curvature-ceiling", compressionCurvatureCeiling);
        requireNonNegative("stable-curvature", stableCurvature);
        requireNonNegative("stable-tension", stableTension);
        if (!Double.isFinite(stableEntropy)) {
            throw new InvalidConfigurationException("manifold.interpreter.stable-entropy", "must be finite");
        }
        if (singularityCountWarning < 0) {
            throw new InvalidConfigurationException("manifold.interpreter.singularity-count-warning",
                "must be >= 0 but was " + singularityCountWarning);
        }
    }

    public static InterpreterThresholds defaults() {
        return new InterpreterThresholds(
            2.0,  // singularity curvature
            1.5,  // high tension
            0.5,  // flow smoothing
            0.5,  // flow tension
            0.5,  // impulse curvature
            0.7,  // impulse tension
            0.3,  // impulse flow ceiling
            1.0,  // compression tension
            0.5,  // compression curvature ceiling
            0.3,  // stable curvature
            0.5,  // stable tension
            4.0,  // stable entropy
            2     // singularity count above which structure is flagged
        );
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new InvalidConfigurationException("manifold.interpreter." + name,
                "must be a finite value >= 0 but was " + value);
        }
    }
}
