package com.manifoldplatform.common.interpreter;

/**
 * Latest-sample inputs of the phase cascade. Curvature, tension and flow are
 * magnitudes; entropy keeps its sign.
 */
public record PhaseSignals(
    double curvature,
    double tension,
    double entropy,
    double flow
) {
    public static PhaseSignals of(double curvature, double tension, double entropy, double flow) {
        return new PhaseSignals(Math.abs(curvature), Math.abs(tension), entropy, Math.abs(flow));
    }
}
