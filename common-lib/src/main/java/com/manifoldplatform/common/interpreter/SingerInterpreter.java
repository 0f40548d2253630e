package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.SingerReading;

/**
 * Pure interpreter - micro reading of whether the latest note holds.
 *
 * <pre>
 * TENSION_CRACKLING - |tension| &gt; 1.5 or |curvature| &gt; 2.0
 * DISSONANT_STRAIN  - |tension| &gt; 1.0 and entropy &gt; 6.0
 * HARMONIOUS_FLOW   - |curvature| &lt; 0.5, |tension| &lt; 0.7, entropy &lt; 5.0
 * RESONANT_STABLE   - |tension| &lt; 0.5 and entropy &lt; 4.0
 * HARMONIOUS_FLOW   - everything else
 * </pre>
 *
 * <p>RESONANT_STABLE is only reachable with curvature of at least 0.5, since
 * calmer curvature already matches the harmonious row above it.
 */
public final class SingerInterpreter {

    private static final double CRACKING_TENSION   = 1.5;
    private static final double CRACKING_CURVATURE = 2.0;
    private static final double STRAIN_TENSION     = 1.0;
    private static final double STRAIN_ENTROPY     = 6.0;
    private static final double FLOW_CURVATURE     = 0.5;
    private static final double FLOW_TENSION       = 0.7;
    private static final double FLOW_ENTROPY       = 5.0;
    private static final double RESONANT_TENSION   = 0.5;
    private static final double RESONANT_ENTROPY   = 4.0;

    private SingerInterpreter() {}

    public static SingerReading interpret(double curvature, double tension, double entropy) {
        double absCurvature = Math.abs(curvature);
        double absTension = Math.abs(tension);

        if (absTension > CRACKING_TENSION || absCurvature > CRACKING_CURVATURE) {
            return SingerReading.TENSION_CRACKLING;
        }
        if (absTension > STRAIN_TENSION && entropy > STRAIN_ENTROPY) {
            return SingerReading.DISSONANT_STRAIN;
        }
        if (absCurvature < FLOW_CURVATURE && absTension < FLOW_TENSION && entropy < FLOW_ENTROPY) {
            return SingerReading.HARMONIOUS_FLOW;
        }
        if (absTension < RESONANT_TENSION && entropy < RESONANT_ENTROPY) {
            return SingerReading.RESONANT_STABLE;
        }
        return SingerReading.HARMONIOUS_FLOW;
    }
}
