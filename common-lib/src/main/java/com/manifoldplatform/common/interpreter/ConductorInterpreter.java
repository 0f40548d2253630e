package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.ConductorReading;

/**
 * Pure interpreter - macro reading of where the composition is heading,
 * from the trailing tension/curvature trend and the latest tension and entropy.
 *
 * <pre>
 * CRESCENDO         - tension trend &gt; 0 and curvature trend &gt; 0
 * DECRESCENDO       - tension trend &lt; 0 while |tension| &gt; 1.0
 * SUSTAINED_TENSION - |tension| &gt; 1.0 with a flat tension trend (|trend| &lt; 0.1)
 * REST_PHASE        - |tension| &lt; 0.5 and entropy &lt; 4.0
 * TRANSITIONAL      - everything else
 * </pre>
 */
public final class ConductorInterpreter {

    /** Number of trailing samples the trends are measured over. */
    public static final int TREND_WINDOW = 20;

    private static final double INTENSE_TENSION   = 1.0;
    private static final double FLAT_TREND        = 0.1;
    private static final double REST_TENSION      = 0.5;
    private static final double REST_ENTROPY      = 4.0;

    private ConductorInterpreter() {}

    /**
     * @param tensionTrend   mean successive difference of recent tension
     * @param curvatureTrend mean successive difference of recent curvature
     * @param tension        latest tension (sign ignored)
     * @param entropy        latest local entropy
     */
    public static ConductorReading interpret(double tensionTrend, double curvatureTrend,
                                             double tension, double entropy) {
        double absTension = Math.abs(tension);

        if (tensionTrend > 0 && curvatureTrend > 0)                        return ConductorReading.CRESCENDO;
        if (tensionTrend < 0 && absTension > INTENSE_TENSION)              return ConductorReading.DECRESCENDO;
        if (absTension > INTENSE_TENSION && Math.abs(tensionTrend) < FLAT_TREND) {
            return ConductorReading.SUSTAINED_TENSION;
        }
        if (absTension < REST_TENSION && entropy < REST_ENTROPY)           return ConductorReading.REST_PHASE;

        return ConductorReading.TRANSITIONAL;
    }
}
