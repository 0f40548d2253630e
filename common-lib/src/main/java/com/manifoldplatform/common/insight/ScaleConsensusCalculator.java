package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldPhase;
import com.manifoldplatform.common.model.TimeScale;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pure logic class - majority phase across timescales.
 * Ties resolve to the phase seen first in the map's iteration order.
 */
public final class ScaleConsensusCalculator {

    private ScaleConsensusCalculator() {}

    public static ScaleConsensus evaluate(Map<TimeScale, ManifoldInterpretation> interpretations) {
        Map<ManifoldPhase, Integer> counts = new LinkedHashMap<>();
        for (ManifoldInterpretation interpretation : interpretations.values()) {
            counts.merge(interpretation.phase(), 1, Integer::sum);
        }
        if (counts.isEmpty()) {
            return new ScaleConsensus(null, 0, counts);
        }

        ManifoldPhase dominant = null;
        int best = 0;
        for (Map.Entry<ManifoldPhase, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                dominant = entry.getKey();
                best = entry.getValue();
            }
        }
        int consistency = (int) (best * 100.0 / interpretations.size());
        return new ScaleConsensus(dominant, consistency, counts);
    }
}
