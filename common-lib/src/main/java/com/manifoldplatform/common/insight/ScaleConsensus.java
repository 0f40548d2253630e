package com.manifoldplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.manifoldplatform.common.model.ManifoldPhase;

import java.util.Map;

/**
 * Agreement of phases across timescales. {@code dominantPhase} is null when no
 * scale produced an interpretation.
 */
public record ScaleConsensus(
    @JsonProperty("dominant_phase") ManifoldPhase dominantPhase,
    @JsonProperty("consistency") int consistency,
    @JsonProperty("phase_counts") Map<ManifoldPhase, Integer> phaseCounts
) {
    public ScaleConsensus {
        phaseCounts = Map.copyOf(phaseCounts);
    }
}
