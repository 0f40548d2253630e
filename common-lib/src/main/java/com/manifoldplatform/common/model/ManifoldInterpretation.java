package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Categorical diagnosis of one {@link ManifoldMetrics} snapshot.
 *
 * <p>{@code wavePosition}, {@code nearestAttractor} and {@code tensionWarning}
 * are nullable and serialise as explicit {@code null}. The trailing three
 * values are the instantaneous readings the diagnosis was made from.
 */
public record ManifoldInterpretation(
    @JsonProperty("phase") ManifoldPhase phase,
    @JsonProperty("phase_confidence") double phaseConfidence,
    @JsonProperty("conductor_reading") ConductorReading conductorReading,
    @JsonProperty("singer_reading") SingerReading singerReading,
    @JsonProperty("curvature_state") String curvatureState,
    @JsonProperty("tension_description") String tensionDescription,
    @JsonProperty("entropy_state") String entropyState,
    @JsonProperty("wave_position") String wavePosition,
    @JsonProperty("nearest_attractor") NearestAttractor nearestAttractor,
    @JsonProperty("attractor_pull_strength") double attractorPullStrength,
    @JsonProperty("market_narrative") String marketNarrative,
    @JsonProperty("tension_warning") String tensionWarning,
    @JsonProperty("curvature_value") double curvatureValue,
    @JsonProperty("entropy_value") double entropyValue,
    @JsonProperty("tension_value") double tensionValue
) {
    public boolean hasWarning() {
        return tensionWarning != null;
    }
}
