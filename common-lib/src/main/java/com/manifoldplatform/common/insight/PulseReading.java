package com.manifoldplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lightweight snapshot of the latest manifold readings.
 * {@code nearestAttractorPrice} is null when the snapshot has no attractors.
 */
public record PulseReading(
    @JsonProperty("current_price") double currentPrice,
    @JsonProperty("entropy") double entropy,
    @JsonProperty("entropy_level") String entropyLevel,
    @JsonProperty("tension") double tension,
    @JsonProperty("tension_level") String tensionLevel,
    @JsonProperty("nearest_attractor") Double nearestAttractorPrice,
    @JsonProperty("attractor_distance") double attractorDistance,
    @JsonProperty("attractor_distance_pct") double attractorDistancePct,
    @JsonProperty("recent_singularities") int recentSingularities,
    @JsonProperty("state") PulseState state
) {}
