package com.manifoldplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Projected price envelope, attractor targets and directional bias for one horizon.
 * Prices and percentages are rounded to two decimals.
 */
public record PriceProjection(
    @JsonProperty("current_price") double currentPrice,
    @JsonProperty("projected_range") Range projectedRange,
    @JsonProperty("targets") List<Target> targets,
    @JsonProperty("directional_bias") Bias directionalBias,
    @JsonProperty("horizon") HorizonScale horizon
) {
    public record Range(
        @JsonProperty("low") double low,
        @JsonProperty("high") double high,
        @JsonProperty("range_pct") double rangePct
    ) {}

    public record Target(
        @JsonProperty("price") double price,
        @JsonProperty("strength") double strength,
        @JsonProperty("distance_pct") double distancePct,
        @JsonProperty("direction") String direction
    ) {}

    /**
     * @param direction  bullish / bearish / neutral
     * @param confidence 0–100
     */
    public record Bias(
        @JsonProperty("direction") String direction,
        @JsonProperty("confidence") int confidence
    ) {}
}
