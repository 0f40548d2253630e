package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Price level with high visitation density. Strength is normalised to the
 * strongest attractor of the same snapshot, so it lies in [0, 1].
 */
public record Attractor(
    @JsonProperty("price") double price,
    @JsonProperty("strength") double strength
) {
    public static Attractor of(double price, double strength) {
        return new Attractor(price, strength);
    }
}
