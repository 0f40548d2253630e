package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NearestAttractor(
    @JsonProperty("price") double price,
    @JsonProperty("description") String description
) {}
