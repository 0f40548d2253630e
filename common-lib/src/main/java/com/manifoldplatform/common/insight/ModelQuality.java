package com.manifoldplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scores in [0, 100] describing how much weight a snapshot can bear.
 */
public record ModelQuality(
    @JsonProperty("overall") int overall,
    @JsonProperty("consistency") int consistency,
    @JsonProperty("signal_clarity") int signalClarity,
    @JsonProperty("sample_sufficiency") int sampleSufficiency,
    @JsonProperty("grade") String grade
) {}
