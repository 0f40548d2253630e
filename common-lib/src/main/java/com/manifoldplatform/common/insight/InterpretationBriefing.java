package com.manifoldplatform.common.insight;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InterpretationBriefing(
    @JsonProperty("phase_title") String phaseTitle,
    @JsonProperty("phase_detail") String phaseDetail,
    @JsonProperty("conductor_view") String conductorView,
    @JsonProperty("singer_view") String singerView,
    @JsonProperty("wave_context") String waveContext
) {}
