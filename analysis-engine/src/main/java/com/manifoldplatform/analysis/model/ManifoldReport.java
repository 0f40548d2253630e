package com.manifoldplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.manifoldplatform.common.insight.InterpretationBriefing;
import com.manifoldplatform.common.insight.ModelQuality;
import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldMetrics;

/** One timescale's snapshot together with everything derived from it. */
public record ManifoldReport(
    @JsonProperty("metrics") ManifoldMetrics metrics,
    @JsonProperty("interpretation") ManifoldInterpretation interpretation,
    @JsonProperty("quality") ModelQuality quality,
    @JsonProperty("briefing") InterpretationBriefing briefing
) {}
