package com.manifoldplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.manifoldplatform.common.insight.ScaleConsensus;
import com.manifoldplatform.common.model.TimeScale;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reports keyed by timescale, ordered coarse to fine. Scales that could not be
 * analysed are absent.
 */
public record MultiScaleReport(
    @JsonProperty("reports") Map<TimeScale, ManifoldReport> reports,
    @JsonProperty("consensus") ScaleConsensus consensus
) {
    public MultiScaleReport {
        reports = reports.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(reports));
    }

    public ManifoldReport report(TimeScale scale) {
        return reports.get(scale);
    }
}
