package com.manifoldplatform.analysis.service;

import com.manifoldplatform.common.engine.ManifoldEngine;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.model.PriceSeries;
import com.manifoldplatform.common.model.TimeScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Runs the engine once per timescale in parallel and joins the snapshots.
 *
 * <p>Coarser scales are approximated by fixed-stride decimation of the input
 * (monthly keeps every 20th sample, weekly every 5th). A scale that fails,
 * typically because too few samples survive decimation, is logged and left
 * out of the result.
 */
@Service
public class MultiScaleAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(MultiScaleAnalyzer.class);

    private final ManifoldEngine engine;

    public MultiScaleAnalyzer(ManifoldEngine engine) {
        this.engine = engine;
    }

    public Mono<Map<TimeScale, ManifoldMetrics>> analyzeMultiscale(PriceSeries series) {
        return analyzeMultiscale(series, null);
    }

    /**
     * @param scales nullable or empty for all four timescales
     */
    public Mono<Map<TimeScale, ManifoldMetrics>> analyzeMultiscale(PriceSeries series, Collection<TimeScale> scales) {
        EnumSet<TimeScale> requested = scales == null || scales.isEmpty()
            ? EnumSet.allOf(TimeScale.class)
            : EnumSet.copyOf(scales);
        log.info("Analysing {} samples across {} timescales {}", series.size(), requested.size(), requested);

        return Flux.fromIterable(requested)
            .flatMap(scale -> Mono.fromCallable(() -> Map.entry(scale, engine.analyze(resample(series, scale), scale)))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(entry -> log.info("Timescale={} complete. samples={} singularities={} attractors={}",
                    scale, entry.getValue().size(), entry.getValue().singularities().size(),
                    entry.getValue().attractors().size()))
                .onErrorResume(e -> {
                    log.warn("Timescale={} skipped: {}", scale, e.getMessage());
                    return Mono.empty();
                }))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue,
                () -> new EnumMap<TimeScale, ManifoldMetrics>(TimeScale.class));
    }

    public PriceSeries resample(PriceSeries series, TimeScale scale) {
        return series.decimate(scale.stride());
    }
}
