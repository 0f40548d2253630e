package com.manifoldplatform.analysis.service;

import com.manifoldplatform.analysis.model.ManifoldReport;
import com.manifoldplatform.analysis.model.MultiScaleReport;
import com.manifoldplatform.common.engine.ManifoldEngine;
import com.manifoldplatform.common.insight.BriefingComposer;
import com.manifoldplatform.common.insight.HorizonScale;
import com.manifoldplatform.common.insight.ModelQualityCalculator;
import com.manifoldplatform.common.insight.PriceProjection;
import com.manifoldplatform.common.insight.PriceProjectionCalculator;
import com.manifoldplatform.common.insight.PulseInterpreter;
import com.manifoldplatform.common.insight.PulseReading;
import com.manifoldplatform.common.insight.ScaleConsensus;
import com.manifoldplatform.common.insight.ScaleConsensusCalculator;
import com.manifoldplatform.common.interpreter.ManifoldInterpreter;
import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.model.PriceSeries;
import com.manifoldplatform.common.model.TimeScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Entry point for callers: composes engine, interpreter and the insight
 * calculators. Engine failures surface as {@code Mono.error}.
 */
@Service
public class ManifoldAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(ManifoldAnalysisService.class);

    private final ManifoldEngine engine;
    private final ManifoldInterpreter interpreter;
    private final MultiScaleAnalyzer multiScaleAnalyzer;

    public ManifoldAnalysisService(ManifoldEngine engine,
                                   ManifoldInterpreter interpreter,
                                   MultiScaleAnalyzer multiScaleAnalyzer) {
        this.engine = engine;
        this.interpreter = interpreter;
        this.multiScaleAnalyzer = multiScaleAnalyzer;
    }

    public Mono<ManifoldReport> analyze(PriceSeries series, TimeScale timescale) {
        log.info("Analysing {} samples at timescale={}", series.size(), timescale);
        return Mono.fromCallable(() -> report(engine.analyze(series, timescale)))
            .doOnSuccess(report -> log.info("Analysis complete. phase={} confidence={} quality={}",
                report.interpretation().phase(), report.interpretation().phaseConfidence(),
                report.quality().grade()))
            .doOnError(e -> log.error("Analysis failed at timescale={}: {}", timescale, e.getMessage()));
    }

    public Mono<MultiScaleReport> analyzeMultiscale(PriceSeries series, Collection<TimeScale> scales) {
        return multiScaleAnalyzer.analyzeMultiscale(series, scales)
            .map(this::multiScaleReport)
            .doOnSuccess(report -> log.info("Multi-scale analysis complete. scales={} dominant={} consistency={}",
                report.reports().keySet(), report.consensus().dominantPhase(), report.consensus().consistency()));
    }

    public Mono<PulseReading> pulse(PriceSeries series) {
        return Mono.fromCallable(() -> PulseInterpreter.read(engine.analyze(series, TimeScale.DAILY)))
            .doOnSuccess(pulse -> log.info("Pulse state={} tension={} entropy={}",
                pulse.state(), pulse.tension(), pulse.entropy()));
    }

    /**
     * Projects from a snapshot at the horizon's timescale; the current price is
     * the last price of the undecimated series.
     */
    public Mono<PriceProjection> project(PriceSeries series, HorizonScale horizon) {
        TimeScale scale = horizon.timescale();
        return Mono.fromCallable(() -> {
                ManifoldMetrics metrics = engine.analyze(multiScaleAnalyzer.resample(series, scale), scale);
                return PriceProjectionCalculator.project(metrics, series.lastPrice(), horizon);
            })
            .doOnSuccess(projection -> log.info("Projection horizon={} range=[{}, {}] bias={}",
                horizon.value(), projection.projectedRange().low(), projection.projectedRange().high(),
                projection.directionalBias().direction()));
    }

    ManifoldReport report(ManifoldMetrics metrics) {
        ManifoldInterpretation interpretation = interpreter.interpret(metrics);
        return new ManifoldReport(metrics, interpretation,
            ModelQualityCalculator.evaluate(metrics), BriefingComposer.compose(interpretation));
    }

    private MultiScaleReport multiScaleReport(Map<TimeScale, ManifoldMetrics> metricsByScale) {
        Map<TimeScale, ManifoldReport> reports = new EnumMap<>(TimeScale.class);
        Map<TimeScale, ManifoldInterpretation> interpretations = new EnumMap<>(TimeScale.class);
        metricsByScale.forEach((scale, metrics) -> {
            ManifoldReport report = report(metrics);
            reports.put(scale, report);
            interpretations.put(scale, report.interpretation());
        });
        ScaleConsensus consensus = ScaleConsensusCalculator.evaluate(interpretations);
        return new MultiScaleReport(reports, consensus);
    }
}
