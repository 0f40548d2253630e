package com.manifoldplatform.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.manifoldplatform.common.engine.ManifoldEngine;
import com.manifoldplatform.common.interpreter.InterpreterThresholds;
import com.manifoldplatform.common.interpreter.ManifoldInterpreter;
import com.manifoldplatform.common.json.ManifoldJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ManifoldConfig {

    private static final Logger log = LoggerFactory.getLogger(ManifoldConfig.class);

    @Value("${manifold.engine.sensitivity:1.0}")
    private double sensitivity;

    @Value("${manifold.interpreter.singularity-curvature:2.0}")
    private double singularityCurvature;

    @Value("${manifold.interpreter.high-tension:1.5}")
    private double highTension;

    @Value("${manifold.interpreter.flow-smoothing:0.5}")
    private double flowSmoothing;

    @Value("${manifold.interpreter.flow-tension:0.5}")
    private double flowTension;

    @Value("${manifold.interpreter.impulse-curvature:0.5}")
    private double impulseCurvature;

    @Value("${manifold.interpreter.impulse-tension:0.7}")
    private double impulseTension;

    @Value("${manifold.interpreter.impulse-flow-ceiling:0.3}")
    private double impulseFlowCeiling;

    @Value("${manifold.interpreter.compression-tension:1.0}")
    private double compressionTension;

    @Value("${manifold.interpreter.compression-curvature-ceiling:0.5}")
    private double compressionCurvatureCeiling;

    @Value("${manifold.interpreter.stable-curvature:0.3}")
    private double stableCurvature;

    @Value("${manifold.interpreter.stable-tension:0.5}")
    private double stableTension;

    @Value("${manifold.interpreter.stable-entropy:4.0}")
    private double stableEntropy;

    @Value("${manifold.interpreter.singularity-count-warning:2}")
    private int singularityCountWarning;

    @Bean
    public ManifoldEngine manifoldEngine() {
        log.info("Manifold engine configured with sensitivity={}", sensitivity);
        return new ManifoldEngine(sensitivity);
    }

    @Bean
    public InterpreterThresholds interpreterThresholds() {
        return new InterpreterThresholds(
            singularityCurvature, highTension, flowSmoothing, flowTension,
            impulseCurvature, impulseTension, impulseFlowCeiling,
            compressionTension, compressionCurvatureCeiling,
            stableCurvature, stableTension, stableEntropy, singularityCountWarning);
    }

    @Bean
    public ManifoldInterpreter manifoldInterpreter(InterpreterThresholds thresholds) {
        log.info("Manifold interpreter configured with {}", thresholds);
        return new ManifoldInterpreter(thresholds);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ManifoldJson.mapper().copy();
    }
}
