package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.ManifoldPhase;

import java.util.List;

/**
 * Ordered phase precedence table. Rows are evaluated top to bottom and the
 * first matching guard wins; {@link ManifoldPhase#ATTRACTOR_CONVERGENCE} is the
 * fall-through row.
 *
 * <pre>
 * 1  c &gt; singularityCurvature ∧ t &gt; highTension                         SINGULARITY_FORMING
 * 2  flow &gt; flowSmoothing ∧ t &gt; flowTension                               RICCI_FLOW_SMOOTHING
 * 3  c &gt; impulseCurvature ∧ t &gt; impulseTension ∧ flow &lt; impulseFlowCeiling IMPULSE_LEG_SHARPENING
 * 4  t &gt; compressionTension ∧ c &lt; compressionCurvatureCeiling               COMPRESSION_BUILDING
 * 5  c &lt; stableCurvature ∧ t &lt; stableTension ∧ entropy &lt; stableEntropy     STABLE_EQUILIBRIUM
 * 6  otherwise                                                              ATTRACTOR_CONVERGENCE
 * </pre>
 */
public final class PhaseRuleTable {

    public static final ManifoldPhase DEFAULT_PHASE = ManifoldPhase.ATTRACTOR_CONVERGENCE;

    private final List<PhaseRule> rules;

    public PhaseRuleTable(InterpreterThresholds th) {
        this.rules = List.of(
            new PhaseRule(ManifoldPhase.SINGULARITY_FORMING,
                "curvature > " + th.singularityCurvature() + " AND tension > " + th.highTension(),
                s -> s.curvature() > th.singularityCurvature() && s.tension() > th.highTension()),
            new PhaseRule(ManifoldPhase.RICCI_FLOW_SMOOTHING,
                "flow > " + th.flowSmoothing() + " AND tension > " + th.flowTension(),
                s -> s.flow() > th.flowSmoothing() && s.tension() > th.flowTension()),
            new PhaseRule(ManifoldPhase.IMPULSE_LEG_SHARPENING,
                "curvature > " + th.impulseCurvature() + " AND tension > " + th.impulseTension()
                    + " AND flow < " + th.impulseFlowCeiling(),
                s -> s.curvature() > th.impulseCurvature() && s.tension() > th.impulseTension()
                    && s.flow() < th.impulseFlowCeiling()),
            new PhaseRule(ManifoldPhase.COMPRESSION_BUILDING,
                "tension > " + th.compressionTension() + " AND curvature < " + th.compressionCurvatureCeiling(),
                s -> s.tension() > th.compressionTension() && s.curvature() < th.compressionCurvatureCeiling()),
            new PhaseRule(ManifoldPhase.STABLE_EQUILIBRIUM,
                "curvature < " + th.stableCurvature() + " AND tension < " + th.stableTension()
                    + " AND entropy < " + th.stableEntropy(),
                s -> s.curvature() < th.stableCurvature() && s.tension() < th.stableTension()
                    && s.entropy() < th.stableEntropy())
        );
    }

    public static PhaseRuleTable defaults() {
        return new PhaseRuleTable(InterpreterThresholds.defaults());
    }

    public List<PhaseRule> rules() {
        return rules;
    }

    public ManifoldPhase diagnose(PhaseSignals signals) {
        for (PhaseRule rule : rules) {
            if (rule.matches(signals)) {
                return rule.phase();
            }
        }
        return DEFAULT_PHASE;
    }
}
