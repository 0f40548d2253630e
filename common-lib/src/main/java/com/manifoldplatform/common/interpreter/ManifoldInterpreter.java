package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.ConductorReading;
import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldMetrics;
import com.manifoldplatform.common.model.ManifoldPhase;
import com.manifoldplatform.common.model.SingerReading;
import com.manifoldplatform.common.numeric.SeriesMath;

/**
 * Turns one {@link ManifoldMetrics} snapshot into a categorical diagnosis.
 *
 * <h3>Inputs</h3>
 * <p>Only the latest curvature, tension, local entropy and Ricci-flow samples,
 * the singularity count, the latest price with the attractor list, and short
 * trailing windows of curvature and tension (for trends and confidence).
 *
 * <h3>Outputs</h3>
 * <ol>
 *   <li>Phase - first matching row of the {@link PhaseRuleTable}</li>
 *   <li>Conductor and singer readings</li>
 *   <li>Curvature / tension / entropy descriptions and wave position</li>
 *   <li>Nearest attractor and its pull strength</li>
 *   <li>Narrative, confidence and an optional warning</li>
 * </ol>
 *
 * <p>Never throws. Null metrics or empty arrays produce a best-effort reading
 * with the default phase {@link ManifoldPhase#ATTRACTOR_CONVERGENCE}.
 * Stateless after construction; safe to share.
 */
public final class ManifoldInterpreter {

    /** Trailing samples used for the confidence estimate. */
    public static final int CONFIDENCE_WINDOW = 10;

    /** Confidence reported when the trailing windows are not finite. */
    public static final double MIN_CONFIDENCE = 0.01;

    public static final String SINGULARITY_WARNING =
        "SINGULARITY FORMING: The manifold cannot sustain this curvature. "
            + "Expect sharp Ricci flow (correction) as tension redistributes.";
    public static final String HIGH_TENSION_WARNING =
        "HIGH TENSION: The structure is stretched. Watch for singularity formation or sudden release.";
    public static final String INSTABILITY_WARNING =
        "MULTIPLE SINGULARITIES: The manifold has experienced repeated extreme events. "
            + "Structure may be unstable.";

    private final InterpreterThresholds thresholds;
    private final PhaseRuleTable phaseTable;

    public ManifoldInterpreter() {
        this(InterpreterThresholds.defaults());
    }

    public ManifoldInterpreter(InterpreterThresholds thresholds) {
        this.thresholds = thresholds;
        this.phaseTable = new PhaseRuleTable(thresholds);
    }

    public InterpreterThresholds thresholds() {
        return thresholds;
    }

    public PhaseRuleTable phaseTable() {
        return phaseTable;
    }

    public ManifoldInterpretation interpret(ManifoldMetrics metrics) {
        if (metrics == null || metrics.size() == 0) {
            return fallback();
        }

        double curvature = metrics.latestCurvature();
        double tension = metrics.latestTension();
        double entropy = metrics.latestLocalEntropy();
        double flow = metrics.latestRicciFlow();
        double price = metrics.latestPrice();
        int singularityCount = metrics.singularities().size();

        double[] curvatureHistory = metrics.curvature();
        double[] tensionHistory = metrics.tension();

        ManifoldPhase phase = phaseTable.diagnose(PhaseSignals.of(curvature, tension, entropy, flow));

        ConductorReading conductor = ConductorInterpreter.interpret(
            SeriesMath.trend(tensionHistory, ConductorInterpreter.TREND_WINDOW),
            SeriesMath.trend(curvatureHistory, ConductorInterpreter.TREND_WINDOW),
            tension, entropy);
        SingerReading singer = SingerInterpreter.interpret(curvature, tension, entropy);

        String curvatureState = ManifoldDescriptions.describeCurvature(curvature,
            SeriesMath.trend(curvatureHistory, ManifoldDescriptions.CURVATURE_TREND_WINDOW));
        String tensionDescription = ManifoldDescriptions.describeTension(tension);
        String entropyState = ManifoldDescriptions.describeEntropy(entropy);

        AttractorPullAnalyzer.AttractorPull pull = AttractorPullAnalyzer.analyze(price, metrics.attractors());

        String narrative = NarrativeComposer.compose(phase, conductor, singer,
            curvatureState, tensionDescription, entropyState);

        return new ManifoldInterpretation(
            phase,
            confidence(curvatureHistory, tensionHistory),
            conductor,
            singer,
            curvatureState,
            tensionDescription,
            entropyState,
            ManifoldDescriptions.wavePosition(phase),
            pull.nearest(),
            pull.pullStrength(),
            narrative,
            warning(phase, tension, singularityCount),
            curvature,
            entropy,
            tension
        );
    }

    /**
     * Mean of {@code 1/(1+σ)} over the last {@value #CONFIDENCE_WINDOW} curvature
     * and tension samples. In (0, 1]; lower when the recent readings are noisy.
     */
    public static double confidence(double[] curvature, double[] tension) {
        double curvatureConfidence = 1.0 / (1.0 + SeriesMath.std(SeriesMath.tail(curvature, CONFIDENCE_WINDOW)));
        double tensionConfidence = 1.0 / (1.0 + SeriesMath.std(SeriesMath.tail(tension, CONFIDENCE_WINDOW)));
        double confidence = (curvatureConfidence + tensionConfidence) / 2.0;
        return Double.isFinite(confidence) && confidence > 0.0 ? confidence : MIN_CONFIDENCE;
    }

    /** First match: forming singularity, high tension, repeated singularities; otherwise null. */
    public String warning(ManifoldPhase phase, double tension, int singularityCount) {
        if (phase == ManifoldPhase.SINGULARITY_FORMING) return SINGULARITY_WARNING;
        if (Math.abs(tension) > thresholds.highTension()) return HIGH_TENSION_WARNING;
        if (singularityCount > thresholds.singularityCountWarning()) return INSTABILITY_WARNING;
        return null;
    }

    private ManifoldInterpretation fallback() {
        ManifoldPhase phase = PhaseRuleTable.DEFAULT_PHASE;
        return new ManifoldInterpretation(
            phase,
            MIN_CONFIDENCE,
            ConductorReading.TRANSITIONAL,
            SingerReading.HARMONIOUS_FLOW,
            ManifoldDescriptions.TRANSITIONAL,
            ManifoldDescriptions.TRANSITIONAL,
            ManifoldDescriptions.TRANSITIONAL,
            ManifoldDescriptions.wavePosition(phase),
            null,
            0.0,
            NarrativeComposer.IN_TRANSITION,
            null,
            0.0,
            0.0,
            0.0
        );
    }
}
