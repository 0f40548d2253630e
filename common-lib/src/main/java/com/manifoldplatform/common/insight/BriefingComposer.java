package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.ConductorReading;
import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldPhase;
import com.manifoldplatform.common.model.SingerReading;

/**
 * Pure logic class - plain-language phrasing of an interpretation for
 * non-specialist readers.
 */
public final class BriefingComposer {

    static final String TRANSITIONAL_TITLE  = "Transitional";
    static final String TRANSITIONAL_DETAIL = "The manifold is reorganizing its geometric structure.";
    static final String DEFAULT_WAVE_CONTEXT = "Transitional structure";

    private BriefingComposer() {}

    public static InterpretationBriefing compose(ManifoldInterpretation interpretation) {
        String wave = interpretation.wavePosition();
        return new InterpretationBriefing(
            phaseTitle(interpretation.phase()),
            phaseDetail(interpretation.phase()),
            conductorView(interpretation.conductorReading()),
            singerView(interpretation.singerReading()),
            wave == null || wave.isBlank() ? DEFAULT_WAVE_CONTEXT : wave);
    }

    static String phaseTitle(ManifoldPhase phase) {
        if (phase == null) return TRANSITIONAL_TITLE;
        return switch (phase) {
            case IMPULSE_LEG_SHARPENING -> "Impulse Phase";
            case SINGULARITY_FORMING    -> "Singularity Alert";
            case RICCI_FLOW_SMOOTHING   -> "Correction Phase";
            case ATTRACTOR_CONVERGENCE  -> "Convergence Phase";
            case STABLE_EQUILIBRIUM     -> "Equilibrium Phase";
            case COMPRESSION_BUILDING   -> "Compression Building";
        };
    }

    static String phaseDetail(ManifoldPhase phase) {
        if (phase == null) return TRANSITIONAL_DETAIL;
        return switch (phase) {
            case IMPULSE_LEG_SHARPENING ->
                "Curvature is intensifying as directional conviction builds. The geometry is tightening.";
            case SINGULARITY_FORMING ->
                "Critical tension detected. The surface cannot hold this shape, so expect a corrective "
                    + "redistribution as the geometry cools.";
            case RICCI_FLOW_SMOOTHING ->
                "The manifold is smoothing out and redistributing tension as the surface relaxes.";
            case ATTRACTOR_CONVERGENCE ->
                "Price is settling toward a natural attractor basin, seeking geometric equilibrium.";
            case STABLE_EQUILIBRIUM ->
                "Low tension and calm entropy. The current shape is sustainable.";
            case COMPRESSION_BUILDING ->
                "Directional pressure is accumulating without release. Watch for sharp curvature when it breaks.";
        };
    }

    static String conductorView(ConductorReading reading) {
        if (reading == null) return "Observing the composition";
        return switch (reading) {
            case CRESCENDO         -> "Building toward a climax, intensity rising";
            case DECRESCENDO       -> "Releasing from a climax, energy dissipating";
            case SUSTAINED_TENSION -> "Holding at intensity, a dramatic pause";
            case REST_PHASE        -> "Resting between movements";
            case TRANSITIONAL      -> "Moving between states";
        };
    }

    static String singerView(SingerReading reading) {
        if (reading == null) return "Feeling the internal geometry";
        return switch (reading) {
            case RESONANT_STABLE   -> "The note holds naturally";
            case TENSION_CRACKLING -> "The voice is straining and close to breaking";
            case HARMONIOUS_FLOW   -> "Smooth melodic movement";
            case DISSONANT_STRAIN  -> "Forced and unsustainable, resolution is near";
        };
    }
}
