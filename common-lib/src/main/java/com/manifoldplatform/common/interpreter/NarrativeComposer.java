package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.ConductorReading;
import com.manifoldplatform.common.model.ManifoldPhase;
import com.manifoldplatform.common.model.SingerReading;

/**
 * Composes the human-readable story for a diagnosed phase from the two
 * readings and the three banded descriptions.
 */
public final class NarrativeComposer {

    public static final String IN_TRANSITION = "The manifold is in transition between states.";

    private NarrativeComposer() {}

    public static String compose(ManifoldPhase phase,
                                 ConductorReading conductor,
                                 SingerReading singer,
                                 String curvatureState,
                                 String tensionDescription,
                                 String entropyState) {
        if (phase == null) return IN_TRANSITION;

        String conductorValue = conductor != null ? conductor.value() : ConductorReading.TRANSITIONAL.value();
        String singerValue = singer != null ? singer.value() : SingerReading.HARMONIOUS_FLOW.value();

        return switch (phase) {
            case IMPULSE_LEG_SHARPENING -> String.format(
                "The manifold is in an impulse leg. Curvature is %s, with tension %s. "
                    + "The Conductor senses a %s, while the Singer feels the note is %s. "
                    + "Psychological heat is accumulating as the surface sharpens.",
                curvatureState, tensionDescription, conductorValue, singerValue);
            case SINGULARITY_FORMING -> String.format(
                "A singularity is forming. The manifold has reached %s tension with %s curvature. "
                    + "The structure cannot hold this shape - a collapse and Ricci flow smoothing "
                    + "are imminent. The Singer feels the note %s.",
                tensionDescription, curvatureState, singerValue);
            case RICCI_FLOW_SMOOTHING -> String.format(
                "The manifold is undergoing Ricci flow - a smoothing process where tension "
                    + "redistributes across the surface. Entropy is %s as the structure 'burns off' "
                    + "excess psychological heat. The Conductor reads this as %s.",
                entropyState, conductorValue);
            case ATTRACTOR_CONVERGENCE -> String.format(
                "The manifold is converging toward a natural attractor. Curvature is %s with %s "
                    + "tension. The surface is settling into a gravitational basin, seeking equilibrium.",
                curvatureState, tensionDescription);
            case STABLE_EQUILIBRIUM -> String.format(
                "The manifold rests in stable equilibrium. Entropy is %s, tension is %s, and "
                    + "curvature is %s. The Singer feels %s. This is a rest phase between movements.",
                entropyState, tensionDescription, curvatureState, singerValue);
            case COMPRESSION_BUILDING -> String.format(
                "Compression is building. The manifold shows %s tension without high curvature - "
                    + "directional pressure is accumulating before the next sharp movement. "
                    + "The Conductor senses %s.",
                tensionDescription, conductorValue);
        };
    }
}
