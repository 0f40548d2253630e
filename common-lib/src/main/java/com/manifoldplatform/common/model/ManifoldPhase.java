package com.manifoldplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative regime label produced by the phase cascade.
 *
 * <ul>
 *   <li>{@link #IMPULSE_LEG_SHARPENING} - curvature tightening under building tension</li>
 *   <li>{@link #SINGULARITY_FORMING}    - peak curvature and tension before a collapse</li>
 *   <li>{@link #RICCI_FLOW_SMOOTHING}   - correction redistributing stored tension</li>
 *   <li>{@link #ATTRACTOR_CONVERGENCE}  - settling into a price basin (default)</li>
 *   <li>{@link #STABLE_EQUILIBRIUM}     - low curvature, tension and entropy</li>
 *   <li>{@link #COMPRESSION_BUILDING}   - tension accumulating without curvature</li>
 * </ul>
 */
public enum ManifoldPhase {
    IMPULSE_LEG_SHARPENING("impulse_leg_sharpening"),
    SINGULARITY_FORMING("singularity_forming"),
    RICCI_FLOW_SMOOTHING("ricci_flow_smoothing"),
    ATTRACTOR_CONVERGENCE("attractor_convergence"),
    STABLE_EQUILIBRIUM("stable_equilibrium"),
    COMPRESSION_BUILDING("compression_building");

    private final String value;

    ManifoldPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ManifoldPhase fromValue(String value) {
        for (ManifoldPhase phase : values()) {
            if (phase.value.equals(value)) return phase;
        }
        throw new IllegalArgumentException("Unknown manifold phase: " + value);
    }
}
