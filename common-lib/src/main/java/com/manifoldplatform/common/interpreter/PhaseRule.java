package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.ManifoldPhase;

import java.util.function.Predicate;

/**
 * One row of the phase precedence table.
 *
 * @param phase     label emitted when the guard matches
 * @param condition human-readable form of the guard, for audit output
 * @param guard     predicate over the latest-sample signals
 */
public record PhaseRule(
    ManifoldPhase phase,
    String condition,
    Predicate<PhaseSignals> guard
) {
    public boolean matches(PhaseSignals signals) {
        return guard.test(signals);
    }
}
