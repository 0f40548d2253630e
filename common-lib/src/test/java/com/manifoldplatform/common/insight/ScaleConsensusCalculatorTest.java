package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.ConductorReading;
import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldPhase;
import com.manifoldplatform.common.model.SingerReading;
import com.manifoldplatform.common.model.TimeScale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScaleConsensusCalculatorTest {

    static ManifoldInterpretation withPhase(ManifoldPhase phase) {
        return new ManifoldInterpretation(phase, 0.8, ConductorReading.TRANSITIONAL, SingerReading.HARMONIOUS_FLOW,
            "c", "t", "e", null, null, 0.0, "story", null, 0.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("three of four scales agree → 75%")
    void majority() {
        Map<TimeScale, ManifoldInterpretation> byScale = new EnumMap<>(TimeScale.class);
        byScale.put(TimeScale.MONTHLY, withPhase(ManifoldPhase.COMPRESSION_BUILDING));
        byScale.put(TimeScale.WEEKLY, withPhase(ManifoldPhase.STABLE_EQUILIBRIUM));
        byScale.put(TimeScale.DAILY, withPhase(ManifoldPhase.STABLE_EQUILIBRIUM));
        byScale.put(TimeScale.INTRADAY, withPhase(ManifoldPhase.STABLE_EQUILIBRIUM));

        ScaleConsensus consensus = ScaleConsensusCalculator.evaluate(byScale);

        assertEquals(ManifoldPhase.STABLE_EQUILIBRIUM, consensus.dominantPhase());
        assertEquals(75, consensus.consistency());
        assertEquals(3, consensus.phaseCounts().get(ManifoldPhase.STABLE_EQUILIBRIUM));
        assertEquals(1, consensus.phaseCounts().get(ManifoldPhase.COMPRESSION_BUILDING));
    }

    @Test
    @DisplayName("a tie resolves to the coarsest scale's phase")
    void tie() {
        Map<TimeScale, ManifoldInterpretation> byScale = new EnumMap<>(TimeScale.class);
        byScale.put(TimeScale.WEEKLY, withPhase(ManifoldPhase.RICCI_FLOW_SMOOTHING));
        byScale.put(TimeScale.DAILY, withPhase(ManifoldPhase.IMPULSE_LEG_SHARPENING));

        ScaleConsensus consensus = ScaleConsensusCalculator.evaluate(byScale);
        assertEquals(ManifoldPhase.RICCI_FLOW_SMOOTHING, consensus.dominantPhase());
        assertEquals(50, consensus.consistency());
    }

    @Test
    @DisplayName("no scales → no dominant phase")
    void empty() {
        ScaleConsensus consensus = ScaleConsensusCalculator.evaluate(Map.of());
        assertNull(consensus.dominantPhase());
        assertEquals(0, consensus.consistency());
        assertTrue(consensus.phaseCounts().isEmpty());
    }
}
