package com.manifoldplatform.common.insight;

import com.manifoldplatform.common.model.ConductorReading;
import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldPhase;
import com.manifoldplatform.common.model.SingerReading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BriefingComposerTest {

    @Test
    @DisplayName("phase and readings map to plain-language phrases")
    void compose() {
        ManifoldInterpretation interpretation = new ManifoldInterpretation(ManifoldPhase.SINGULARITY_FORMING, 0.9,
            ConductorReading.CRESCENDO, SingerReading.TENSION_CRACKLING, "c", "t", "e",
            "Wave peak - singularity forming", null, 0.0, "story", "warn", 2.5, 3.0, 2.0);

        InterpretationBriefing briefing = BriefingComposer.compose(interpretation);

        assertEquals("Singularity Alert", briefing.phaseTitle());
        assertTrue(briefing.phaseDetail().startsWith("Critical tension detected."));
        assertEquals("Building toward a climax, intensity rising", briefing.conductorView());
        assertEquals("The voice is straining and close to breaking", briefing.singerView());
        assertEquals("Wave peak - singularity forming", briefing.waveContext());
    }

    @Test
    @DisplayName("every phase and reading has a phrase")
    void total() {
        for (ManifoldPhase phase : ManifoldPhase.values()) {
            assertNotEquals(BriefingComposer.TRANSITIONAL_TITLE, BriefingComposer.phaseTitle(phase));
        }
        for (ConductorReading reading : ConductorReading.values()) {
            assertFalse(BriefingComposer.conductorView(reading).isBlank());
        }
        for (SingerReading reading : SingerReading.values()) {
            assertFalse(BriefingComposer.singerView(reading).isBlank());
        }
    }

    @Test
    @DisplayName("missing values fall back to generic phrases")
    void fallbacks() {
        ManifoldInterpretation interpretation = new ManifoldInterpretation(null, 0.0, null, null,
            "c", "t", "e", null, null, 0.0, "story", null, 0.0, 0.0, 0.0);

        InterpretationBriefing briefing = BriefingComposer.compose(interpretation);

        assertEquals(BriefingComposer.TRANSITIONAL_TITLE, briefing.phaseTitle());
        assertEquals(BriefingComposer.TRANSITIONAL_DETAIL, briefing.phaseDetail());
        assertEquals("Observing the composition", briefing.conductorView());
        assertEquals("Feeling the internal geometry", briefing.singerView());
        assertEquals(BriefingComposer.DEFAULT_WAVE_CONTEXT, briefing.waveContext());
    }
}
