package com.manifoldplatform.common.interpreter;

import com.manifoldplatform.common.model.ConductorReading;
import com.manifoldplatform.common.model.ManifoldPhase;
import com.manifoldplatform.common.model.SingerReading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NarrativeComposerTest {

    @Test
    @DisplayName("every phase produces a story naming its inputs")
    void everyPhase() {
        for (ManifoldPhase phase : ManifoldPhase.values()) {
            String story = NarrativeComposer.compose(phase, ConductorReading.CRESCENDO,
                SingerReading.RESONANT_STABLE, "CURV", "TENS", "ENTR");
            assertFalse(story.isBlank(), phase.name());
            assertTrue(story.contains("CURV") || story.contains("TENS") || story.contains("ENTR"), phase.name());
        }
    }

    @Test
    @DisplayName("impulse story carries the wire names of both readings")
    void impulseReadings() {
        String story = NarrativeComposer.compose(ManifoldPhase.IMPULSE_LEG_SHARPENING, ConductorReading.CRESCENDO,
            SingerReading.TENSION_CRACKLING, "sharp", "high", "calm");
        assertTrue(story.contains("The Conductor senses a crescendo"));
        assertTrue(story.contains("the note is tension_crackling"));
    }

    @Test
    @DisplayName("null phase → transition sentence")
    void nullPhase() {
        assertEquals(NarrativeComposer.IN_TRANSITION,
            NarrativeComposer.compose(null, null, null, null, null, null));
    }
}
