package org.sugarscape.cli.rendering;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.sugarscape.junit.extensions.logging.LogWatchExtension;
import org.sugarscape.runtime.internal.services.SeededRandomProvider;
import org.sugarscape.runtime.model.AgentFactory;
import org.sugarscape.runtime.model.AgentTraits;
import org.sugarscape.runtime.model.FertilityWindow;
import org.sugarscape.runtime.model.Landscape;
import org.sugarscape.runtime.model.LandscapeProperties;
import org.sugarscape.runtime.model.Sex;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LandscapeRendererTest {

    private static final String CELL = "  ";

    @Test
    void rendersOneRowPerXAndOneCellPerY() {
        Landscape landscape = new Landscape(new LandscapeProperties(2, 3, 1), (x, y) -> x * 3 + y);
        AgentTraits traits = new AgentTraits(1, 1.0, 5.0, 50.0, Sex.MALE, new FertilityWindow(20.0, 30.0));
        new AgentFactory(landscape, new SeededRandomProvider(1L), rng -> traits)
                .create(landscape.cellAt(1, 2), traits);

        String frame = new LandscapeRenderer(false).render(landscape.snapshot(), 1, null);

        List<String> lines = Arrays.asList(frame.split("\n"));
        String row0 = LandscapeRenderer.PALETTE[0] + CELL + LandscapeRenderer.RESET
                + LandscapeRenderer.PALETTE[1] + CELL + LandscapeRenderer.RESET
                + LandscapeRenderer.PALETTE[2] + CELL + LandscapeRenderer.RESET;
        String row1 = LandscapeRenderer.PALETTE[3] + CELL + LandscapeRenderer.RESET
                + LandscapeRenderer.PALETTE[4] + CELL + LandscapeRenderer.RESET
                + LandscapeRenderer.AGENT + CELL + LandscapeRenderer.RESET;
        assertThat(lines).containsSubsequence(row0, row1);
        assertThat(lines).contains("Agents: 1");
        assertThat(frame).doesNotStartWith(LandscapeRenderer.CLEAR_SCREEN);
        assertThat(frame).contains("Landscape Map:");
    }

    @Test
    void keyListsAllLevelsAndTheAgentColor() {
        Landscape landscape = new Landscape(new LandscapeProperties(1, 1, 1), (x, y) -> 0);

        String frame = new LandscapeRenderer(false).render(landscape.snapshot(), 0, null);

        for (int i = 0; i < LandscapeRenderer.PALETTE.length; i++) {
            assertThat(frame).contains(i + " = " + LandscapeRenderer.PALETTE[i] + CELL);
        }
        assertThat(frame).contains("Agent = " + LandscapeRenderer.AGENT + CELL);
        assertThat(frame).startsWith("=".repeat(20) + "\n");
    }

    @Test
    void animatedFramesClearTheScreenAndShowProgress() {
        Landscape landscape = new Landscape(new LandscapeProperties(2, 2, 1), (x, y) -> 1);

        String frame = new LandscapeRenderer(true).render(landscape.snapshot(), 0, "3/10");

        assertThat(frame).startsWith(LandscapeRenderer.CLEAR_SCREEN + LandscapeRenderer.CURSOR_HOME);
        assertThat(frame).contains("Landscape Map 3/10:");
    }

    @Test
    void resourceLevelsAboveNineShareTheLastColor() {
        assertThat(LandscapeRenderer.colorFor(9)).isEqualTo(LandscapeRenderer.PALETTE[9]);
        assertThat(LandscapeRenderer.colorFor(42)).isEqualTo(LandscapeRenderer.PALETTE[9]);
        assertThat(LandscapeRenderer.colorFor(0)).isEqualTo(LandscapeRenderer.PALETTE[0]);
    }
}
