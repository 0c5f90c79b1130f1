package org.sugarscape.cli.rendering;

import org.sugarscape.runtime.model.LandscapeSnapshot;

/**
 * Draws a {@link LandscapeSnapshot} as a block of ANSI-colored terminal cells.
 * <p>
 * Every cell is two characters wide. Occupied cells use the agent color; empty cells use one of
 * ten background colors picked by resource level, levels above 9 sharing the last color. Rows are
 * x-coordinates and columns y-coordinates.
 */
public class LandscapeRenderer {

    static final String RESET = "\u001B[0m";
    static final String AGENT = "\u001B[30;43m";
    static final String TITLE = "\u001B[97;1m";
    static final String CLEAR_SCREEN = "\u001B[2J";
    static final String CURSOR_HOME = "\u001B[H";

    static final String[] PALETTE = {
        "\u001B[30;100m",
        "\u001B[30;106m",
        "\u001B[30;46m",
        "\u001B[30;104m",
        "\u001B[30;44m",
        "\u001B[30;45m",
        "\u001B[30;105m",
        "\u001B[30;101m",
        "\u001B[30;41m",
        "\u001B[30;40m"
    };

    private static final String CELL = "  ";

    private final boolean clearScreen;

    /**
     * @param clearScreen whether each frame starts by clearing the terminal, for animated output
     */
    public LandscapeRenderer(boolean clearScreen) {
        this.clearScreen = clearScreen;
    }

    /**
     * Renders one frame.
     *
     * @param snapshot   the landscape state
     * @param agentCount number of live agents shown below the map
     * @param progress   label such as {@code "12/500"} appended to the title, or {@code null}
     * @return the frame, lines separated by {@code '\n'}
     */
    public String render(LandscapeSnapshot snapshot, int agentCount, String progress) {
        StringBuilder sb = new StringBuilder();
        if (clearScreen) {
            sb.append(CLEAR_SCREEN).append(CURSOR_HOME);
        }
        String rule = "=".repeat(Math.max(snapshot.getHeight() * CELL.length(), 20));

        sb.append(rule).append('\n');
        sb.append(TITLE).append("Landscape Map");
        if (progress != null) {
            sb.append(' ').append(progress);
        }
        sb.append(':').append(RESET).append('\n');
        sb.append(rule).append('\n');

        sb.append("Key:\n");
        for (int i = 0; i < PALETTE.length; i++) {
            sb.append(i).append(" = ").append(PALETTE[i]).append(CELL).append(RESET);
            sb.append((i + 1) % 4 == 0 ? "\n" : "; ");
        }
        sb.append("Agent = ").append(AGENT).append(CELL).append(RESET).append('\n');
        sb.append(rule).append('\n');

        for (int x = 0; x < snapshot.getWidth(); x++) {
            for (int y = 0; y < snapshot.getHeight(); y++) {
                String color = snapshot.isOccupied(x, y) ? AGENT : colorFor(snapshot.resourceLevelAt(x, y));
                sb.append(color).append(CELL).append(RESET);
            }
            sb.append('\n');
        }
        sb.append(rule).append('\n');
        sb.append("Agents: ").append(agentCount).append('\n');
        sb.append(rule).append('\n');
        return sb.toString();
    }

    static String colorFor(int resourceLevel) {
        return PALETTE[Math.max(0, Math.min(resourceLevel, PALETTE.length - 1))];
    }
}
