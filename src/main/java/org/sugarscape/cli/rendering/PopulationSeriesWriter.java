package org.sugarscape.cli.rendering;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sugarscape.runtime.RunSummary;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Writes the population of a run as CSV with header {@code tick,population}.
 * <p>
 * Row 0 holds the initial population; row {@code i} the population after tick {@code i}.
 */
public class PopulationSeriesWriter {

    private static final Logger LOG = LoggerFactory.getLogger(PopulationSeriesWriter.class);

    static final String HEADER = "tick,population";

    /**
     * @param target  the CSV file, created or truncated; parent directories are created
     * @param summary the finished run
     * @throws IOException if the file cannot be written
     */
    public void write(Path target, RunSummary summary) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        IntList series = summary.populationSeries();
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            writer.write("0," + summary.initialPopulation());
            writer.newLine();
            for (int i = 0; i < series.size(); i++) {
                writer.write((i + 1) + "," + series.getInt(i));
                writer.newLine();
            }
        }
        LOG.debug("Wrote {} population rows to {}", series.size() + 1, target);
    }
}
