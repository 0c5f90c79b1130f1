package org.sugarscape.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sugarscape.cli.CommandLineInterface;
import org.sugarscape.cli.rendering.LandscapeRenderer;
import org.sugarscape.cli.rendering.PopulationSeriesWriter;
import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.RunSummary;
import org.sugarscape.runtime.Simulation;
import org.sugarscape.runtime.SimulationFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs one simulation and reports the population after every tick.
 * <p>
 * Options override the matching configuration values; anything not given on the command line
 * comes from the resolved configuration.
 */
@Command(
    name = "run",
    description = "Run a simulation and report the population after every tick"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"-T", "--ticks"}, description = "Number of ticks to run (config: simulation.ticks)")
    private Long ticks;

    @Option(names = {"-X", "--width"}, description = "Landscape width (config: landscape.width)")
    private Integer width;

    @Option(names = {"-Y", "--height"}, description = "Landscape height (config: landscape.height)")
    private Integer height;

    @Option(names = {"-A", "--agents"}, description = "Initial number of agents (config: agents.initial-count)")
    private Integer agents;

    @Option(names = {"-R", "--randomize"}, description = "Draw random capacity field parameters")
    private boolean randomize;

    @Option(names = {"-V", "--display"}, description = "Draw the landscape after every tick")
    private boolean display;

    @Option(names = {"-S", "--sleep-ms"}, description = "Pause between displayed ticks in ms (config: display.sleep-ms)")
    private Long sleepMs;

    @Option(names = {"--seed"}, description = "Random seed (config: simulation.seed)")
    private Long seed;

    @Option(names = {"--parallelism"},
        description = "Threads for agent updates: 0 = auto, 1 = sequential (config: simulation.parallelism)")
    private Integer parallelism;

    @Option(names = {"--series-out"}, description = "Write the population series as CSV to this file")
    private Path seriesOut;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config;
        Simulation simulation;
        try {
            config = applyOverrides(parent.getConfig());
            simulation = SimulationFactory.create(config);
        } catch (IllegalArgumentException | ConfigException e) {
            // InvalidConfigurationException is an IllegalArgumentException.
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            long maxTicks = config.getLong("simulation.ticks");
            if (maxTicks < 0) {
                throw new InvalidConfigurationException("simulation.ticks must be >= 0, got " + maxTicks);
            }
            boolean animate = config.getBoolean("display.enabled");
            long sleep = config.getLong("display.sleep-ms");
            LandscapeRenderer renderer = new LandscapeRenderer(animate);

            out.println("Initial Map:");
            out.print(renderer.render(simulation.getLandscape().snapshot(), simulation.getAliveCount(), null));

            simulation.addTickListener(report -> {
                if (animate) {
                    out.print(renderer.render(simulation.getLandscape().snapshot(), report.population(),
                            report.tick() + "/" + maxTicks));
                    pause(sleep);
                }
                out.println("Current Population at (" + report.tick() + " of " + maxTicks + "): "
                        + report.population());
                out.flush();
            });

            RunSummary summary = simulation.run(maxTicks);
            if (summary.extinct()) {
                out.println("All agents have died.");
            }
            out.print(renderer.render(simulation.getLandscape().snapshot(), summary.finalPopulation(), null));
            out.printf(Locale.ROOT, "Survivors: %d of %d (ratio %.3f) after %d ticks%n",
                    summary.finalPopulation(), summary.initialPopulation(), summary.survivorRatio(),
                    summary.ticksExecuted());

            if (seriesOut != null) {
                new PopulationSeriesWriter().write(seriesOut, summary);
                out.println("Population series written to " + seriesOut.toAbsolutePath());
            }
            out.flush();
            return 0;
        } catch (InvalidConfigurationException | ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to write population series to {}: {}", seriesOut, e.getMessage());
            err.println("Error: failed to write " + seriesOut + ": " + e.getMessage());
            return 1;
        } finally {
            simulation.shutdown();
        }
    }

    /**
     * Layers the command line options over the configuration.
     */
    Config applyOverrides(Config config) {
        Map<String, Object> overrides = new HashMap<>();
        if (ticks != null) {
            overrides.put("simulation.ticks", ticks);
        }
        if (seed != null) {
            overrides.put("simulation.seed", seed);
        }
        if (parallelism != null) {
            overrides.put("simulation.parallelism", parallelism);
        }
        if (width != null) {
            overrides.put("landscape.width", width);
        }
        if (height != null) {
            overrides.put("landscape.height", height);
        }
        if (agents != null) {
            overrides.put("agents.initial-count", agents);
        }
        if (randomize) {
            overrides.put("landscape.capacity-field.options.randomize", true);
        }
        if (display) {
            overrides.put("display.enabled", true);
        }
        if (sleepMs != null) {
            overrides.put("display.sleep-ms", sleepMs);
        }
        if (overrides.isEmpty()) {
            return config;
        }
        log.debug("Command line overrides: {}", overrides);
        return ConfigFactory.parseMap(overrides, "command line").withFallback(config).resolve();
    }

    private static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
