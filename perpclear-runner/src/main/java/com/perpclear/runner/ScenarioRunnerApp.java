package com.perpclear.runner;

import com.perpclear.clearing.Venue;
import com.perpclear.clearing.VenueBootstrap;
import com.perpclear.core.config.VenueConfig;
import com.perpclear.core.exception.VenueException;
import com.perpclear.core.time.ManualClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Scenario Runner - replays a scripted scenario against a paper venue.
 *
 * Usage: ScenarioRunnerApp [venue.yaml] scenario.yaml
 * Without a venue file the bundled example venue is used.
 */
public class ScenarioRunnerApp {
    private static final Logger LOG = LoggerFactory.getLogger(ScenarioRunnerApp.class);
    static final String EXAMPLE_VENUE = "/venue-example.yaml";

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: ScenarioRunnerApp [venue.yaml] scenario.yaml");
            System.exit(2);
        }
        Path scenarioPath = Path.of(args[args.length - 1]);

        LOG.info("Scenario Runner starting: venue={} scenario={}",
                args.length == 2 ? args[0] : EXAMPLE_VENUE, scenarioPath);
        try {
            VenueConfig config = args.length == 2 ? VenueConfig.load(Path.of(args[0])) : loadExampleVenue();
            Scenario scenario = Scenario.load(scenarioPath);
            ManualClock clock = new ManualClock(scenario.getStartTime());
            try (Venue venue = VenueBootstrap.create(config, clock)) {
                new ScenarioRunner(venue, clock).run(scenario);
            }
        } catch (IOException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            System.exit(1);
        } catch (VenueException e) {
            LOG.error("Failed to build venue: {}", e.getMessage());
            System.exit(1);
        } catch (ScenarioException e) {
            LOG.error("Scenario failed at step {}: {}", e.getStepIndex(), e.getMessage());
            System.exit(1);
        }
    }

    static VenueConfig loadExampleVenue() throws IOException {
        try (InputStream in = ScenarioRunnerApp.class.getResourceAsStream(EXAMPLE_VENUE)) {
            if (in == null) {
                throw new IOException("Missing bundled venue " + EXAMPLE_VENUE);
            }
            return VenueConfig.load(in);
        }
    }
}
