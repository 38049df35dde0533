package com.perpclear.runner;

import com.perpclear.clearing.Venue;
import com.perpclear.clearing.VenueBootstrap;
import com.perpclear.core.config.VenueConfig;
import com.perpclear.core.time.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioRunnerTest {

    private Venue venue;

    @AfterEach
    void tearDown() {
        if (venue != null) {
            venue.close();
        }
    }

    private ScenarioRunner runner(long startTime) throws Exception {
        VenueConfig config = ScenarioRunnerApp.loadExampleVenue();
        ManualClock clock = new ManualClock(startTime);
        venue = VenueBootstrap.create(config, clock);
        return new ScenarioRunner(venue, clock);
    }

    private static Scenario.Step step(String action, String account, String expect) {
        Scenario.Step step = new Scenario.Step();
        step.setAction(action);
        step.setAccount(account);
        step.setMarket("ETH-PERP");
        step.setExpect(expect);
        return step;
    }

    @Test
    @DisplayName("Bundled liquidation scenario runs to completion")
    void liquidationScenario() throws Exception {
        // Given
        Scenario scenario;
        try (InputStream in = getClass().getResourceAsStream("/scenarios/liquidation.yaml")) {
            assertNotNull(in);
            scenario = Scenario.load(in);
        }
        ScenarioRunner runner = runner(scenario.getStartTime());

        // When
        List<StepOutcome> outcomes = runner.run(scenario);

        // Then
        assertEquals(scenario.getSteps().size(), outcomes.size());
        assertEquals("WITHDRAW_UNBACKED", outcomes.get(3).rejection());
        assertTrue(outcomes.get(11).succeeded());
        assertFalse(venue.house().getPosition("alice", "ETH-PERP").isOpen());
        // 2.5% of 10 x 1850, half to the liquidator
        assertEquals(new BigInteger("100231250000"), venue.ledger().balanceOf("bob", "USDC"));
    }

    @Test
    @DisplayName("Unexpected rejection stops the run at that step")
    void unexpectedRejection() throws Exception {
        ScenarioRunner runner = runner(1_700_000_000L);
        Scenario scenario = new Scenario();
        Scenario.Step open = step("open", "carol", null);
        open.setSize("1");
        scenario.getSteps().add(open);

        ScenarioException e = assertThrows(ScenarioException.class, () -> runner.run(scenario));

        assertEquals(1, e.getStepIndex());
        assertTrue(e.getMessage().contains("INSUFFICIENT_COLLATERAL"));
    }

    @Test
    @DisplayName("Expected rejection that does not happen fails the run")
    void missingRejection() throws Exception {
        ScenarioRunner runner = runner(1_700_000_000L);
        Scenario scenario = new Scenario();
        Scenario.Step show = step("showPosition", "alice", "NO_POSITION");
        scenario.getSteps().add(show);

        ScenarioException e = assertThrows(ScenarioException.class, () -> runner.run(scenario));

        assertEquals(1, e.getStepIndex());
    }

    @Test
    @DisplayName("Unknown actions are reported")
    void unknownAction() throws Exception {
        ScenarioRunner runner = runner(1_700_000_000L);
        Scenario scenario = new Scenario();
        scenario.getSteps().add(step("teleport", "alice", null));

        assertThrows(ScenarioException.class, () -> runner.run(scenario));
    }
}
