package com.perpclear.runner;

import com.perpclear.clearing.ClearingService;
import com.perpclear.clearing.LiquidationResult;
import com.perpclear.clearing.TradeResult;
import com.perpclear.clearing.Venue;
import com.perpclear.clearing.port.TokenConfig;
import com.perpclear.clearing.position.Position;
import com.perpclear.core.exception.RiskRejectedException;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.exception.VenueException;
import com.perpclear.core.math.Wad;
import com.perpclear.core.time.ManualClock;
import com.perpclear.pricing.FundingUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays a {@link Scenario} against a venue through its clearing actor.
 * Stops at the first step whose outcome differs from what the script expects.
 */
public class ScenarioRunner {

    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);

    private final Venue venue;
    private final ManualClock clock;
    private final ClearingService service;

    public ScenarioRunner(Venue venue, ManualClock clock) {
        this.venue = venue;
        this.clock = clock;
        this.service = venue.service();
    }

    public List<StepOutcome> run(Scenario scenario) throws ScenarioException {
        log.info("Running scenario '{}' ({} steps)", scenario.getName(), scenario.getSteps().size());
        List<StepOutcome> outcomes = new ArrayList<>();
        int index = 0;
        for (Scenario.Step step : scenario.getSteps()) {
            index++;
            StepOutcome outcome = runStep(index, step);
            outcomes.add(outcome);

            String expected = blankToNull(step.getExpect());
            if (expected == null && !outcome.succeeded()) {
                throw new ScenarioException(String.format("Step %d (%s) rejected: %s",
                        index, step, outcome.rejection()), index);
            }
            if (expected != null && !expected.equals(outcome.rejection())) {
                throw new ScenarioException(String.format("Step %d (%s) expected %s but got %s",
                        index, step, expected, outcome.succeeded() ? "success" : outcome.rejection()), index);
            }
            if (outcome.succeeded()) {
                log.info("#{} {} -> {}", index, step.getAction(), outcome.detail());
            } else {
                log.info("#{} {} rejected as expected: {}", index, step.getAction(), outcome.rejection());
            }
        }
        log.info("Scenario '{}' completed", scenario.getName());
        return outcomes;
    }

    private StepOutcome runStep(int index, Scenario.Step step) throws ScenarioException {
        String action = step.getAction();
        if (action == null) {
            throw new ScenarioException("Step " + index + " has no action", index);
        }
        try {
            return new StepOutcome(index, action, execute(index, step), null);
        } catch (ValidationException e) {
            return new StepOutcome(index, action, e.getMessage(), e.getReason().name());
        } catch (RiskRejectedException e) {
            return new StepOutcome(index, action, e.getMessage(), e.getReason().name());
        } catch (VenueException e) {
            return new StepOutcome(index, action, e.getMessage(), e.getClass().getSimpleName());
        }
    }

    private String execute(int index, Scenario.Step step) throws VenueException, ScenarioException {
        switch (step.getAction()) {
            case "deposit": {
                BigInteger units = toUnits(step.getToken(), step.getAmount());
                service.deposit(step.getAccount(), step.getToken(), units);
                return "deposited " + step.getAmount() + " " + step.getToken();
            }
            case "withdraw": {
                BigInteger units = toUnits(step.getToken(), step.getAmount());
                service.withdraw(step.getAccount(), step.getToken(), units);
                return "withdrew " + step.getAmount() + " " + step.getToken();
            }
            case "open": {
                boolean isLong = !"short".equalsIgnoreCase(step.getSide());
                TradeResult r = service.openPosition(step.getAccount(), step.getMarket(), isLong,
                        Wad.parse(step.getSize()), Wad.parse(step.getPriceLimit()));
                return describe(r);
            }
            case "close": {
                TradeResult r = service.closePosition(step.getAccount(), step.getMarket(),
                        Wad.parse(step.getSize()), Wad.parse(step.getPriceLimit()));
                return describe(r);
            }
            case "liquidate": {
                LiquidationResult r = service.liquidate(step.getLiquidator(), step.getAccount(), step.getMarket(),
                        Wad.parse(step.getSize()), Wad.parse(step.getPriceLimit()));
                return String.format("liquidated %s @ %s, penalty %s, bad debt %s", Wad.format(r.size()),
                        Wad.format(r.riskPrice().price()), Wad.format(r.penalty()), Wad.format(r.badDebt()));
            }
            case "addMargin": {
                Position p = service.addMargin(step.getAccount(), step.getMarket(), Wad.parse(step.getAmount()));
                return "margin " + Wad.format(p.getMargin());
            }
            case "removeMargin": {
                Position p = service.removeMargin(step.getAccount(), step.getMarket(), Wad.parse(step.getAmount()));
                return "margin " + Wad.format(p.getMargin());
            }
            case "settleFunding": {
                BigInteger payment = service.settleFunding(step.getAccount(), step.getMarket());
                return "funding payment " + Wad.format(payment);
            }
            case "pokeFunding": {
                FundingUpdate update = service.pokeFunding(step.getMarket());
                return String.format("funding %s rate=%s index=%s", update.status(),
                        Wad.format(update.rate()), Wad.format(update.cumulativeIndex()));
            }
            case "advanceTime": {
                long now = service.call(h -> clock.advance(step.getSeconds()));
                return "clock at " + now;
            }
            case "setIndexPrice": {
                BigInteger price = Wad.parse(step.getPrice());
                service.call(h -> {
                    venue.oracle(step.getMarket()).setPrice(price);
                    return null;
                });
                return "index " + step.getPrice();
            }
            case "failOracle":
            case "restoreOracle": {
                boolean failing = "failOracle".equals(step.getAction());
                service.call(h -> {
                    venue.oracle(step.getMarket()).setFailing(failing);
                    return null;
                });
                return failing ? "oracle down" : "oracle restored";
            }
            case "pauseSwaps":
            case "resumeSwaps": {
                boolean paused = "pauseSwaps".equals(step.getAction());
                service.call(h -> {
                    h.setSwapsPaused(callerOf(step), step.getMarket(), paused);
                    return null;
                });
                return paused ? "swaps paused" : "swaps resumed";
            }
            case "resetReserves": {
                service.call(h -> {
                    h.resetReserves(callerOf(step), step.getMarket(), Wad.parse(step.getPrice()),
                            Wad.parse(step.getAmount()));
                    return null;
                });
                return "reserves reset to " + step.getPrice();
            }
            case "showPosition": {
                Position p = service.getPosition(step.getAccount(), step.getMarket());
                return p.toString();
            }
            default:
                throw new ScenarioException("Unknown action: " + step.getAction(), index);
        }
    }

    private String callerOf(Scenario.Step step) {
        return step.getCaller() != null ? step.getCaller() : venue.admin();
    }

    private BigInteger toUnits(String token, String amount) throws VenueException {
        TokenConfig config = venue.ledger().tokenConfig(token);
        if (config == null) {
            return Wad.parse(amount);
        }
        return Wad.toTokenUnits(Wad.parse(amount), config.baseUnit(), false);
    }

    private static String describe(TradeResult r) {
        return String.format("%s %s @ %s, size %s, realized %s", r.kind(), Wad.format(r.baseDelta()),
                Wad.format(r.executionPrice()), Wad.format(r.position().getSize()), Wad.format(r.realizedPnl()));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
