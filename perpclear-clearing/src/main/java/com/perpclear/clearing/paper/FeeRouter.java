package com.perpclear.clearing.paper;

import com.perpclear.clearing.port.CollateralLedger;
import com.perpclear.clearing.port.FeeDistributor;
import com.perpclear.core.exception.CollateralException;
import com.perpclear.core.math.Wad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Splits fees and protocol penalties collected into the router account between the
 * insurance fund and the treasury.
 */
public class FeeRouter implements FeeDistributor {

    private static final Logger log = LoggerFactory.getLogger(FeeRouter.class);

    private final CollateralLedger ledger;
    private final String accountId;
    private final String insuranceAccount;
    private final String treasuryAccount;
    private final int insuranceShareBps;

    private final Map<String, BigInteger> tradeFees = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> penalties = new ConcurrentHashMap<>();

    public FeeRouter(CollateralLedger ledger, String accountId, String insuranceAccount,
                     String treasuryAccount, int insuranceShareBps) {
        if (insuranceShareBps < 0 || insuranceShareBps > 10_000) {
            throw new IllegalArgumentException("insuranceShareBps must be within [0, 10000]");
        }
        this.ledger = ledger;
        this.accountId = accountId;
        this.insuranceAccount = insuranceAccount;
        this.treasuryAccount = treasuryAccount;
        this.insuranceShareBps = insuranceShareBps;
    }

    @Override
    public String accountId() {
        return accountId;
    }

    @Override
    public void onTradeFee(String token, BigInteger amount) throws CollateralException {
        tradeFees.merge(token, amount, BigInteger::add);
        route(token, amount);
    }

    @Override
    public void onLiquidationPenalty(String token, BigInteger amount) throws CollateralException {
        penalties.merge(token, amount, BigInteger::add);
        route(token, amount);
    }

    private void route(String token, BigInteger amount) throws CollateralException {
        if (amount.signum() <= 0) return;
        BigInteger toInsurance = Wad.bps(amount, insuranceShareBps, false);
        BigInteger toTreasury = amount.subtract(toInsurance);
        if (toInsurance.signum() > 0) {
            ledger.seize(accountId, insuranceAccount, token, toInsurance);
        }
        if (toTreasury.signum() > 0) {
            ledger.seize(accountId, treasuryAccount, token, toTreasury);
        }
        log.debug("Routed {} {}: insurance={} treasury={}", amount, token, toInsurance, toTreasury);
    }

    public BigInteger getTotalTradeFees(String token) {
        return tradeFees.getOrDefault(token, BigInteger.ZERO);
    }

    public BigInteger getTotalPenalties(String token) {
        return penalties.getOrDefault(token, BigInteger.ZERO);
    }
}
