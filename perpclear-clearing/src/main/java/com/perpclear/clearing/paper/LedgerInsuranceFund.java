package com.perpclear.clearing.paper;

import com.perpclear.clearing.port.CollateralLedger;
import com.perpclear.clearing.port.InsuranceFund;
import com.perpclear.core.exception.CollateralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Insurance fund whose treasury is an ordinary ledger account.
 */
public class LedgerInsuranceFund implements InsuranceFund {

    private static final Logger log = LoggerFactory.getLogger(LedgerInsuranceFund.class);

    private final CollateralLedger ledger;
    private final String accountId;

    public LedgerInsuranceFund(CollateralLedger ledger, String accountId) {
        this.ledger = ledger;
        this.accountId = accountId;
    }

    @Override
    public String accountId() {
        return accountId;
    }

    @Override
    public BigInteger balance(String token) {
        return ledger.balanceOf(accountId, token);
    }

    @Override
    public BigInteger payout(String to, String token, BigInteger amount) throws CollateralException {
        BigInteger paid = amount.min(balance(token));
        if (paid.signum() <= 0) {
            return BigInteger.ZERO;
        }
        ledger.seize(accountId, to, token, paid);
        log.info("Insurance payout: {} {} to {} (requested {})", paid, token, to, amount);
        return paid;
    }
}
