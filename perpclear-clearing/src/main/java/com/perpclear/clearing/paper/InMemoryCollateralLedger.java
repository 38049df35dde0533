package com.perpclear.clearing.paper;

import com.perpclear.clearing.port.CollateralLedger;
import com.perpclear.clearing.port.TokenConfig;
import com.perpclear.core.exception.CollateralException;
import com.perpclear.core.math.Wad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulated collateral vault for the paper venue.
 * Balances live in memory; every enabled token counts at par towards collateral value.
 */
public class InMemoryCollateralLedger implements CollateralLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCollateralLedger.class);

    private final Map<String, TokenConfig> tokens = new ConcurrentHashMap<>();
    // account -> token -> balance
    private final Map<String, Map<String, BigInteger>> balances = new ConcurrentHashMap<>();

    public void registerToken(TokenConfig config) {
        tokens.put(config.symbol(), config);
        log.info("Collateral token registered: {} (unit={}, enabled={})",
                config.symbol(), config.baseUnit(), config.enabled());
    }

    @Override
    public BigInteger balanceOf(String account, String token) {
        Map<String, BigInteger> accountBalances = balances.get(account);
        if (accountBalances == null) return BigInteger.ZERO;
        return accountBalances.getOrDefault(token, BigInteger.ZERO);
    }

    @Override
    public BigInteger deposit(String account, String token, BigInteger amount) throws CollateralException {
        TokenConfig config = requireToken(token);
        if (!config.enabled()) {
            throw new CollateralException("Deposits disabled for " + token);
        }
        requireNonNegative(amount);
        credit(account, token, amount);
        log.info("Deposit: {} {} {}", account, amount, token);
        return amount;
    }

    @Override
    public BigInteger withdraw(String account, String token, BigInteger amount) throws CollateralException {
        requireToken(token);
        requireNonNegative(amount);
        debit(account, token, amount);
        log.info("Withdraw: {} {} {}", account, amount, token);
        return amount;
    }

    @Override
    public void seize(String from, String to, String token, BigInteger amount) throws CollateralException {
        requireToken(token);
        requireNonNegative(amount);
        debit(from, token, amount);
        credit(to, token, amount);
        log.debug("Seize: {} -> {} {} {}", from, to, amount, token);
    }

    @Override
    public void settlePnL(String account, String token, BigInteger signedAmount) throws CollateralException {
        requireToken(token);
        if (signedAmount.signum() >= 0) {
            credit(account, token, signedAmount);
        } else {
            debit(account, token, signedAmount.negate());
        }
        log.debug("Settle PnL: {} {} {}", account, signedAmount, token);
    }

    @Override
    public BigInteger accountCollateralValue(String account) {
        Map<String, BigInteger> accountBalances = balances.get(account);
        if (accountBalances == null) return BigInteger.ZERO;
        BigInteger total = BigInteger.ZERO;
        for (Map.Entry<String, BigInteger> e : accountBalances.entrySet()) {
            TokenConfig config = tokens.get(e.getKey());
            if (config != null && config.enabled()) {
                total = total.add(Wad.fromTokenUnits(e.getValue(), config.baseUnit()));
            }
        }
        return total;
    }

    @Override
    public TokenConfig tokenConfig(String token) {
        return tokens.get(token);
    }

    private TokenConfig requireToken(String token) throws CollateralException {
        TokenConfig config = tokens.get(token);
        if (config == null) {
            throw new CollateralException("Unknown collateral token: " + token);
        }
        return config;
    }

    private void credit(String account, String token, BigInteger amount) {
        balances.computeIfAbsent(account, k -> new ConcurrentHashMap<>())
                .merge(token, amount, BigInteger::add);
    }

    private void debit(String account, String token, BigInteger amount) throws CollateralException {
        BigInteger balance = balanceOf(account, token);
        if (balance.compareTo(amount) < 0) {
            throw new CollateralException(String.format("Insufficient %s balance for %s: need %s, have %s",
                    token, account, amount, balance));
        }
        balances.computeIfAbsent(account, k -> new ConcurrentHashMap<>())
                .put(token, balance.subtract(amount));
    }

    private static void requireNonNegative(BigInteger amount) throws CollateralException {
        if (amount == null || amount.signum() < 0) {
            throw new CollateralException("Amount must be non-negative: " + amount);
        }
    }
}
