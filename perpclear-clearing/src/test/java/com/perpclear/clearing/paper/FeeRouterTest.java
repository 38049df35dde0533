package com.perpclear.clearing.paper;

import com.perpclear.clearing.port.TokenConfig;
import com.perpclear.core.exception.CollateralException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class FeeRouterTest {

    private InMemoryCollateralLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryCollateralLedger();
        ledger.registerToken(TokenConfig.ofDecimals("USDC", 6, true));
    }

    @Test
    @DisplayName("Splits fees between insurance and treasury, rounding towards the treasury")
    void splitsFees() throws CollateralException {
        // Given
        FeeRouter router = new FeeRouter(ledger, "router", "insurance", "treasury", 3000);
        ledger.deposit("router", "USDC", BigInteger.valueOf(1_005));

        // When
        router.onTradeFee("USDC", BigInteger.valueOf(1_000));
        router.onLiquidationPenalty("USDC", BigInteger.valueOf(5));

        // Then: 30% of 1000 = 300, 30% of 5 = 1.5 -> 1
        assertEquals(BigInteger.valueOf(301), ledger.balanceOf("insurance", "USDC"));
        assertEquals(BigInteger.valueOf(704), ledger.balanceOf("treasury", "USDC"));
        assertEquals(BigInteger.ZERO, ledger.balanceOf("router", "USDC"));
        assertEquals(BigInteger.valueOf(1_000), router.getTotalTradeFees("USDC"));
        assertEquals(BigInteger.valueOf(5), router.getTotalPenalties("USDC"));
    }

    @Test
    @DisplayName("Share outside [0, 10000] bps is rejected")
    void rejectsBadShare() {
        assertThrows(IllegalArgumentException.class,
                () -> new FeeRouter(ledger, "router", "insurance", "treasury", 10_001));
    }

    @Test
    @DisplayName("Insurance payout is limited to the fund balance")
    void insurancePayoutCapped() throws CollateralException {
        LedgerInsuranceFund fund = new LedgerInsuranceFund(ledger, "insurance");
        ledger.deposit("insurance", "USDC", BigInteger.valueOf(70));

        BigInteger paid = fund.payout("bob", "USDC", BigInteger.valueOf(100));

        assertEquals(BigInteger.valueOf(70), paid);
        assertEquals(BigInteger.ZERO, fund.balance("USDC"));
        assertEquals(BigInteger.ZERO, fund.payout("bob", "USDC", BigInteger.TEN));
    }
}
