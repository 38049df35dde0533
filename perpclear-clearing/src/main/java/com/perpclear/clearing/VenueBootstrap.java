package com.perpclear.clearing;

import com.perpclear.clearing.journal.ClearingJournal;
import com.perpclear.clearing.paper.FeeRouter;
import com.perpclear.clearing.paper.InMemoryCollateralLedger;
import com.perpclear.clearing.paper.InMemoryMarketDirectory;
import com.perpclear.clearing.paper.LedgerInsuranceFund;
import com.perpclear.clearing.port.MarketInfo;
import com.perpclear.clearing.port.TokenConfig;
import com.perpclear.clearing.risk.MarketRiskParams;
import com.perpclear.core.access.AccessControl;
import com.perpclear.core.config.VenueConfig;
import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.exception.VenueException;
import com.perpclear.core.math.Wad;
import com.perpclear.core.oracle.ManualPriceSource;
import com.perpclear.core.time.TimeSource;
import com.perpclear.pricing.AmmParams;
import com.perpclear.pricing.VirtualAmm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds a paper venue from {@link VenueConfig}: collateral tokens, fee router, insurance fund,
 * one vAMM and manual index feed per market, risk parameters and the clearing actor.
 */
public class VenueBootstrap {

    private static final Logger log = LoggerFactory.getLogger(VenueBootstrap.class);

    public static Venue create(VenueConfig config, TimeSource time) throws VenueException {
        String admin = config.getAdmin();
        AccessControl access = new AccessControl(admin);

        InMemoryCollateralLedger ledger = new InMemoryCollateralLedger();
        for (VenueConfig.TokenConfigEntry token : config.getTokens()) {
            if (token.getSymbol() == null || token.getDecimals() < 0 || token.getDecimals() > Wad.DECIMALS) {
                throw new ValidationException("Invalid token entry: " + token.getSymbol(), RejectReason.INVALID_PARAMS);
            }
            ledger.registerToken(TokenConfig.ofDecimals(token.getSymbol(), token.getDecimals(), token.isEnabled()));
        }

        VenueConfig.InsuranceConfig insuranceConfig = config.getInsurance();
        VenueConfig.FeeRouterConfig routerConfig = config.getFeeRouter();
        LedgerInsuranceFund insuranceFund = new LedgerInsuranceFund(ledger, insuranceConfig.getAccount());
        FeeRouter feeRouter = new FeeRouter(ledger, routerConfig.getAccount(), insuranceConfig.getAccount(),
                routerConfig.getTreasuryAccount(), routerConfig.getInsuranceShareBps());

        String journalDir = config.getEngine().getJournalDir();
        ClearingJournal journal = journalDir == null || journalDir.isBlank()
                ? ClearingJournal.inMemory()
                : new ClearingJournal(Path.of(journalDir));

        InMemoryMarketDirectory directory = new InMemoryMarketDirectory();
        Map<String, ManualPriceSource> oracles = new LinkedHashMap<>();
        Map<String, VirtualAmm> amms = new LinkedHashMap<>();
        Set<String> quoteTokens = new LinkedHashSet<>();

        for (VenueConfig.MarketConfig market : config.getMarkets()) {
            String id = market.getId();
            if (id == null || id.isBlank()) {
                throw new ValidationException("Market without id", RejectReason.INVALID_PARAMS);
            }
            TokenConfig quote = ledger.tokenConfig(market.getQuoteToken());
            if (quote == null) {
                throw new ValidationException("Market " + id + " quotes unknown token " + market.getQuoteToken(),
                        RejectReason.UNKNOWN_TOKEN);
            }
            TokenConfig base = ledger.tokenConfig(market.getBaseToken());

            AmmParams ammParams = AmmParams.fromConfig(market.getAmm());
            String oraclePrice = market.getOracle().getPrice();
            BigInteger indexPrice = oraclePrice != null ? Wad.parse(oraclePrice) : ammParams.initialPrice();
            ManualPriceSource oracle = new ManualPriceSource(id + "-index", indexPrice);
            VirtualAmm amm = new VirtualAmm(id, ammParams, oracle, time, access);

            directory.register(new MarketInfo(id, amm, oracle, market.getFeeBps(), feeRouter, insuranceFund,
                    quote.symbol(), market.getBaseToken(), base != null ? base.baseUnit() : Wad.ONE,
                    market.isPaused()));
            oracles.put(id, oracle);
            amms.put(id, amm);
            quoteTokens.add(quote.symbol());
        }

        ClearingHouse house = new ClearingHouse(directory, ledger, access, time, journal,
                config.getEngine().getMaxActiveMarkets());
        for (VenueConfig.MarketConfig market : config.getMarkets()) {
            house.setRiskParams(admin, market.getId(), MarketRiskParams.fromConfig(market.getRisk()));
        }

        BigInteger insuranceSeed = Wad.parse(insuranceConfig.getInitialBalance());
        if (insuranceSeed.signum() > 0) {
            for (String token : quoteTokens) {
                BigInteger units = Wad.toTokenUnits(insuranceSeed, ledger.tokenConfig(token).baseUnit(), false);
                house.deposit(insuranceFund.accountId(), token, units);
            }
        }

        log.info("Venue ready: {} markets, {} tokens, admin={}", amms.size(), config.getTokens().size(), admin);
        return new Venue(admin, time, access, ledger, directory, insuranceFund, feeRouter, oracles, amms,
                journal, house, new ClearingService(house));
    }
}
