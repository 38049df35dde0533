package com.perpclear.clearing;

import com.perpclear.clearing.journal.BadDebtEvent;
import com.perpclear.clearing.journal.ClearingJournal;
import com.perpclear.clearing.journal.FundingEvent;
import com.perpclear.clearing.journal.LiquidationEvent;
import com.perpclear.clearing.journal.PositionEvent;
import com.perpclear.clearing.port.CollateralLedger;
import com.perpclear.clearing.port.FeeDistributor;
import com.perpclear.clearing.port.InsuranceFund;
import com.perpclear.clearing.port.MarketDirectory;
import com.perpclear.clearing.port.MarketInfo;
import com.perpclear.clearing.port.TokenConfig;
import com.perpclear.clearing.position.Position;
import com.perpclear.clearing.position.PositionBook;
import com.perpclear.clearing.position.PositionKey;
import com.perpclear.clearing.risk.MarketRiskParams;
import com.perpclear.clearing.risk.RiskPrice;
import com.perpclear.clearing.risk.RiskPriceResolver;
import com.perpclear.clearing.tx.EngineTransaction;
import com.perpclear.core.access.AccessControl;
import com.perpclear.core.access.Role;
import com.perpclear.core.exception.CollateralException;
import com.perpclear.core.exception.InsufficientCollateralException;
import com.perpclear.core.exception.PriceUnavailableException;
import com.perpclear.core.exception.RejectReason;
import com.perpclear.core.exception.RiskRejectedException;
import com.perpclear.core.exception.ValidationException;
import com.perpclear.core.exception.VenueException;
import com.perpclear.core.math.Wad;
import com.perpclear.core.time.TimeSource;
import com.perpclear.pricing.FundingUpdate;
import com.perpclear.pricing.SwapResult;
import com.perpclear.pricing.VirtualAmm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Margin, funding and liquidation engine.
 *
 * Owns every position and runs each mutating operation inside an {@link EngineTransaction},
 * so a rejected operation leaves positions, vAMM state, ledger balances and bad-debt totals
 * exactly as they were. Ledger amounts are converted to token units rounding up when the
 * venue collects and down when it pays out.
 *
 * Not thread-safe. {@link ClearingService} serializes all access onto one thread.
 */
public class ClearingHouse {

    private static final Logger log = LoggerFactory.getLogger(ClearingHouse.class);

    private final MarketDirectory markets;
    private final CollateralLedger ledger;
    private final AccessControl access;
    private final TimeSource time;
    private final ClearingJournal journal;
    private final PositionBook book;
    private final RiskPriceResolver priceResolver = new RiskPriceResolver();

    private final Map<String, MarketRiskParams> riskParams = new HashMap<>();
    private final Map<String, BigInteger> badDebt = new HashMap<>();

    private EngineTransaction tx;

    public ClearingHouse(MarketDirectory markets, CollateralLedger ledger, AccessControl access,
                         TimeSource time, ClearingJournal journal, int maxActiveMarkets) {
        this.markets = markets;
        this.ledger = ledger;
        this.access = access;
        this.time = time;
        this.journal = journal;
        this.book = new PositionBook(maxActiveMarkets);
    }

    // ========== Collateral ==========

    public BigInteger deposit(String account, String token, BigInteger amount) throws VenueException {
        requirePositive(amount);
        requireToken(token);
        return transact("deposit", () -> {
            BigInteger deposited = ledger.deposit(account, token, amount);
            tx.onRollback(() -> ledger.settlePnL(account, token, deposited.negate()));
            return deposited;
        });
    }

    /**
     * Withdraw native token units. The remaining balance must still back the margin reserved by
     * positions quoted in the token, and no active position may be liquidatable afterwards.
     */
    public BigInteger withdraw(String account, String token, BigInteger amount) throws VenueException {
        requirePositive(amount);
        TokenConfig config = requireToken(token);
        return transact("withdraw", () -> {
            settleAllFunding(account);

            BigInteger balance = ledger.balanceOf(account, token);
            if (balance.compareTo(amount) < 0) {
                throw new InsufficientCollateralException(String.format(
                        "%s cannot withdraw %s %s, balance is %s", account, amount, token, balance));
            }
            BigInteger remaining = Wad.fromTokenUnits(balance.subtract(amount), config.baseUnit());
            BigInteger reserved = reservedMargin(account, token);
            if (remaining.compareTo(reserved) < 0) {
                throw new RiskRejectedException(String.format(
                        "Withdrawal leaves %s %s against %s reserved margin", Wad.format(remaining),
                        token, Wad.format(reserved)), RejectReason.WITHDRAW_UNBACKED);
            }

            BigInteger withdrawn = ledger.withdraw(account, token, amount);
            tx.onRollback(() -> ledger.settlePnL(account, token, withdrawn));
            requireNothingLiquidatable(account, RejectReason.ACCOUNT_LIQUIDATABLE);
            return withdrawn;
        });
    }

    // ========== Trading ==========

    public TradeResult openPosition(String account, String marketId, boolean isLong,
                                    BigInteger size, BigInteger priceLimit) throws VenueException {
        requirePositive(size);
        MarketInfo market = requireTradableMarket(marketId);
        MarketRiskParams params = requireRiskParams(marketId);
        TokenConfig token = requireToken(market.quoteToken());

        return transact("openPosition", () -> {
            pokeAndSettle(account, market);
            settleAllFunding(account);
            requireNothingLiquidatable(account, RejectReason.ACCOUNT_LIQUIDATABLE);

            Position pos = touch(account, marketId);
            BigInteger signedSize = isLong ? size : size.negate();
            checkSizeBounds(pos.getSize().add(signedSize).abs(), params);

            VirtualAmm amm = touchAmm(market);
            SwapResult swap = isLong ? amm.buy(size, priceLimit) : amm.sell(size, priceLimit);
            return finishTrade(pos, swap, applyTrade(pos, market, params, token, swap, false));
        });
    }

    /**
     * Trade {@code size} against the current side of the position.
     */
    public TradeResult closePosition(String account, String marketId, BigInteger size,
                                     BigInteger priceLimit) throws VenueException {
        requirePositive(size);
        MarketInfo market = requireTradableMarket(marketId);
        MarketRiskParams params = requireRiskParams(marketId);
        TokenConfig token = requireToken(market.quoteToken());

        return transact("closePosition", () -> {
            pokeAndSettle(account, market);
            settleAllFunding(account);

            Position pos = requireOpenPosition(account, marketId);
            if (size.compareTo(pos.absSize()) > 0) {
                throw new ValidationException(String.format("Close size %s exceeds position %s",
                        Wad.format(size), Wad.format(pos.absSize())), RejectReason.CLOSE_EXCEEDS_POSITION);
            }
            requireNothingLiquidatable(account, RejectReason.ACCOUNT_LIQUIDATABLE);
            checkSizeBounds(pos.absSize().subtract(size), params);

            pos = touch(account, marketId);
            VirtualAmm amm = touchAmm(market);
            SwapResult swap = pos.isLong() ? amm.sell(size, priceLimit) : amm.buy(size, priceLimit);
            return finishTrade(pos, swap, applyTrade(pos, market, params, token, swap, false));
        });
    }

    /**
     * Close {@code size} of an under-maintained position and charge the liquidation penalty.
     * Eligibility and the penalty are both evaluated at the risk price observed before the
     * closing trade.
     */
    public LiquidationResult liquidate(String liquidator, String account, String marketId,
                                       BigInteger size, BigInteger priceLimit) throws VenueException {
        requirePositive(size);
        if (liquidator == null || liquidator.equals(account)) {
            throw new ValidationException("Accounts cannot liquidate themselves", RejectReason.SELF_LIQUIDATION);
        }
        MarketInfo market = requireMarket(marketId);
        MarketRiskParams params = requireRiskParams(marketId);
        TokenConfig token = requireToken(market.quoteToken());

        return transact("liquidate", () -> {
            pokeAndSettle(account, market);
            settleAllFunding(account);

            Position pos = requireOpenPosition(account, marketId);
            if (size.compareTo(pos.absSize()) > 0) {
                throw new ValidationException(String.format("Liquidation size %s exceeds position %s",
                        Wad.format(size), Wad.format(pos.absSize())), RejectReason.CLOSE_EXCEEDS_POSITION);
            }
            RiskPrice snapshot = priceResolver.resolve(marketId, market.oracle(), market.amm());
            if (!isLiquidatable(pos, market, params, snapshot.price())) {
                throw new RiskRejectedException(account + " is not liquidatable in " + marketId,
                        RejectReason.NOT_LIQUIDATABLE);
            }
            BigInteger remaining = pos.absSize().subtract(size);
            BigInteger minSize = params.minPositionSize();
            if (remaining.signum() > 0 && minSize.signum() > 0 && remaining.compareTo(minSize) < 0) {
                throw new ValidationException(String.format(
                        "Partial liquidation leaves %s below minimum %s; liquidate the full position",
                        Wad.format(remaining), Wad.format(minSize)), RejectReason.DUST_REMAINDER);
            }

            pos = touch(account, marketId);
            VirtualAmm amm = touchAmm(market);
            SwapResult swap = pos.isLong() ? amm.sell(size, priceLimit) : amm.buy(size, priceLimit);
            Applied applied = applyTrade(pos, market, params, token, swap, true);

            BigInteger penalty = params.penalty(Wad.mulDiv(size, snapshot.price(), Wad.ONE, true));
            BigInteger liquidatorShare = Wad.bps(penalty, params.liquidatorShareBps(), false);
            BigInteger protocolShare = penalty.subtract(liquidatorShare);

            PenaltyShare toLiquidator = settlePenalty(pos, market, token, liquidator, liquidatorShare);
            FeeDistributor router = market.feeRouter();
            PenaltyShare toProtocol = router == null
                    ? PenaltyShare.NONE
                    : settlePenalty(pos, market, token, router.accountId(), protocolShare);
            if (router != null) {
                BigInteger routed = toProtocol.paidUnits();
                if (routed.signum() > 0) {
                    tx.afterCommit(() -> notifyPenalty(router, token.symbol(), routed));
                }
            } else if (protocolShare.signum() > 0) {
                log.warn("{} has no fee router, protocol penalty share {} not collected",
                        marketId, Wad.format(protocolShare));
            }

            BigInteger insured = toLiquidator.insured().add(toProtocol.insured());
            BigInteger uncovered = toLiquidator.badDebt().add(toProtocol.badDebt());
            long now = time.nowSeconds();
            Position after = pos.copy();
            tx.afterCommit(() -> {
                journal.log(new PositionEvent(now, "liquidated", after, swap.baseDelta(),
                        swap.averagePrice(), applied.realizedPnl(), BigInteger.ZERO));
                journal.log(new LiquidationEvent(now, account, marketId, liquidator, size,
                        snapshot.price(), penalty, toLiquidator.paid(), toProtocol.paid(), insured, uncovered));
            });
            log.info("Liquidated {} {} of {} by {} @ {} ({}): penalty={} realized={}", account,
                    Wad.format(size), marketId, liquidator, Wad.format(snapshot.price()), snapshot.source(),
                    Wad.format(penalty), Wad.format(applied.realizedPnl()));

            return new LiquidationResult(account, liquidator, marketId, size, snapshot,
                    swap.averagePrice(), applied.realizedPnl(), penalty, toLiquidator.paid(),
                    toProtocol.paid(), insured, uncovered, after);
        });
    }

    // ========== Margin ==========

    public Position addMargin(String account, String marketId, BigInteger amount) throws VenueException {
        requirePositive(amount);
        MarketInfo market = requireMarket(marketId);
        requireToken(market.quoteToken());
        return transact("addMargin", () -> {
            settleAllFunding(account);
            requireOpenPosition(account, marketId);
            BigInteger free = getFreeCollateral(account, market.quoteToken());
            if (free.compareTo(amount) < 0) {
                throw new InsufficientCollateralException(String.format("%s has %s free collateral, needs %s",
                        account, Wad.format(free), Wad.format(amount)));
            }
            Position pos = touch(account, marketId);
            pos.setMargin(pos.getMargin().add(amount));
            log.info("Margin added: {} {} +{} -> {}", account, marketId, Wad.format(amount), Wad.format(pos.getMargin()));
            return pos.copy();
        });
    }

    public Position removeMargin(String account, String marketId, BigInteger amount) throws VenueException {
        requirePositive(amount);
        MarketInfo market = requireMarket(marketId);
        MarketRiskParams params = requireRiskParams(marketId);
        return transact("removeMargin", () -> {
            settleAllFunding(account);
            Position pos = requireOpenPosition(account, marketId);
            if (amount.compareTo(pos.getMargin()) > 0) {
                throw new InsufficientCollateralException(String.format("Cannot remove %s, position margin is %s",
                        Wad.format(amount), Wad.format(pos.getMargin())));
            }
            pos = touch(account, marketId);
            pos.setMargin(pos.getMargin().subtract(amount));
            RiskPrice risk = priceResolver.resolve(marketId, market.oracle(), market.amm());
            if (isLiquidatable(pos, market, params, risk.price())) {
                throw new RiskRejectedException("Removing margin would breach maintenance in " + marketId,
                        RejectReason.MAINTENANCE_BREACH);
            }
            log.info("Margin removed: {} {} -{} -> {}", account, marketId, Wad.format(amount), Wad.format(pos.getMargin()));
            return pos.copy();
        });
    }

    // ========== Funding ==========

    /**
     * Advance the market's funding index and settle the account's position against it.
     * Returns the signed payment (positive = received).
     */
    public BigInteger settleFunding(String account, String marketId) throws VenueException {
        MarketInfo market = requireMarket(marketId);
        return transact("settleFunding", () -> pokeAndSettle(account, market));
    }

    public FundingUpdate pokeFunding(String marketId) throws VenueException {
        MarketInfo market = requireMarket(marketId);
        return transact("pokeFunding", () -> touchAmm(market).pokeFunding());
    }

    // ========== Administration ==========

    public void setRiskParams(String caller, String marketId, MarketRiskParams params) throws VenueException {
        access.check(caller, Role.RISK_MANAGER);
        requireMarket(marketId);
        params.validate();
        MarketRiskParams previous = riskParams.put(marketId, params);
        log.info("Risk params for {} set by {}: {} (was {})", marketId, caller, params, previous);
    }

    public void resetReserves(String caller, String marketId, BigInteger newPrice, BigInteger newBaseReserve)
            throws VenueException {
        MarketInfo market = requireMarket(marketId);
        transact("resetReserves", () -> {
            touchAmm(market).resetReserves(caller, newPrice, newBaseReserve);
            return null;
        });
    }

    public void setSwapsPaused(String caller, String marketId, boolean paused) throws VenueException {
        MarketInfo market = requireMarket(marketId);
        transact("setSwapsPaused", () -> {
            touchAmm(market).setSwapsPaused(caller, paused);
            return null;
        });
    }

    public void setAmmFeeBps(String caller, String marketId, int feeBps) throws VenueException {
        MarketInfo market = requireMarket(marketId);
        transact("setAmmFeeBps", () -> {
            touchAmm(market).setFeeBps(caller, feeBps);
            return null;
        });
    }

    // ========== Reads ==========

    /** Copy of the position; an empty position when the account never traded the market. */
    public Position getPosition(String account, String marketId) {
        Position pos = book.get(account, marketId);
        return pos == null ? new Position(account, marketId) : pos.copy();
    }

    public List<String> getActiveMarkets(String account) {
        return book.activeMarkets(account);
    }

    /** Absolute notional at the mark price. */
    public BigInteger getNotional(String account, String marketId) throws ValidationException {
        MarketInfo market = requireMarket(marketId);
        Position pos = book.get(account, marketId);
        if (pos == null || !pos.isOpen()) return BigInteger.ZERO;
        return pos.notional(market.amm().getMarkPrice(), false);
    }

    /**
     * Effective margin over notional at the risk price, 1e18 scaled.
     */
    public BigInteger getMarginRatio(String account, String marketId) throws VenueException {
        MarketInfo market = requireMarket(marketId);
        Position pos = requireOpenPosition(account, marketId);
        RiskPrice risk = priceResolver.resolve(marketId, market.oracle(), market.amm());
        BigInteger notional = pos.notional(risk.price(), true);
        if (notional.signum() == 0) {
            throw new PriceUnavailableException("Zero notional for " + account + " in " + marketId);
        }
        return Wad.divDown(effectiveMargin(pos, market, risk.price()), notional);
    }

    public boolean isLiquidatable(String account, String marketId) throws VenueException {
        MarketInfo market = requireMarket(marketId);
        Position pos = book.get(account, marketId);
        if (pos == null || !pos.isOpen()) return false;
        MarketRiskParams params = requireRiskParams(marketId);
        RiskPrice risk = priceResolver.resolve(marketId, market.oracle(), market.amm());
        return isLiquidatable(pos, market, params, risk.price());
    }

    /**
     * Collateral value plus unrealized PnL and pending funding across active markets.
     */
    public BigInteger getAccountValue(String account) throws VenueException {
        BigInteger value = ledger.accountCollateralValue(account);
        for (String marketId : book.activeMarkets(account)) {
            MarketInfo market = requireMarket(marketId);
            Position pos = book.get(account, marketId);
            RiskPrice risk = priceResolver.resolve(marketId, market.oracle(), market.amm());
            value = value.add(pos.unrealizedPnl(risk.price()))
                    .add(pos.pendingFunding(market.amm().getCumulativeFundingPerUnit()));
        }
        return value;
    }

    /**
     * Token balance (as a wad) minus margin reserved by active positions quoted in the token.
     * Negative when rounding or bad debt left the reservation under-backed.
     */
    public BigInteger getFreeCollateral(String account, String token) {
        TokenConfig config = ledger.tokenConfig(token);
        if (config == null) return BigInteger.ZERO;
        BigInteger balance = Wad.fromTokenUnits(ledger.balanceOf(account, token), config.baseUnit());
        return balance.subtract(reservedMargin(account, token));
    }

    public BigInteger getBadDebt(String token) {
        return badDebt.getOrDefault(token, BigInteger.ZERO);
    }

    public Optional<MarketRiskParams> getRiskParams(String marketId) {
        return Optional.ofNullable(riskParams.get(marketId));
    }

    public int getMaxActiveMarkets() {
        return book.getMaxActiveMarkets();
    }

    // ========== Trade application ==========

    private record Applied(TradeKind kind, BigInteger realizedPnl, BigInteger tradeFee) {}

    private Applied applyTrade(Position pos, MarketInfo market, MarketRiskParams params, TokenConfig token,
                               SwapResult swap, boolean liquidation) throws VenueException {
        String account = pos.getAccount();
        BigInteger oldSize = pos.getSize();
        BigInteger delta = swap.baseDelta();
        BigInteger price = swap.averagePrice();
        BigInteger newSize = oldSize.add(delta);
        BigInteger realized = BigInteger.ZERO;
        BigInteger opened;
        TradeKind kind;

        if (oldSize.signum() == 0) {
            kind = TradeKind.OPEN;
            opened = delta.abs();
            book.activate(account, market.marketId());
            pos.setEntryPrice(price);
            pos.setLastFundingIndex(market.amm().getCumulativeFundingPerUnit());
        } else if (oldSize.signum() == delta.signum()) {
            kind = TradeKind.INCREASE;
            opened = delta.abs();
            BigInteger weighted = oldSize.abs().multiply(pos.getEntryPrice()).add(delta.abs().multiply(price));
            pos.setEntryPrice(weighted.divide(newSize.abs()));
        } else {
            BigInteger closed = delta.abs().min(oldSize.abs());
            BigInteger move = oldSize.signum() > 0
                    ? price.subtract(pos.getEntryPrice())
                    : pos.getEntryPrice().subtract(price);
            realized = Wad.mulDiv(move, closed, Wad.ONE, false);
            pos.addRealizedPnl(realized);
            BigInteger release = Wad.mulDiv(pos.getMargin(), closed, oldSize.abs(), false);
            pos.setMargin(pos.getMargin().subtract(release));

            if (newSize.signum() == 0) {
                kind = TradeKind.CLOSE;
                opened = BigInteger.ZERO;
                pos.setEntryPrice(BigInteger.ZERO);
                book.deactivate(account, market.marketId());
            } else if (newSize.signum() != oldSize.signum()) {
                kind = TradeKind.FLIP;
                opened = newSize.abs();
                pos.setEntryPrice(price);
            } else {
                kind = TradeKind.REDUCE;
                opened = BigInteger.ZERO;
            }
        }
        pos.setSize(newSize);

        if (realized.signum() > 0) {
            credit(account, token, realized);
        } else if (realized.signum() < 0) {
            collectLoss(pos, market, token, realized.negate());
        }

        if (liquidation) {
            return new Applied(kind, realized, BigInteger.ZERO);
        }

        // Margin for the newly opened exposure
        if (opened.signum() > 0) {
            BigInteger reserve = params.initialMargin(Wad.mulDiv(opened, price, Wad.ONE, true));
            BigInteger free = getFreeCollateral(account, token.symbol());
            if (free.signum() <= 0 || free.compareTo(reserve) < 0) {
                throw new InsufficientCollateralException(String.format(
                        "%s needs %s initial margin in %s, has %s free", account, Wad.format(reserve),
                        market.marketId(), Wad.format(free)));
            }
            pos.setMargin(pos.getMargin().add(reserve));
        }

        // Realized PnL is net of both the swap fee in the price and the clearing fee
        BigInteger fee = chargeTradeFee(account, market, token, Wad.mulDiv(delta.abs(), price, Wad.ONE, true));
        pos.addRealizedPnl(fee.negate());
        checkPostTrade(pos, market, params, token);
        return new Applied(kind, realized.subtract(fee), fee);
    }

    private BigInteger chargeTradeFee(String account, MarketInfo market, TokenConfig token, BigInteger notional)
            throws VenueException {
        FeeDistributor router = market.feeRouter();
        if (router == null || market.feeBps() <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger fee = Wad.bps(notional, market.feeBps(), true);
        if (fee.signum() <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger free = getFreeCollateral(account, token.symbol());
        if (free.compareTo(fee) < 0) {
            throw new InsufficientCollateralException(String.format("%s cannot pay trade fee %s, has %s free",
                    account, Wad.format(fee), Wad.format(free)));
        }
        BigInteger units = transfer(account, router.accountId(), token, fee);
        tx.afterCommit(() -> notifyTradeFee(router, token.symbol(), units));
        return fee;
    }

    /**
     * Initial margin at the less favourable of mark and risk price, topped up from free
     * collateral when short; then the position must not be liquidatable at the risk price.
     */
    private void checkPostTrade(Position pos, MarketInfo market, MarketRiskParams params, TokenConfig token)
            throws VenueException {
        if (!pos.isOpen()) return;
        RiskPrice risk = priceResolver.resolve(market.marketId(), market.oracle(), market.amm());
        BigInteger checkPrice = Wad.max(market.amm().getMarkPrice(), risk.price());
        BigInteger required = params.initialMargin(pos.notional(checkPrice, true));

        if (pos.getMargin().compareTo(required) < 0) {
            BigInteger topUp = required.subtract(pos.getMargin());
            BigInteger free = getFreeCollateral(pos.getAccount(), token.symbol());
            if (free.compareTo(topUp) < 0) {
                throw new RiskRejectedException(String.format(
                        "Initial margin %s not met in %s: margin %s, free %s", Wad.format(required),
                        market.marketId(), Wad.format(pos.getMargin()), Wad.format(free)), RejectReason.IMR_BREACH);
            }
            pos.setMargin(required);
        }

        if (isLiquidatable(pos, market, params, risk.price())) {
            throw new RiskRejectedException("Position would be liquidatable immediately in " + market.marketId(),
                    RejectReason.WOULD_BE_LIQUIDATABLE);
        }
    }

    /**
     * Realized loss: free collateral first, then the position's remaining margin, then bad debt.
     */
    private void collectLoss(Position pos, MarketInfo market, TokenConfig token, BigInteger loss)
            throws VenueException {
        String account = pos.getAccount();
        BigInteger fromFree = loss.min(available(account, token.symbol()));
        BigInteger fromMargin = loss.subtract(fromFree).min(pos.getMargin());
        pos.setMargin(pos.getMargin().subtract(fromMargin));
        debit(account, token, fromFree.add(fromMargin));
        BigInteger shortfall = loss.subtract(fromFree).subtract(fromMargin);
        if (shortfall.signum() > 0) {
            recordBadDebt(account, market, token, shortfall, BadDebtEvent.Source.TRADE_LOSS);
        }
    }

    private TradeResult finishTrade(Position pos, SwapResult swap, Applied applied) {
        long now = time.nowSeconds();
        Position after = pos.copy();
        tx.afterCommit(() -> journal.log(new PositionEvent(now, applied.kind().action(), after,
                swap.baseDelta(), swap.averagePrice(), applied.realizedPnl(), applied.tradeFee())));
        log.info("{} {} {} {} @ {}: size={} margin={} realized={}", applied.kind(), pos.getAccount(),
                pos.getMarketId(), Wad.format(swap.baseDelta()), Wad.format(swap.averagePrice()),
                Wad.format(pos.getSize()), Wad.format(pos.getMargin()), Wad.format(applied.realizedPnl()));
        return new TradeResult(pos.getAccount(), pos.getMarketId(), applied.kind(), swap.baseDelta(),
                swap.averagePrice(), applied.realizedPnl(), swap.fee(), applied.tradeFee(), after);
    }

    // ========== Liquidation penalty ==========

    private record PenaltyShare(BigInteger paid, BigInteger paidUnits, BigInteger insured, BigInteger badDebt) {
        static final PenaltyShare NONE =
                new PenaltyShare(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
    }

    /**
     * Pay one share of the penalty to {@code recipient}: remaining margin, then free collateral,
     * then the insurance fund up to its balance. What is left becomes bad debt.
     */
    private PenaltyShare settlePenalty(Position pos, MarketInfo market, TokenConfig token, String recipient,
                                       BigInteger amount) throws VenueException {
        if (amount.signum() <= 0) {
            return PenaltyShare.NONE;
        }
        String account = pos.getAccount();
        BigInteger free = available(account, token.symbol());
        BigInteger fromMargin = amount.min(pos.getMargin());
        BigInteger fromFree = amount.subtract(fromMargin).min(free);
        pos.setMargin(pos.getMargin().subtract(fromMargin));
        BigInteger fromAccount = fromMargin.add(fromFree);
        BigInteger units = transfer(account, recipient, token, fromAccount);

        BigInteger remaining = amount.subtract(fromAccount);
        BigInteger insuredUnits = BigInteger.ZERO;
        BigInteger insured = BigInteger.ZERO;
        if (remaining.signum() > 0) {
            insuredUnits = insurancePayout(market, recipient, token, remaining);
            insured = Wad.fromTokenUnits(insuredUnits, token.baseUnit()).min(remaining);
        }
        BigInteger shortfall = remaining.subtract(insured);
        if (shortfall.signum() > 0) {
            recordBadDebt(account, market, token, shortfall, BadDebtEvent.Source.LIQUIDATION_PENALTY);
        }
        return new PenaltyShare(fromAccount.add(insured), units.add(insuredUnits), insured, shortfall);
    }

    // ========== Funding internals ==========

    private void settleAllFunding(String account) throws VenueException {
        for (String marketId : book.activeMarkets(account)) {
            pokeAndSettle(account, requireMarket(marketId));
        }
    }

    private BigInteger pokeAndSettle(String account, MarketInfo market) throws VenueException {
        touchAmm(market).pokeFunding();
        return settlePositionFunding(account, market);
    }

    /**
     * Credit goes to margin and the ledger. Debit drains margin, then free collateral in the same
     * quote token, then becomes bad debt.
     */
    private BigInteger settlePositionFunding(String account, MarketInfo market) throws VenueException {
        String marketId = market.marketId();
        Position existing = book.get(account, marketId);
        BigInteger index = market.amm().getCumulativeFundingPerUnit();
        if (existing == null || index.equals(existing.getLastFundingIndex())) {
            return BigInteger.ZERO;
        }
        Position pos = touch(account, marketId);
        BigInteger payment = pos.pendingFunding(index);
        pos.setLastFundingIndex(index);
        if (payment.signum() == 0) {
            return BigInteger.ZERO;
        }

        TokenConfig token = requireToken(market.quoteToken());
        BigInteger collected;
        if (payment.signum() > 0) {
            pos.setMargin(pos.getMargin().add(payment));
            credit(account, token, payment);
            collected = payment;
        } else {
            BigInteger owed = payment.negate();
            BigInteger free = available(account, token.symbol());
            BigInteger fromMargin = owed.min(pos.getMargin());
            BigInteger fromFree = owed.subtract(fromMargin).min(free);
            pos.setMargin(pos.getMargin().subtract(fromMargin));
            debit(account, token, fromMargin.add(fromFree));
            collected = fromMargin.add(fromFree).negate();
            BigInteger shortfall = owed.subtract(fromMargin).subtract(fromFree);
            if (shortfall.signum() > 0) {
                recordBadDebt(account, market, token, shortfall, BadDebtEvent.Source.FUNDING);
            }
        }

        long now = time.nowSeconds();
        BigInteger settled = collected;
        tx.afterCommit(() -> journal.log(new FundingEvent(now, account, marketId, payment, settled, index)));
        log.debug("Funding settled: {} {} payment={} index={}", account, marketId,
                Wad.format(payment), Wad.format(index));
        return payment;
    }

    // ========== Risk helpers ==========

    private BigInteger effectiveMargin(Position pos, MarketInfo market, BigInteger price) {
        return pos.getMargin()
                .add(pos.pendingFunding(market.amm().getCumulativeFundingPerUnit()))
                .add(pos.unrealizedPnl(price));
    }

    private boolean isLiquidatable(Position pos, MarketInfo market, MarketRiskParams params, BigInteger riskPrice) {
        if (!pos.isOpen()) return false;
        BigInteger maintenance = params.maintenanceMargin(pos.notional(riskPrice, true));
        return effectiveMargin(pos, market, riskPrice).compareTo(maintenance) < 0;
    }

    private void requireNothingLiquidatable(String account, RejectReason reason) throws VenueException {
        for (String marketId : book.activeMarkets(account)) {
            MarketInfo market = requireMarket(marketId);
            MarketRiskParams params = requireRiskParams(marketId);
            Position pos = book.get(account, marketId);
            RiskPrice risk = priceResolver.resolve(marketId, market.oracle(), market.amm());
            if (isLiquidatable(pos, market, params, risk.price())) {
                throw new RiskRejectedException(String.format("%s is liquidatable in %s at %s (%s)",
                        account, marketId, Wad.format(risk.price()), risk.source()), reason);
            }
        }
    }

    private BigInteger reservedMargin(String account, String token) {
        BigInteger reserved = BigInteger.ZERO;
        for (String marketId : book.activeMarkets(account)) {
            Optional<MarketInfo> market = markets.getMarket(marketId);
            if (market.isPresent() && token.equals(market.get().quoteToken())) {
                reserved = reserved.add(book.get(account, marketId).getMargin());
            }
        }
        return reserved;
    }

    private BigInteger available(String account, String token) {
        return Wad.max(getFreeCollateral(account, token), BigInteger.ZERO);
    }

    private void checkSizeBounds(BigInteger absSize, MarketRiskParams params) throws ValidationException {
        if (absSize.signum() == 0) return;
        BigInteger max = params.maxPositionSize();
        BigInteger min = params.minPositionSize();
        if (max.signum() > 0 && absSize.compareTo(max) > 0) {
            throw new ValidationException(String.format("Position size %s above maximum %s",
                    Wad.format(absSize), Wad.format(max)), RejectReason.SIZE_ABOVE_MAX);
        }
        if (min.signum() > 0 && absSize.compareTo(min) < 0) {
            throw new ValidationException(String.format("Position size %s below minimum %s",
                    Wad.format(absSize), Wad.format(min)), RejectReason.SIZE_BELOW_MIN);
        }
    }

    // ========== Ledger movements (each registers its compensation) ==========

    private BigInteger credit(String account, TokenConfig token, BigInteger wad) throws CollateralException {
        BigInteger units = Wad.toTokenUnits(wad, token.baseUnit(), false);
        if (units.signum() <= 0) return BigInteger.ZERO;
        ledger.settlePnL(account, token.symbol(), units);
        tx.onRollback(() -> ledger.settlePnL(account, token.symbol(), units.negate()));
        return units;
    }

    private BigInteger debit(String account, TokenConfig token, BigInteger wad) throws CollateralException {
        if (wad.signum() <= 0) return BigInteger.ZERO;
        BigInteger units = Wad.toTokenUnits(wad, token.baseUnit(), true)
                .min(ledger.balanceOf(account, token.symbol()));
        if (units.signum() <= 0) return BigInteger.ZERO;
        ledger.settlePnL(account, token.symbol(), units.negate());
        tx.onRollback(() -> ledger.settlePnL(account, token.symbol(), units));
        return units;
    }

    private BigInteger transfer(String from, String to, TokenConfig token, BigInteger wad) throws CollateralException {
        if (wad.signum() <= 0) return BigInteger.ZERO;
        BigInteger units = Wad.toTokenUnits(wad, token.baseUnit(), true)
                .min(ledger.balanceOf(from, token.symbol()));
        if (units.signum() <= 0) return BigInteger.ZERO;
        ledger.seize(from, to, token.symbol(), units);
        tx.onRollback(() -> ledger.seize(to, from, token.symbol(), units));
        return units;
    }

    /**
     * Insurance coverage in token units. A failing fund counts as no coverage.
     */
    private BigInteger insurancePayout(MarketInfo market, String to, TokenConfig token, BigInteger wad) {
        InsuranceFund fund = market.insuranceFund();
        if (fund == null) return BigInteger.ZERO;
        BigInteger requested = Wad.toTokenUnits(wad, token.baseUnit(), true);
        BigInteger paid;
        try {
            paid = fund.payout(to, token.symbol(), requested);
        } catch (CollateralException | RuntimeException e) {
            log.warn("Insurance payout of {} {} to {} failed: {}", requested, token.symbol(), to, e.getMessage());
            return BigInteger.ZERO;
        }
        if (paid == null || paid.signum() <= 0) return BigInteger.ZERO;
        tx.onRollback(() -> ledger.seize(to, fund.accountId(), token.symbol(), paid));
        return paid;
    }

    private void recordBadDebt(String account, MarketInfo market, TokenConfig token, BigInteger amount,
                               BadDebtEvent.Source source) {
        String symbol = token.symbol();
        BigInteger before = badDebt.getOrDefault(symbol, BigInteger.ZERO);
        badDebt.put(symbol, before.add(amount));
        tx.onRollback(() -> badDebt.put(symbol, before));
        long now = time.nowSeconds();
        tx.afterCommit(() -> {
            log.warn("Bad debt: {} {} {} {} ({})", account, market.marketId(), Wad.format(amount), symbol, source);
            journal.log(new BadDebtEvent(now, account, market.marketId(), symbol, amount, source));
        });
    }

    private void notifyTradeFee(FeeDistributor router, String token, BigInteger units) {
        try {
            router.onTradeFee(token, units);
        } catch (CollateralException e) {
            log.warn("Fee router rejected trade fee {} {}: {}", units, token, e.getMessage());
        }
    }

    private void notifyPenalty(FeeDistributor router, String token, BigInteger units) {
        try {
            router.onLiquidationPenalty(token, units);
        } catch (CollateralException e) {
            log.warn("Fee router rejected liquidation penalty {} {}: {}", units, token, e.getMessage());
        }
    }

    // ========== Transaction plumbing ==========

    @FunctionalInterface
    private interface TxBody<T> {
        T run() throws VenueException;
    }

    private record ActiveSetKey(String account) {}

    private <T> T transact(String operation, TxBody<T> body) throws VenueException {
        if (tx != null) {
            throw new IllegalStateException(operation + " started inside " + tx.getOperation());
        }
        EngineTransaction current = new EngineTransaction(operation);
        tx = current;
        try {
            T result = body.run();
            tx = null;
            current.commit();
            return result;
        } catch (VenueException e) {
            tx = null;
            current.rollback();
            log.info("{} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            tx = null;
            current.rollback();
            log.error("{} failed", operation, e);
            throw e;
        }
    }

    private Position touch(String account, String marketId) {
        PositionKey key = new PositionKey(account, marketId);
        if (tx.firstTouch(key)) {
            Position before = book.snapshot(key);
            tx.onRollback(() -> book.restore(key, before));
        }
        ActiveSetKey activeKey = new ActiveSetKey(account);
        if (tx.firstTouch(activeKey)) {
            Set<String> before = book.snapshotActive(account);
            tx.onRollback(() -> book.restoreActive(account, before));
        }
        return book.getOrCreate(account, marketId);
    }

    private VirtualAmm touchAmm(MarketInfo market) {
        VirtualAmm amm = market.amm();
        if (tx.firstTouch(amm)) {
            VirtualAmm.Snapshot snapshot = amm.snapshot();
            tx.onRollback(() -> amm.restore(snapshot));
        }
        return amm;
    }

    // ========== Validation ==========

    private MarketInfo requireMarket(String marketId) throws ValidationException {
        return markets.getMarket(marketId).orElseThrow(() ->
                new ValidationException("Unknown market: " + marketId, RejectReason.UNKNOWN_MARKET));
    }

    private MarketInfo requireTradableMarket(String marketId) throws ValidationException {
        MarketInfo market = requireMarket(marketId);
        if (!markets.isActive(marketId) || market.paused()) {
            throw new ValidationException("Market not active: " + marketId, RejectReason.MARKET_INACTIVE);
        }
        return market;
    }

    private MarketRiskParams requireRiskParams(String marketId) throws ValidationException {
        MarketRiskParams params = riskParams.get(marketId);
        if (params == null || params.mmrBps() <= 0) {
            throw new ValidationException("Risk parameters not set for " + marketId, RejectReason.RISK_PARAMS_NOT_SET);
        }
        return params;
    }

    private TokenConfig requireToken(String token) throws ValidationException {
        TokenConfig config = ledger.tokenConfig(token);
        if (config == null) {
            throw new ValidationException("Unknown collateral token: " + token, RejectReason.UNKNOWN_TOKEN);
        }
        return config;
    }

    private Position requireOpenPosition(String account, String marketId) throws ValidationException {
        Position pos = book.get(account, marketId);
        if (pos == null || !pos.isOpen()) {
            throw new ValidationException(account + " has no position in " + marketId, RejectReason.NO_POSITION);
        }
        return pos;
    }

    private static void requirePositive(BigInteger amount) throws ValidationException {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be positive", RejectReason.ZERO_AMOUNT);
        }
    }
}
