package com.perpclear.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Venue configuration loaded from YAML. Prices and sizes are decimal strings in human units
 * ("2000", "0.5") and are converted to 1e18 fixed point by the bootstrap.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VenueConfig {

    private String admin = "admin";
    private EngineConfig engine = new EngineConfig();
    private List<TokenConfigEntry> tokens = new ArrayList<>();
    private List<MarketConfig> markets = new ArrayList<>();
    private FeeRouterConfig feeRouter = new FeeRouterConfig();
    private InsuranceConfig insurance = new InsuranceConfig();

    public String getAdmin() { return admin; }
    public void setAdmin(String admin) { this.admin = admin; }

    public EngineConfig getEngine() { return engine; }
    public void setEngine(EngineConfig engine) { this.engine = engine; }

    public List<TokenConfigEntry> getTokens() { return tokens; }
    public void setTokens(List<TokenConfigEntry> tokens) { this.tokens = tokens; }

    public List<MarketConfig> getMarkets() { return markets; }
    public void setMarkets(List<MarketConfig> markets) { this.markets = markets; }

    public FeeRouterConfig getFeeRouter() { return feeRouter; }
    public void setFeeRouter(FeeRouterConfig feeRouter) { this.feeRouter = feeRouter; }

    public InsuranceConfig getInsurance() { return insurance; }
    public void setInsurance(InsuranceConfig insurance) { this.insurance = insurance; }

    public static VenueConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new VenueConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), VenueConfig.class);
    }

    public static VenueConfig load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(in, VenueConfig.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return Path.of(System.getProperty("user.home"), ".perpclear", "venue.yaml");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EngineConfig {
        private int maxActiveMarkets = 16;
        private String journalDir;   // null = no on-disk journal

        public int getMaxActiveMarkets() { return maxActiveMarkets; }
        public void setMaxActiveMarkets(int v) { this.maxActiveMarkets = v; }

        public String getJournalDir() { return journalDir; }
        public void setJournalDir(String journalDir) { this.journalDir = journalDir; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TokenConfigEntry {
        private String symbol;
        private int decimals = 18;
        private boolean enabled = true;

        public String getSymbol() { return symbol; }
        public void setSymbol(String symbol) { this.symbol = symbol; }

        public int getDecimals() { return decimals; }
        public void setDecimals(int decimals) { this.decimals = decimals; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarketConfig {
        private String id;
        private String baseToken;
        private String quoteToken;
        private int feeBps = 10;
        private boolean paused;
        private AmmConfig amm = new AmmConfig();
        private RiskConfig risk = new RiskConfig();
        private OracleConfig oracle = new OracleConfig();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getBaseToken() { return baseToken; }
        public void setBaseToken(String baseToken) { this.baseToken = baseToken; }

        public String getQuoteToken() { return quoteToken; }
        public void setQuoteToken(String quoteToken) { this.quoteToken = quoteToken; }

        public int getFeeBps() { return feeBps; }
        public void setFeeBps(int feeBps) { this.feeBps = feeBps; }

        public boolean isPaused() { return paused; }
        public void setPaused(boolean paused) { this.paused = paused; }

        public AmmConfig getAmm() { return amm; }
        public void setAmm(AmmConfig amm) { this.amm = amm; }

        public RiskConfig getRisk() { return risk; }
        public void setRisk(RiskConfig risk) { this.risk = risk; }

        public OracleConfig getOracle() { return oracle; }
        public void setOracle(OracleConfig oracle) { this.oracle = oracle; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AmmConfig {
        private String initialPrice = "2000";
        private String baseReserve = "1000";
        private int feeBps = 10;
        private int frMaxBpsPerHour = 100;
        private String fundingK = "1";
        private long observationWindow = 900;
        private int observationCardinality = 64;
        private String minReserveBase = "1";
        private String minReserveQuote = "1";

        public String getInitialPrice() { return initialPrice; }
        public void setInitialPrice(String v) { this.initialPrice = v; }

        public String getBaseReserve() { return baseReserve; }
        public void setBaseReserve(String v) { this.baseReserve = v; }

        public int getFeeBps() { return feeBps; }
        public void setFeeBps(int v) { this.feeBps = v; }

        public int getFrMaxBpsPerHour() { return frMaxBpsPerHour; }
        public void setFrMaxBpsPerHour(int v) { this.frMaxBpsPerHour = v; }

        public String getFundingK() { return fundingK; }
        public void setFundingK(String v) { this.fundingK = v; }

        public long getObservationWindow() { return observationWindow; }
        public void setObservationWindow(long v) { this.observationWindow = v; }

        public int getObservationCardinality() { return observationCardinality; }
        public void setObservationCardinality(int v) { this.observationCardinality = v; }

        public String getMinReserveBase() { return minReserveBase; }
        public void setMinReserveBase(String v) { this.minReserveBase = v; }

        public String getMinReserveQuote() { return minReserveQuote; }
        public void setMinReserveQuote(String v) { this.minReserveQuote = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RiskConfig {
        private int imrBps = 1000;
        private int mmrBps = 500;
        private int liquidationPenaltyBps = 250;
        private String penaltyCap = "0";
        private int liquidatorShareBps = 5000;
        private String maxPositionSize = "0";
        private String minPositionSize = "0";

        public int getImrBps() { return imrBps; }
        public void setImrBps(int v) { this.imrBps = v; }

        public int getMmrBps() { return mmrBps; }
        public void setMmrBps(int v) { this.mmrBps = v; }

        public int getLiquidationPenaltyBps() { return liquidationPenaltyBps; }
        public void setLiquidationPenaltyBps(int v) { this.liquidationPenaltyBps = v; }

        public String getPenaltyCap() { return penaltyCap; }
        public void setPenaltyCap(String v) { this.penaltyCap = v; }

        public int getLiquidatorShareBps() { return liquidatorShareBps; }
        public void setLiquidatorShareBps(int v) { this.liquidatorShareBps = v; }

        public String getMaxPositionSize() { return maxPositionSize; }
        public void setMaxPositionSize(String v) { this.maxPositionSize = v; }

        public String getMinPositionSize() { return minPositionSize; }
        public void setMinPositionSize(String v) { this.minPositionSize = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OracleConfig {
        private String price;   // null = use the AMM initial price

        public String getPrice() { return price; }
        public void setPrice(String price) { this.price = price; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeeRouterConfig {
        private String account = "fee-router";
        private String treasuryAccount = "treasury";
        private int insuranceShareBps = 5000;

        public String getAccount() { return account; }
        public void setAccount(String account) { this.account = account; }

        public String getTreasuryAccount() { return treasuryAccount; }
        public void setTreasuryAccount(String v) { this.treasuryAccount = v; }

        public int getInsuranceShareBps() { return insuranceShareBps; }
        public void setInsuranceShareBps(int v) { this.insuranceShareBps = v; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InsuranceConfig {
        private String account = "insurance-fund";
        private String initialBalance = "0";

        public String getAccount() { return account; }
        public void setAccount(String account) { this.account = account; }

        public String getInitialBalance() { return initialBalance; }
        public void setInitialBalance(String v) { this.initialBalance = v; }
    }
}
