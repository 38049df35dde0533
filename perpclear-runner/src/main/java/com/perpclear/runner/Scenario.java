package com.perpclear.runner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Scripted sequence of venue operations loaded from YAML. Amounts, sizes and prices are human
 * decimals; {@code expect} names the rejection a step should produce (empty = must succeed).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Scenario {

    private String name = "scenario";
    private long startTime = 1_700_000_000L;
    private List<Step> steps = new ArrayList<>();

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getStartTime() { return startTime; }
    public void setStartTime(long startTime) { this.startTime = startTime; }

    public List<Step> getSteps() { return steps; }
    public void setSteps(List<Step> steps) { this.steps = steps; }

    public static Scenario load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), Scenario.class);
    }

    public static Scenario load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(in, Scenario.class);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Step {
        private String action;
        private String account;
        private String market;
        private String token;
        private String amount;
        private String size;
        private String side;          // long | short
        private String price;
        private String priceLimit;
        private String liquidator;
        private String caller;
        private long seconds;
        private String expect;

        public String getAction() { return action; }
        public void setAction(String action) { this.action = action; }

        public String getAccount() { return account; }
        public void setAccount(String account) { this.account = account; }

        public String getMarket() { return market; }
        public void setMarket(String market) { this.market = market; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getAmount() { return amount; }
        public void setAmount(String amount) { this.amount = amount; }

        public String getSize() { return size; }
        public void setSize(String size) { this.size = size; }

        public String getSide() { return side; }
        public void setSide(String side) { this.side = side; }

        public String getPrice() { return price; }
        public void setPrice(String price) { this.price = price; }

        public String getPriceLimit() { return priceLimit; }
        public void setPriceLimit(String priceLimit) { this.priceLimit = priceLimit; }

        public String getLiquidator() { return liquidator; }
        public void setLiquidator(String liquidator) { this.liquidator = liquidator; }

        public String getCaller() { return caller; }
        public void setCaller(String caller) { this.caller = caller; }

        public long getSeconds() { return seconds; }
        public void setSeconds(long seconds) { this.seconds = seconds; }

        public String getExpect() { return expect; }
        public void setExpect(String expect) { this.expect = expect; }

        @Override
        public String toString() {
            return action + (account != null ? " " + account : "") + (market != null ? " " + market : "");
        }
    }
}
