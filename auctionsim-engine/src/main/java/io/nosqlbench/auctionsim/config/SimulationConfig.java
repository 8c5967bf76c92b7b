package io.nosqlbench.auctionsim.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * JSON-serializable configuration for one simulation run.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "auction": {
 *     "total_auctions": 40,
 *     "timeout_ms": 10000,
 *     "minimum_bid_increment": 1.0
 *   },
 *   "bidder": {
 *     "total_bidders": 100,
 *     "bid_probability": 0.3,
 *     "min_bid_multiplier": 1.0,
 *     "max_bid_multiplier": 2.5,
 *     "bid_delay_min_ms": 100,
 *     "bid_delay_max_ms": 2000
 *   },
 *   "system": {
 *     "bidder_threads": 0,
 *     "enable_profiling": true,
 *     "log_level": "info",
 *     "seed": null,
 *     "warmup_ms": 50
 *   }
 * }
 * }</pre>
 *
 * <p>Every field is optional. Missing sections and fields keep their defaults, so an empty
 * object is a valid configuration.</p>
 *
 * <p>The engine assumes the configuration it is given has already passed {@link #validate()};
 * it performs no validation of its own. A configuration must not be modified once a run has
 * started with it.</p>
 */
public class SimulationConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .create();

    /** Log levels accepted by {@code system.log_level}. */
    public static final Set<String> LOG_LEVELS = Set.of("trace", "debug", "info", "warn", "error");

    @SerializedName("auction")
    private AuctionSettings auction = new AuctionSettings();

    @SerializedName("bidder")
    private BidderSettings bidder = new BidderSettings();

    @SerializedName("system")
    private SystemSettings system = new SystemSettings();

    /**
     * Settings for the auctions themselves.
     */
    public static class AuctionSettings {
        @SerializedName("total_auctions")
        private int totalAuctions = 40;

        @SerializedName("timeout_ms")
        private long timeoutMs = 10_000L;

        /** Reported with the configuration; sealed-bid auctions do not enforce it. */
        @SerializedName("minimum_bid_increment")
        private double minimumBidIncrement = 1.0d;

        public int getTotalAuctions() {
            return totalAuctions;
        }

        public AuctionSettings setTotalAuctions(int totalAuctions) {
            this.totalAuctions = totalAuctions;
            return this;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public AuctionSettings setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Duration getTimeout() {
            return Duration.ofMillis(timeoutMs);
        }

        public double getMinimumBidIncrement() {
            return minimumBidIncrement;
        }

        public AuctionSettings setMinimumBidIncrement(double minimumBidIncrement) {
            this.minimumBidIncrement = minimumBidIncrement;
            return this;
        }
    }

    /**
     * Settings shared by every bidder in the pool.
     */
    public static class BidderSettings {
        @SerializedName("total_bidders")
        private int totalBidders = 100;

        @SerializedName("bid_probability")
        private double bidProbability = 0.3d;

        @SerializedName("min_bid_multiplier")
        private double minBidMultiplier = 1.0d;

        @SerializedName("max_bid_multiplier")
        private double maxBidMultiplier = 2.5d;

        @SerializedName("bid_delay_min_ms")
        private int bidDelayMinMs = 100;

        @SerializedName("bid_delay_max_ms")
        private int bidDelayMaxMs = 2000;

        public int getTotalBidders() {
            return totalBidders;
        }

        public BidderSettings setTotalBidders(int totalBidders) {
            this.totalBidders = totalBidders;
            return this;
        }

        public double getBidProbability() {
            return bidProbability;
        }

        public BidderSettings setBidProbability(double bidProbability) {
            this.bidProbability = bidProbability;
            return this;
        }

        public double getMinBidMultiplier() {
            return minBidMultiplier;
        }

        public BidderSettings setMinBidMultiplier(double minBidMultiplier) {
            this.minBidMultiplier = minBidMultiplier;
            return this;
        }

        public double getMaxBidMultiplier() {
            return maxBidMultiplier;
        }

        public BidderSettings setMaxBidMultiplier(double maxBidMultiplier) {
            this.maxBidMultiplier = maxBidMultiplier;
            return this;
        }

        public int getBidDelayMinMs() {
            return bidDelayMinMs;
        }

        public BidderSettings setBidDelayMinMs(int bidDelayMinMs) {
            this.bidDelayMinMs = bidDelayMinMs;
            return this;
        }

        public int getBidDelayMaxMs() {
            return bidDelayMaxMs;
        }

        public BidderSettings setBidDelayMaxMs(int bidDelayMaxMs) {
            this.bidDelayMaxMs = bidDelayMaxMs;
            return this;
        }
    }

    /**
     * Process-level settings: threading, profiling, logging and reproducibility.
     */
    public static class SystemSettings {
        /** 0 runs every bidder pairing on its own thread; N caps the pairing executor at N. */
        @SerializedName("bidder_threads")
        private int bidderThreads = 0;

        @SerializedName("enable_profiling")
        private boolean enableProfiling = true;

        @SerializedName("log_level")
        private String logLevel = "info";

        /** Fixed seed for every random source, or null for a fresh seed per run. */
        @SerializedName("seed")
        private Long seed;

        @SerializedName("warmup_ms")
        private long warmupMs = 50L;

        public int getBidderThreads() {
            return bidderThreads;
        }

        public SystemSettings setBidderThreads(int bidderThreads) {
            this.bidderThreads = bidderThreads;
            return this;
        }

        public boolean isEnableProfiling() {
            return enableProfiling;
        }

        public SystemSettings setEnableProfiling(boolean enableProfiling) {
            this.enableProfiling = enableProfiling;
            return this;
        }

        public String getLogLevel() {
            return logLevel;
        }

        public SystemSettings setLogLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Long getSeed() {
            return seed;
        }

        public SystemSettings setSeed(Long seed) {
            this.seed = seed;
            return this;
        }

        public long getWarmupMs() {
            return warmupMs;
        }

        public SystemSettings setWarmupMs(long warmupMs) {
            this.warmupMs = warmupMs;
            return this;
        }

        public Duration getWarmup() {
            return Duration.ofMillis(warmupMs);
        }
    }

    public SimulationConfig() {
    }

    /**
     * @return a configuration holding only default values
     */
    public static SimulationConfig defaults() {
        return new SimulationConfig();
    }

    public AuctionSettings getAuction() {
        return auction;
    }

    public BidderSettings getBidder() {
        return bidder;
    }

    public SystemSettings getSystem() {
        return system;
    }

    /**
     * Checks every constraint and reports all violations at once.
     *
     * @return this configuration, for chaining
     * @throws InvalidConfigurationException if any constraint is violated
     */
    public SimulationConfig validate() {
        List<String> violations = new ArrayList<>();
        if (auction == null || bidder == null || system == null) {
            violations.add("auction, bidder and system sections must not be null");
            throw new InvalidConfigurationException(violations);
        }

        if (auction.totalAuctions <= 0) {
            violations.add("total auctions must be positive");
        }
        if (auction.timeoutMs <= 0) {
            violations.add("auction timeout must be positive");
        }

        if (bidder.totalBidders <= 0) {
            violations.add("total bidders must be positive");
        }
        if (!(bidder.bidProbability >= 0.0d && bidder.bidProbability <= 1.0d)) {
            violations.add("bid probability must be between 0 and 1");
        }
        if (!(bidder.minBidMultiplier > 0.0d)) {
            violations.add("minimum bid multiplier must be positive");
        }
        if (!(bidder.maxBidMultiplier >= bidder.minBidMultiplier)) {
            violations.add("maximum bid multiplier must not be less than the minimum");
        }
        if (bidder.bidDelayMinMs < 0) {
            violations.add("minimum bid delay must not be negative");
        }
        if (bidder.bidDelayMaxMs < bidder.bidDelayMinMs) {
            violations.add("maximum bid delay must not be less than the minimum");
        }

        if (system.bidderThreads < 0) {
            violations.add("bidder threads must not be negative");
        }
        if (system.warmupMs < 0) {
            violations.add("warmup must not be negative");
        }
        if (system.logLevel == null || !LOG_LEVELS.contains(system.logLevel.toLowerCase(Locale.ROOT))) {
            violations.add("log level must be one of " + LOG_LEVELS);
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
        return this;
    }

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON text
     * @return the parsed configuration, defaults filled in
     * @throws JsonParseException if the text is not valid JSON for this schema
     */
    public static SimulationConfig fromJson(String json) {
        SimulationConfig config = GSON.fromJson(json, SimulationConfig.class);
        return config != null ? config : defaults();
    }

    public static SimulationConfig fromJson(Reader reader) {
        SimulationConfig config = GSON.fromJson(reader, SimulationConfig.class);
        return config != null ? config : defaults();
    }

    /**
     * Loads a configuration file.
     *
     * @param path path of a JSON configuration file
     * @return the parsed configuration
     * @throws IOException if the file cannot be read
     */
    public static SimulationConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return "SimulationConfig{auctions=" + auction.totalAuctions
            + ", timeout=" + auction.timeoutMs + "ms"
            + ", bidders=" + bidder.totalBidders
            + ", p=" + bidder.bidProbability
            + ", multiplier=[" + bidder.minBidMultiplier + "," + bidder.maxBidMultiplier + "]"
            + ", delay=[" + bidder.bidDelayMinMs + "," + bidder.bidDelayMaxMs + "]ms"
            + ", bidderThreads=" + system.bidderThreads
            + ", seed=" + system.seed + "}";
    }
}
