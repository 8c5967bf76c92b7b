package io.nosqlbench.auctionsim.command.common;

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

import io.nosqlbench.auctionsim.config.SimulationConfig;
import picocli.CommandLine;

/**
 * Shared simulation parameters. Every option is optional and, when given, overrides the
 * corresponding value of the loaded configuration.
 */
public class SimulationOptions {

    @CommandLine.Option(names = {"-a", "--auctions"}, description = "Number of concurrent auctions")
    private Integer auctions;

    @CommandLine.Option(names = {"-b", "--bidders"}, description = "Number of bidders")
    private Integer bidders;

    @CommandLine.Option(names = {"-t", "--timeout-ms"}, description = "Auction timeout in milliseconds")
    private Long timeoutMs;

    @CommandLine.Option(names = {"--probability"}, description = "Probability that a bidder bids on an auction (0..1)")
    private Double probability;

    @CommandLine.Option(names = {"--min-multiplier"}, description = "Minimum bid as a multiple of the base price")
    private Double minMultiplier;

    @CommandLine.Option(names = {"--max-multiplier"}, description = "Maximum bid as a multiple of the base price")
    private Double maxMultiplier;

    @CommandLine.Option(names = {"--min-delay-ms"}, description = "Minimum bidder think time in milliseconds")
    private Integer minDelayMs;

    @CommandLine.Option(names = {"--max-delay-ms"}, description = "Maximum bidder think time in milliseconds")
    private Integer maxDelayMs;

    @CommandLine.Option(names = {"--bidder-threads"},
        description = "Cap on bidder pairing threads (0 = one thread per pairing)")
    private Integer bidderThreads;

    @CommandLine.Option(names = {"--warmup-ms"}, description = "Delay between starting auctions and releasing bidders")
    private Long warmupMs;

    @CommandLine.Option(names = {"--no-profile"}, description = "Disable resource monitoring")
    private boolean noProfile = false;

    /**
     * Overlays every given option onto the configuration.
     *
     * @param config the configuration to update
     * @return the same configuration
     */
    public SimulationConfig applyTo(SimulationConfig config) {
        SimulationConfig.AuctionSettings auction = config.getAuction();
        SimulationConfig.BidderSettings bidder = config.getBidder();
        SimulationConfig.SystemSettings system = config.getSystem();

        if (auctions != null) {
            auction.setTotalAuctions(auctions);
        }
        if (timeoutMs != null) {
            auction.setTimeoutMs(timeoutMs);
        }
        if (bidders != null) {
            bidder.setTotalBidders(bidders);
        }
        if (probability != null) {
            bidder.setBidProbability(probability);
        }
        if (minMultiplier != null) {
            bidder.setMinBidMultiplier(minMultiplier);
        }
        if (maxMultiplier != null) {
            bidder.setMaxBidMultiplier(maxMultiplier);
        }
        if (minDelayMs != null) {
            bidder.setBidDelayMinMs(minDelayMs);
        }
        if (maxDelayMs != null) {
            bidder.setBidDelayMaxMs(maxDelayMs);
        }
        if (bidderThreads != null) {
            system.setBidderThreads(bidderThreads);
        }
        if (warmupMs != null) {
            system.setWarmupMs(warmupMs);
        }
        if (noProfile) {
            system.setEnableProfiling(false);
        }
        return config;
    }
}
