package io.nosqlbench.auctionsim.model;

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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregate over every {@link AuctionResult} of one simulation run. Built once, after every
 * auction has resolved; consumed by statistics, reporting and export.
 *
 * @param totalAuctions      number of auctions in the run
 * @param totalDuration      {@code endTime - startTime} as recorded by the manager
 * @param startTime          when the manager launched the first auction
 * @param endTime            when the manager observed the last task finish
 * @param auctionResults     per-auction results, in completion order
 * @param successfulAuctions auctions that completed with a winner
 * @param failedAuctions     every other auction
 * @param totalBids          sum of {@link AuctionResult#totalBids()} over all results
 * @param resourceUsage      resource usage attached by the caller, or null
 */
public record SimulationResult(
    int totalAuctions,
    Duration totalDuration,
    Instant startTime,
    Instant endTime,
    List<AuctionResult> auctionResults,
    int successfulAuctions,
    int failedAuctions,
    int totalBids,
    ResourceUsage resourceUsage
) {

    public SimulationResult {
        Objects.requireNonNull(totalDuration, "totalDuration");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        auctionResults = List.copyOf(auctionResults);
    }

    /**
     * Returns a copy of this result with the given resource usage attached.
     *
     * @param usage sampled resource usage
     * @return a new result carrying {@code usage}
     */
    public SimulationResult withResourceUsage(ResourceUsage usage) {
        return new SimulationResult(totalAuctions, totalDuration, startTime, endTime, auctionResults,
            successfulAuctions, failedAuctions, totalBids, usage);
    }

    public Optional<ResourceUsage> resources() {
        return Optional.ofNullable(resourceUsage);
    }
}
