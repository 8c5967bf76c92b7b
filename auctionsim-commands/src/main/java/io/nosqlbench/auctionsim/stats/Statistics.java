package io.nosqlbench.auctionsim.stats;

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

/**
 * Summary statistics derived from one {@link io.nosqlbench.auctionsim.model.SimulationResult}.
 *
 * @param totalBids            bids received across all auctions
 * @param averageBids          mean bids per auction
 * @param medianBids           median bids per auction
 * @param minBids              fewest bids any auction received
 * @param maxBids              most bids any auction received
 * @param stdDevBids           population standard deviation of bids per auction
 * @param totalRevenue         sum of winning amounts
 * @param averageWinAmount     mean winning amount
 * @param medianWinAmount      median winning amount
 * @param minWinAmount         smallest winning amount
 * @param maxWinAmount         largest winning amount
 * @param uniqueWinners        distinct bidders that won at least one auction
 * @param mostSuccessfulBidder bidder with the most wins, lowest id on ties; 0 when nobody won
 * @param mostSuccessfulWins   wins of {@code mostSuccessfulBidder}
 * @param bidsPerSecond        bids over the total run duration
 * @param auctionsPerSecond    auctions over the total run duration
 * @param successRate          successful auctions as a percentage of all auctions
 * @param auctionsSuccessful   auctions that completed with a winner
 * @param auctionsFailed       every other auction
 */
public record Statistics(
    int totalBids,
    double averageBids,
    double medianBids,
    int minBids,
    int maxBids,
    double stdDevBids,
    double totalRevenue,
    double averageWinAmount,
    double medianWinAmount,
    double minWinAmount,
    double maxWinAmount,
    int uniqueWinners,
    int mostSuccessfulBidder,
    int mostSuccessfulWins,
    double bidsPerSecond,
    double auctionsPerSecond,
    double successRate,
    int auctionsSuccessful,
    int auctionsFailed
) {

    public boolean hasWinners() {
        return uniqueWinners > 0;
    }
}
