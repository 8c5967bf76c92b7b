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

import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.Bid;
import io.nosqlbench.auctionsim.model.SimulationResult;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Derives [Statistics] from a finished simulation and renders them as a text report.
///
/// Stateless; one instance can analyze any number of results.
public class ResultAnalyzer {

    public Statistics analyze(SimulationResult result) {
        List<AuctionResult> results = result.auctionResults();

        int[] bidCounts = results.stream().mapToInt(AuctionResult::totalBids).sorted().toArray();
        double averageBids = 0.0d;
        double medianBids = 0.0d;
        double stdDevBids = 0.0d;
        int minBids = 0;
        int maxBids = 0;
        if (bidCounts.length > 0) {
            averageBids = Arrays.stream(bidCounts).average().orElse(0.0d);
            medianBids = median(Arrays.stream(bidCounts).asDoubleStream().toArray());
            minBids = bidCounts[0];
            maxBids = bidCounts[bidCounts.length - 1];
            double variance = 0.0d;
            for (int count : bidCounts) {
                double diff = count - averageBids;
                variance += diff * diff;
            }
            stdDevBids = Math.sqrt(variance / bidCounts.length);
        }

        double[] amounts = results.stream()
            .map(AuctionResult::winningBid)
            .filter(Objects::nonNull)
            .mapToDouble(Bid::amount)
            .sorted()
            .toArray();
        double totalRevenue = Arrays.stream(amounts).sum();
        double averageWin = 0.0d;
        double medianWin = 0.0d;
        double minWin = 0.0d;
        double maxWin = 0.0d;
        if (amounts.length > 0) {
            averageWin = totalRevenue / amounts.length;
            medianWin = median(amounts);
            minWin = amounts[0];
            maxWin = amounts[amounts.length - 1];
        }

        // sorted by bidder id so ties resolve to the lowest id
        Map<Integer, Integer> wins = new TreeMap<>();
        for (AuctionResult auction : results) {
            auction.winner().ifPresent(bid -> wins.merge(bid.bidderId(), 1, Integer::sum));
        }
        int topBidder = 0;
        int topWins = 0;
        for (Map.Entry<Integer, Integer> entry : wins.entrySet()) {
            if (entry.getValue() > topWins) {
                topBidder = entry.getKey();
                topWins = entry.getValue();
            }
        }

        double seconds = result.totalDuration().toNanos() / 1_000_000_000.0d;
        double bidsPerSecond = seconds > 0 ? result.totalBids() / seconds : 0.0d;
        double auctionsPerSecond = seconds > 0 ? result.totalAuctions() / seconds : 0.0d;
        double successRate = result.totalAuctions() > 0
            ? (double) result.successfulAuctions() / result.totalAuctions() * 100.0d
            : 0.0d;

        return new Statistics(
            result.totalBids(),
            averageBids,
            medianBids,
            minBids,
            maxBids,
            stdDevBids,
            totalRevenue,
            averageWin,
            medianWin,
            minWin,
            maxWin,
            wins.size(),
            topBidder,
            topWins,
            bidsPerSecond,
            auctionsPerSecond,
            successRate,
            result.successfulAuctions(),
            result.failedAuctions()
        );
    }

    /// Median of an already sorted, non-empty array.
    static double median(double[] sorted) {
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0d;
        }
        return sorted[mid];
    }

    public String formatReport(Statistics stats) {
        StringBuilder sb = new StringBuilder();
        sb.append("\nDETAILED STATISTICS\n");
        sb.append("=".repeat(56)).append("\n\n");

        sb.append("Bid Statistics:\n");
        sb.append(String.format(Locale.ROOT, "   |- Total Bids: %d%n", stats.totalBids()));
        sb.append(String.format(Locale.ROOT, "   |- Average per Auction: %.1f%n", stats.averageBids()));
        sb.append(String.format(Locale.ROOT, "   |- Median: %.1f%n", stats.medianBids()));
        sb.append(String.format(Locale.ROOT, "   |- Min/Max: %d / %d%n", stats.minBids(), stats.maxBids()));
        sb.append(String.format(Locale.ROOT, "   `- Std Deviation: %.2f%n%n", stats.stdDevBids()));

        if (stats.totalRevenue() > 0) {
            sb.append("Revenue Statistics:\n");
            sb.append(String.format(Locale.ROOT, "   |- Total Revenue: $%.2f%n", stats.totalRevenue()));
            sb.append(String.format(Locale.ROOT, "   |- Average Win: $%.2f%n", stats.averageWinAmount()));
            sb.append(String.format(Locale.ROOT, "   |- Median Win: $%.2f%n", stats.medianWinAmount()));
            sb.append(String.format(Locale.ROOT, "   `- Min/Max: $%.2f / $%.2f%n%n",
                stats.minWinAmount(), stats.maxWinAmount()));
        }

        sb.append("Bidder Statistics:\n");
        sb.append(String.format(Locale.ROOT, "   |- Unique Winners: %d%n", stats.uniqueWinners()));
        if (stats.hasWinners()) {
            sb.append(String.format(Locale.ROOT, "   `- Top Bidder: #%d (%d wins)%n%n",
                stats.mostSuccessfulBidder(), stats.mostSuccessfulWins()));
        } else {
            sb.append("   `- No winners\n\n");
        }

        sb.append("Performance Metrics:\n");
        sb.append(String.format(Locale.ROOT, "   |- Bids/Second: %.1f%n", stats.bidsPerSecond()));
        sb.append(String.format(Locale.ROOT, "   |- Auctions/Second: %.2f%n", stats.auctionsPerSecond()));
        sb.append(String.format(Locale.ROOT, "   `- Success Rate: %.1f%%%n%n", stats.successRate()));

        return sb.toString();
    }
}
