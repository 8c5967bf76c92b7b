package io.nosqlbench.auctionsim.report;

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
import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.ResourceUsage;
import io.nosqlbench.auctionsim.model.SimulationResult;
import io.nosqlbench.auctionsim.stats.Statistics;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/// Console rendering of a simulation run: banner, configuration echo, results, resource
/// utilization, export outcomes and a closing summary.
///
/// All output goes to the stream given at construction, so commands can redirect it.
public class ConsoleReport {

    static final int TOP_AUCTIONS = 5;
    private static final String RULE = "=".repeat(60);
    private static final DateTimeFormatter CLOCK_TIME =
        DateTimeFormatter.ofPattern("HH:mm:ss.SSS", Locale.ROOT).withZone(ZoneId.systemDefault());

    private final PrintStream out;

    public ConsoleReport(PrintStream out) {
        this.out = out;
    }

    public void printBanner() {
        out.println();
        out.println(RULE);
        out.println("          CONCURRENT AUCTION SIMULATOR");
        out.println(RULE);
        out.println();
    }

    /// Echoes the effective configuration, with the number of concurrent tasks the run will
    /// schedule: one per auction plus one per bidder and auction pairing.
    public void printConfiguration(SimulationConfig config) {
        SimulationConfig.AuctionSettings auction = config.getAuction();
        SimulationConfig.BidderSettings bidder = config.getBidder();
        SimulationConfig.SystemSettings system = config.getSystem();
        long expectedTasks = expectedTasks(config);

        out.println("Configuration");
        out.println(RULE);
        out.printf(Locale.ROOT, "  Concurrent Auctions:    %d%n", auction.getTotalAuctions());
        out.printf(Locale.ROOT, "  Total Bidders:          %d%n", bidder.getTotalBidders());
        out.printf(Locale.ROOT, "  Auction Timeout:        %d ms%n", auction.getTimeoutMs());
        out.printf(Locale.ROOT, "  Bid Probability:        %.1f%%%n", bidder.getBidProbability() * 100.0d);
        out.printf(Locale.ROOT, "  Bid Multiplier:         %.2f - %.2f%n",
            bidder.getMinBidMultiplier(), bidder.getMaxBidMultiplier());
        out.printf(Locale.ROOT, "  Think Time:             %d - %d ms%n",
            bidder.getBidDelayMinMs(), bidder.getBidDelayMaxMs());
        out.printf(Locale.ROOT, "  CPU Cores Available:    %d%n", Runtime.getRuntime().availableProcessors());
        out.printf(Locale.ROOT, "  Bidder Threads:         %s%n",
            system.getBidderThreads() == 0 ? "unbounded" : Integer.toString(system.getBidderThreads()));
        out.printf(Locale.ROOT, "  Seed:                   %s%n",
            system.getSeed() != null ? system.getSeed().toString() : "random");
        out.printf(Locale.ROOT, "  Expected Tasks:         ~%d%n", expectedTasks);
        out.println();
    }

    static long expectedTasks(SimulationConfig config) {
        long auctions = config.getAuction().getTotalAuctions();
        return auctions + (long) config.getBidder().getTotalBidders() * auctions;
    }

    public void printResults(SimulationResult result) {
        out.println();
        out.println(RULE);
        out.println("SIMULATION RESULTS");
        out.println(RULE);

        out.println();
        out.println("Timing:");
        out.printf(Locale.ROOT, "   |- Start:      %s%n", clock(result.startTime()));
        out.printf(Locale.ROOT, "   |- End:        %s%n", clock(result.endTime()));
        out.printf(Locale.ROOT, "   `- Duration:   %s%n", formatDuration(result.totalDuration()));

        out.println();
        out.println("Auction Summary:");
        out.printf(Locale.ROOT, "   |- Total:      %d%n", result.totalAuctions());
        out.printf(Locale.ROOT, "   |- Successful: %d (%.1f%%)%n", result.successfulAuctions(),
            percent(result.successfulAuctions(), result.totalAuctions()));
        out.printf(Locale.ROOT, "   `- Failed:     %d%n", result.failedAuctions());

        out.println();
        out.println("Bidding Activity:");
        out.printf(Locale.ROOT, "   |- Total Bids:       %d%n", result.totalBids());
        out.printf(Locale.ROOT, "   `- Avg per Auction:  %.1f%n",
            result.totalAuctions() > 0 ? (double) result.totalBids() / result.totalAuctions() : 0.0d);

        out.println();
        out.printf(Locale.ROOT, "Top %d Most Popular Auctions:%n", TOP_AUCTIONS);
        List<AuctionResult> top = topAuctions(result.auctionResults(), TOP_AUCTIONS);
        for (int i = 0; i < top.size(); i++) {
            AuctionResult auction = top.get(i);
            String winner = auction.winner()
                .map(bid -> String.format(Locale.ROOT, "Bidder #%d - $%.2f", bid.bidderId(), bid.amount()))
                .orElse("No winner");
            out.printf(Locale.ROOT, "   %d. Auction #%-3d: %3d bids -> %s%n",
                i + 1, auction.auctionId(), auction.totalBids(), winner);
        }
    }

    /// Auctions ordered by bid count, most first; equal counts keep ascending auction id.
    static List<AuctionResult> topAuctions(List<AuctionResult> results, int limit) {
        return results.stream()
            .sorted(Comparator.comparingInt(AuctionResult::totalBids).reversed()
                .thenComparingInt(AuctionResult::auctionId))
            .limit(limit)
            .collect(Collectors.toList());
    }

    public void printWinners(Statistics stats) {
        out.println();
        out.println("Winners:");
        out.printf(Locale.ROOT, "   |- Unique Winners:  %d%n", stats.uniqueWinners());
        out.printf(Locale.ROOT, "   |- Total Revenue:   $%.2f%n", stats.totalRevenue());
        out.printf(Locale.ROOT, "   `- Avg Win Amount:  $%.2f%n", stats.averageWinAmount());
        if (stats.mostSuccessfulWins() > 1) {
            out.printf(Locale.ROOT, "%n   Top Winner: Bidder #%d (%d auctions won)%n",
                stats.mostSuccessfulBidder(), stats.mostSuccessfulWins());
        }
    }

    public void printStatistics(String statisticsReport) {
        out.println(statisticsReport);
    }

    public void printResourceUsage(ResourceUsage usage, SimulationResult result) {
        out.println();
        out.println(RULE);
        out.println("RESOURCE UTILIZATION");
        out.println(RULE);

        out.println();
        out.println("Memory:");
        out.printf(Locale.ROOT, "   |- Initial:        %.2f MB%n", usage.initialMemoryMb());
        out.printf(Locale.ROOT, "   |- Final:          %.2f MB%n", usage.finalMemoryMb());
        out.printf(Locale.ROOT, "   |- Peak:           %.2f MB%n", usage.peakMemoryMb());
        out.printf(Locale.ROOT, "   |- Average:        %.2f MB%n", usage.averageMemoryMb());
        out.printf(Locale.ROOT, "   `- Delta:          %+.2f MB%n", usage.memoryDeltaMb());

        out.println();
        out.println("CPU & Concurrency:");
        out.printf(Locale.ROOT, "   |- CPUs Available:     %d%n", usage.cpuCount());
        out.printf(Locale.ROOT, "   `- Peak Threads:       %d%n", usage.peakThreads());

        double seconds = seconds(result.totalDuration());
        out.println();
        out.println("Efficiency:");
        out.printf(Locale.ROOT, "   |- Memory/Thread:      %.3f MB%n",
            usage.peakThreads() > 0 ? usage.peakMemoryMb() / usage.peakThreads() : 0.0d);
        out.printf(Locale.ROOT, "   |- Bids/Second:        %.1f%n", seconds > 0 ? result.totalBids() / seconds : 0.0d);
        out.printf(Locale.ROOT, "   `- Auctions/Second:    %.2f%n",
            seconds > 0 ? result.totalAuctions() / seconds : 0.0d);
    }

    public void printExportHeader() {
        out.println();
        out.println("Exporting Results");
        out.println(RULE);
    }

    public void printExported(String label, Path path) {
        out.printf(Locale.ROOT, "   + %s exported: %s%n", label, path);
    }

    public void printExportFailed(String label, Exception error) {
        out.printf(Locale.ROOT, "   x %s export failed: %s%n", label, error.getMessage());
    }

    /// Closing summary. The output directory line is omitted when nothing was exported.
    public void printFinalSummary(SimulationResult result, Statistics stats, Path outputDir) {
        out.println();
        out.println(RULE);
        out.println("FINAL SUMMARY");
        out.println(RULE);

        out.println();
        out.println("Performance:");
        out.printf(Locale.ROOT, "   |- Total Time:           %s%n", formatDuration(result.totalDuration()));
        out.printf(Locale.ROOT, "   |- Bids/Second:          %.1f%n", stats.bidsPerSecond());
        out.printf(Locale.ROOT, "   |- Success Rate:         %.1f%%%n", stats.successRate());
        result.resources().ifPresent(usage -> {
            out.printf(Locale.ROOT, "   |- Peak Memory:          %.2f MB%n", usage.peakMemoryMb());
            out.printf(Locale.ROOT, "   |- Peak Threads:         %d%n", usage.peakThreads());
        });
        out.printf(Locale.ROOT, "   `- Auctions:             %d%n", result.totalAuctions());

        out.println();
        out.println("Simulation completed successfully!");
        if (outputDir != null) {
            out.printf(Locale.ROOT, "Results saved to %s%n", outputDir);
        }
        out.println();
    }

    private static String clock(Instant instant) {
        return CLOCK_TIME.format(instant);
    }

    static String formatDuration(Duration duration) {
        return String.format(Locale.ROOT, "%.3fs", seconds(duration));
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0d;
    }

    private static double percent(int part, int whole) {
        return whole > 0 ? (double) part / whole * 100.0d : 0.0d;
    }
}
