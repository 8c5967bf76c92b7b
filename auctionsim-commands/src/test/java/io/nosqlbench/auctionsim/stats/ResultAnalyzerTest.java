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

import io.nosqlbench.auctionsim.model.AuctionItem;
import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.Bid;
import io.nosqlbench.auctionsim.model.SimulationResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResultAnalyzerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private static AuctionResult auction(int id, int bids, Integer winner, double amount) {
        AuctionItem item = AuctionItem.of(id, "Item " + id, 100.0);
        Optional<Bid> winning = winner == null
            ? Optional.empty()
            : Optional.of(new Bid(winner, id, amount, START.plusMillis(id)));
        return AuctionResult.of(id, item, bids, winning, START, START.plusMillis(500));
    }

    private static SimulationResult simulation(Duration duration, AuctionResult... results) {
        List<AuctionResult> list = List.of(results);
        int successful = (int) list.stream().filter(AuctionResult::isSuccessful).count();
        int bids = list.stream().mapToInt(AuctionResult::totalBids).sum();
        return new SimulationResult(list.size(), duration, START, START.plus(duration), list,
            successful, list.size() - successful, bids, null);
    }

    @Test
    void testBidAndRevenueStatistics() {
        SimulationResult result = simulation(Duration.ofSeconds(2),
            auction(1, 3, 7, 150.0),
            auction(2, 0, null, 0.0),
            auction(3, 5, 4, 300.0),
            auction(4, 2, 7, 120.0));

        Statistics stats = new ResultAnalyzer().analyze(result);

        assertThat(stats.totalBids()).isEqualTo(10);
        assertThat(stats.averageBids()).isCloseTo(2.5, within(1e-9));
        assertThat(stats.medianBids()).isCloseTo(2.5, within(1e-9));
        assertThat(stats.minBids()).isZero();
        assertThat(stats.maxBids()).isEqualTo(5);
        assertThat(stats.stdDevBids()).isCloseTo(Math.sqrt(3.25), within(1e-9));

        assertThat(stats.totalRevenue()).isCloseTo(570.0, within(1e-9));
        assertThat(stats.averageWinAmount()).isCloseTo(190.0, within(1e-9));
        assertThat(stats.medianWinAmount()).isCloseTo(150.0, within(1e-9));
        assertThat(stats.minWinAmount()).isCloseTo(120.0, within(1e-9));
        assertThat(stats.maxWinAmount()).isCloseTo(300.0, within(1e-9));

        assertThat(stats.uniqueWinners()).isEqualTo(2);
        assertThat(stats.mostSuccessfulBidder()).isEqualTo(7);
        assertThat(stats.mostSuccessfulWins()).isEqualTo(2);

        assertThat(stats.bidsPerSecond()).isCloseTo(5.0, within(1e-9));
        assertThat(stats.auctionsPerSecond()).isCloseTo(2.0, within(1e-9));
        assertThat(stats.successRate()).isCloseTo(75.0, within(1e-9));
        assertThat(stats.auctionsSuccessful()).isEqualTo(3);
        assertThat(stats.auctionsFailed()).isEqualTo(1);
    }

    @Test
    void testTopBidderTieGoesToLowestId() {
        SimulationResult result = simulation(Duration.ofSeconds(1),
            auction(1, 1, 9, 110.0),
            auction(2, 1, 3, 120.0),
            auction(3, 2, 9, 130.0),
            auction(4, 2, 3, 140.0));

        Statistics stats = new ResultAnalyzer().analyze(result);
        assertThat(stats.mostSuccessfulBidder()).isEqualTo(3);
        assertThat(stats.mostSuccessfulWins()).isEqualTo(2);
    }

    @Test
    void testNoAuctionsYieldsZeros() {
        SimulationResult result = simulation(Duration.ZERO);
        Statistics stats = new ResultAnalyzer().analyze(result);

        assertThat(stats.totalBids()).isZero();
        assertThat(stats.averageBids()).isZero();
        assertThat(stats.totalRevenue()).isZero();
        assertThat(stats.bidsPerSecond()).isZero();
        assertThat(stats.successRate()).isZero();
        assertThat(stats.hasWinners()).isFalse();
        assertThat(stats.mostSuccessfulBidder()).isZero();
    }

    @Test
    void testMedianOfOddAndEvenArrays() {
        assertThat(ResultAnalyzer.median(new double[]{1.0, 2.0, 9.0})).isEqualTo(2.0);
        assertThat(ResultAnalyzer.median(new double[]{1.0, 2.0, 4.0, 9.0})).isEqualTo(3.0);
    }

    @Test
    void testReportWithWinners() {
        SimulationResult result = simulation(Duration.ofSeconds(2),
            auction(1, 3, 7, 150.0),
            auction(2, 4, 7, 250.0));
        ResultAnalyzer analyzer = new ResultAnalyzer();
        String report = analyzer.formatReport(analyzer.analyze(result));

        assertThat(report).contains("DETAILED STATISTICS");
        assertThat(report).contains("Total Bids: 7");
        assertThat(report).contains("Total Revenue: $400.00");
        assertThat(report).contains("Top Bidder: #7 (2 wins)");
        assertThat(report).contains("Success Rate: 100.0%");
    }

    @Test
    void testReportWithoutWinnersOmitsRevenue() {
        SimulationResult result = simulation(Duration.ofSeconds(1), auction(1, 0, null, 0.0));
        ResultAnalyzer analyzer = new ResultAnalyzer();
        String report = analyzer.formatReport(analyzer.analyze(result));

        assertThat(report).doesNotContain("Revenue Statistics");
        assertThat(report).contains("No winners");
        assertThat(report).contains("Success Rate: 0.0%");
    }
}
