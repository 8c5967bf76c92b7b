package io.nosqlbench.auctionsim.bidder;

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

import io.nosqlbench.auctionsim.auction.Auction;
import io.nosqlbench.auctionsim.config.SimulationConfig.BidderSettings;
import io.nosqlbench.auctionsim.model.AuctionItem;
import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.Bid;
import io.nosqlbench.auctionsim.scope.Deadline;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class BidderTest {

    private static final AuctionItem ITEM = AuctionItem.of(1, "Test Item", 200.0);

    private static BidderSettings settings(double probability, int minDelayMs, int maxDelayMs) {
        return new BidderSettings()
            .setBidProbability(probability)
            .setMinBidMultiplier(1.0)
            .setMaxBidMultiplier(2.5)
            .setBidDelayMinMs(minDelayMs)
            .setBidDelayMaxMs(maxDelayMs);
    }

    @Test
    void testProbabilityZeroNeverBids() {
        Bidder bidder = new Bidder(1, settings(0.0, 0, 0), 5L);
        Auction auction = new Auction(1, ITEM, Duration.ofMillis(50));
        try (Deadline window = Deadline.after(Duration.ofMillis(50))) {
            assertEquals(ParticipationOutcome.NOT_INTERESTED, bidder.participate(auction, window));
        }
        assertThat(auction.run().totalBids()).isZero();
    }

    @Test
    void testProbabilityOneAlwaysDecidesToBid() {
        Bidder bidder = new Bidder(1, settings(1.0, 0, 0), 5L);
        UniformRandomProvider rng = bidder.randomFor(1);
        for (int i = 0; i < 100; i++) {
            assertThat(bidder.decideIfBid(ITEM, rng)).isTrue();
        }
    }

    @Test
    void testThinkTimeWithinInclusiveRange() {
        Bidder bidder = new Bidder(1, settings(1.0, 10, 12), 5L);
        UniformRandomProvider rng = bidder.randomFor(1);
        for (int i = 0; i < 500; i++) {
            assertThat(bidder.thinkTime(rng)).isBetween(Duration.ofMillis(10), Duration.ofMillis(12));
        }
    }

    @Test
    void testBidAmountScalesBasePrice() {
        Bidder bidder = new Bidder(1, settings(1.0, 0, 0), 5L);
        UniformRandomProvider rng = bidder.randomFor(1);
        for (int i = 0; i < 500; i++) {
            assertThat(bidder.bidAmount(ITEM, rng)).isBetween(200.0, 500.0);
        }
    }

    @Test
    void testPairingDecisionsAreReproducible() {
        Bidder a = new Bidder(3, settings(0.5, 0, 100), 77L);
        Bidder b = new Bidder(3, settings(0.5, 0, 100), 77L);
        UniformRandomProvider rngA = a.randomFor(9);
        UniformRandomProvider rngB = b.randomFor(9);
        for (int i = 0; i < 20; i++) {
            assertEquals(a.decideIfBid(ITEM, rngA), b.decideIfBid(ITEM, rngB));
            assertEquals(a.bidAmount(ITEM, rngA), b.bidAmount(ITEM, rngB));
        }
    }

    @Test
    void testSubmitsExactlyOneBid() {
        Bidder bidder = new Bidder(4, settings(1.0, 0, 5), 5L);
        Auction auction = new Auction(1, ITEM, Duration.ofMillis(100));
        try (Deadline window = Deadline.after(Duration.ofSeconds(5))) {
            assertEquals(ParticipationOutcome.SUBMITTED, bidder.participate(auction, window));
        }

        AuctionResult result = auction.run();
        List<Bid> bids = auction.getAllBids();
        assertThat(bids).hasSize(1);
        assertThat(bids.get(0).bidderId()).isEqualTo(4);
        assertThat(bids.get(0).amount()).isBetween(200.0, 500.0);
        assertThat(result.winningBid()).isEqualTo(bids.get(0));
    }

    @Test
    void testAbandonsWhenWindowClosesWhileThinking() {
        Bidder bidder = new Bidder(1, settings(1.0, 5_000, 5_000), 5L);
        Auction auction = new Auction(1, ITEM, Duration.ofMillis(50));
        long start = System.nanoTime();
        try (Deadline window = Deadline.after(Duration.ofMillis(50))) {
            assertEquals(ParticipationOutcome.ABANDONED_THINKING, bidder.participate(auction, window));
        }
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
        assertThat(auction.run().totalBids()).isZero();
    }

    @Test
    void testAbandonsWhenWindowAlreadyClosed() {
        Bidder bidder = new Bidder(1, settings(1.0, 0, 0), 5L);
        Auction auction = new Auction(1, ITEM, Duration.ofMillis(50));
        Deadline window = Deadline.unbounded();
        window.cancel();
        assertEquals(ParticipationOutcome.ABANDONED_THINKING, bidder.participate(auction, window));
    }

    @Test
    void testAbandonsWhenBufferStaysFull() {
        Bidder bidder = new Bidder(2, settings(1.0, 0, 0), 5L);
        Auction auction = new Auction(1, ITEM, Duration.ofMillis(50), 1);
        auction.submit(new Bid(1, 1, 150.0, Instant.now()));
        try (Deadline window = Deadline.after(Duration.ofMillis(40))) {
            assertEquals(ParticipationOutcome.ABANDONED_SENDING, bidder.participate(auction, window));
        }
    }

    @Test
    void testAbandonsOnInterrupt() {
        Bidder bidder = new Bidder(1, settings(1.0, 5_000, 5_000), 5L);
        Auction auction = new Auction(1, ITEM, Duration.ofMillis(50));
        Thread.currentThread().interrupt();
        try (Deadline window = Deadline.after(Duration.ofSeconds(10))) {
            assertEquals(ParticipationOutcome.ABANDONED_THINKING, bidder.participate(auction, window));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
