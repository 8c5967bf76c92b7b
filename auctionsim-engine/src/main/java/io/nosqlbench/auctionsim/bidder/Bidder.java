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
import io.nosqlbench.auctionsim.model.Bid;
import io.nosqlbench.auctionsim.scope.Deadline;
import io.nosqlbench.auctionsim.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/// A simulated bidder. For each auction it is paired with, it decides whether it is interested,
/// thinks for a while, and then submits at most one sealed bid, giving up as soon as the
/// pairing's window closes.
///
/// A bidder holds no mutable state. Every pairing draws from its own generator, derived from
/// the bidder's seed and the auction id, so concurrent pairings of the same bidder never share
/// a random source and a seeded run makes the same decisions every time.
public class Bidder {

    private static final Logger logger = LogManager.getLogger(Bidder.class);

    private final int id;
    private final BidderSettings settings;
    private final long seed;

    /// @param id       bidder id, unique within a pool
    /// @param settings shared bidder settings, already validated
    /// @param seed     this bidder's base seed
    public Bidder(int id, BidderSettings settings, long seed) {
        this.id = id;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.seed = seed;
    }

    /// @return a generator owned by the pairing of this bidder with `auctionId`
    public UniformRandomProvider randomFor(int auctionId) {
        return RandomGenerators.create(RandomGenerators.mix(seed, auctionId));
    }

    /// Interest draw: succeeds with the configured bid probability.
    public boolean decideIfBid(AuctionItem item, UniformRandomProvider rng) {
        return rng.nextDouble() < settings.getBidProbability();
    }

    /// Think time, uniform over the configured inclusive millisecond range.
    public Duration thinkTime(UniformRandomProvider rng) {
        return Duration.ofMillis(
            RandomGenerators.uniformInt(rng, settings.getBidDelayMinMs(), settings.getBidDelayMaxMs()));
    }

    /// Bid amount, uniform over `[basePrice * minMultiplier, basePrice * maxMultiplier]`.
    public double bidAmount(AuctionItem item, UniformRandomProvider rng) {
        double multiplier = RandomGenerators.uniformDouble(rng,
            settings.getMinBidMultiplier(), settings.getMaxBidMultiplier());
        return item.basePrice() * multiplier;
    }

    /// Runs the participation protocol against one auction.
    ///
    /// The window is checked while thinking and once more right after, so a window that closed
    /// between the end of the delay and the check still cancels the bid. The hand-off to the
    /// auction gives up when the window closes rather than blocking on a full buffer.
    ///
    /// If the calling thread is interrupted, the pairing is abandoned and the interrupt flag is
    /// left set.
    ///
    /// @param auction the auction to bid on
    /// @param window  the pairing's cancellation scope, no longer-lived than the auction's own
    /// @return how the pairing ended
    public ParticipationOutcome participate(Auction auction, Deadline window) {
        UniformRandomProvider rng = randomFor(auction.getId());
        AuctionItem item = auction.getItem();

        if (!decideIfBid(item, rng)) {
            return ParticipationOutcome.NOT_INTERESTED;
        }

        Duration delay = thinkTime(rng);
        try {
            if (window.await(delay.toNanos(), TimeUnit.NANOSECONDS) || window.isDone()) {
                logger.trace("Bidder {} abandoned auction #{} while thinking", id, auction.getId());
                return ParticipationOutcome.ABANDONED_THINKING;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Bidder {} interrupted while thinking about auction #{}", id, auction.getId());
            return ParticipationOutcome.ABANDONED_THINKING;
        }

        Bid bid = new Bid(id, auction.getId(), bidAmount(item, rng), Instant.now());
        try {
            if (auction.submit(bid, window)) {
                logger.trace("Bidder {} bid {} on auction #{}", id, bid.amount(), auction.getId());
                return ParticipationOutcome.SUBMITTED;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Bidder {} interrupted while bidding on auction #{}", id, auction.getId());
        }
        logger.trace("Bidder {} abandoned auction #{} while sending", id, auction.getId());
        return ParticipationOutcome.ABANDONED_SENDING;
    }

    public int getId() {
        return id;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "Bidder{id=" + id + "}";
    }
}
