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
import io.nosqlbench.auctionsim.scope.Deadline;
import io.nosqlbench.auctionsim.util.RandomGenerators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Fans every bidder out against every auction.
 *
 * <p>Each (bidder, auction) pairing runs as its own task on the supplied executor. A pairing first
 * waits, for at most the auction's timeout, for that auction to open its bidding window, then
 * runs under a child scope of the window bounded by the auction's timeout. When the window closes,
 * whether by timeout, explicit close or cancellation, every pairing still pending on it ends with
 * it. A pairing whose auction never opens within the timeout abandons. Pairings share nothing
 * except the inbound buffer of the auction they target.</p>
 */
public class BidderPool {

    private static final Logger logger = LogManager.getLogger(BidderPool.class);

    private final List<Bidder> bidders;

    /**
     * Creates a pool with a fresh, non-reproducible seed.
     *
     * @param settings validated bidder settings
     */
    public BidderPool(BidderSettings settings) {
        this(settings, RandomGenerators.freshSeed());
    }

    /**
     * Creates {@code settings.getTotalBidders()} bidders with ids starting at 1.
     *
     * @param settings validated bidder settings
     * @param seed     base seed; each bidder derives its own from it
     */
    public BidderPool(BidderSettings settings, long seed) {
        List<Bidder> created = new ArrayList<>(settings.getTotalBidders());
        for (int id = 1; id <= settings.getTotalBidders(); id++) {
            created.add(new Bidder(id, settings, RandomGenerators.mix(seed, -id)));
        }
        this.bidders = Collections.unmodifiableList(created);
    }

    /**
     * Runs one participation task per (bidder, auction) pairing and waits for all of them.
     * Returns once every pairing has bid, lost interest or been cancelled by its window.
     *
     * @param auctions the complete auction roster
     * @param executor executor the pairing tasks run on
     * @param parent   bounds the wait for auctions that have not opened their bidding window yet
     * @return per-outcome counts over all pairings
     * @throws InterruptedException if interrupted while waiting; pending pairings are cancelled
     */
    public ParticipationTally participateInAll(List<Auction> auctions, ExecutorService executor, Deadline parent)
        throws InterruptedException {
        logger.info("Activating {} bidders for {} auctions", bidders.size(), auctions.size());

        ParticipationTally tally = new ParticipationTally();
        List<Future<ParticipationOutcome>> futures = new ArrayList<>(bidders.size() * auctions.size());
        for (Bidder bidder : bidders) {
            for (Auction auction : auctions) {
                futures.add(executor.submit(() -> {
                    ParticipationOutcome outcome = runPairing(bidder, auction, parent);
                    tally.record(outcome);
                    return outcome;
                }));
            }
        }

        try {
            for (Future<ParticipationOutcome> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Bidder pairing failed", e.getCause());
        }

        logger.info("All bidders have finished participating: {}", tally);
        return tally;
    }

    private ParticipationOutcome runPairing(Bidder bidder, Auction auction, Deadline parent) {
        try (Deadline opening = parent.withTimeout(auction.getTimeout())) {
            Optional<Deadline> biddingWindow;
            try {
                biddingWindow = auction.awaitBiddingWindow(opening);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ParticipationOutcome.ABANDONED_THINKING;
            }
            if (biddingWindow.isEmpty()) {
                // opening is done here, so the bidder abandons once it has decided
                logger.debug("Auction {} never opened for bidder {}", auction.getId(), bidder.getId());
                return bidder.participate(auction, opening);
            }
            try (Deadline window = biddingWindow.get().withTimeout(auction.getTimeout())) {
                return bidder.participate(auction, window);
            }
        }
    }

    public List<Bidder> getBidders() {
        return bidders;
    }

    public int getBidderCount() {
        return bidders.size();
    }
}
