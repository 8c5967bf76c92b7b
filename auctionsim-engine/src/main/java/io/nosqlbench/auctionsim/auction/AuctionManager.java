package io.nosqlbench.auctionsim.auction;

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

import io.nosqlbench.auctionsim.bidder.BidderPool;
import io.nosqlbench.auctionsim.bidder.ParticipationTally;
import io.nosqlbench.auctionsim.config.SimulationConfig;
import io.nosqlbench.auctionsim.model.AuctionItem;
import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.SimulationResult;
import io.nosqlbench.auctionsim.scope.Deadline;
import io.nosqlbench.auctionsim.util.NamedThreadFactory;
import io.nosqlbench.auctionsim.util.RandomGenerators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates one simulation run: builds the auction roster, runs every auction concurrently,
 * fans the bidder pool out against them, and aggregates the results.
 *
 * <p>A manager is a single-use context. Construct it, call {@link #run(BidderPool)} once, and
 * discard it. Its result list and its start/end instants are guarded by one lock that is held
 * only for appends, timing marks and the final aggregation, never across a blocking wait.</p>
 *
 * <h2>Orchestration</h2>
 * <ol>
 *   <li>Generate every item and construct every auction before any task starts, so the pool
 *       sees a complete and stable roster</li>
 *   <li>Launch one task per auction; each appends its result as soon as it resolves</li>
 *   <li>After a short warm-up, launch the bidder fan-out as one task</li>
 *   <li>Wait for the auctions and the fan-out, then aggregate</li>
 * </ol>
 */
public class AuctionManager {

    private static final Logger logger = LogManager.getLogger(AuctionManager.class);

    private final SimulationConfig config;
    private final ItemGenerator generator;
    private final Deadline root = Deadline.unbounded();
    private final AtomicBoolean ran = new AtomicBoolean(false);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<AuctionResult> results = new ArrayList<>();
    private List<Auction> auctions = List.of();
    private Instant startTime;
    private Instant endTime;
    private volatile ParticipationTally lastTally;

    /**
     * @param config a validated configuration; its seed, if any, fixes the item catalogue
     */
    public AuctionManager(SimulationConfig config) {
        this(config, config.getSystem().getSeed() != null
            ? new ItemGenerator(config.getSystem().getSeed())
            : new ItemGenerator());
    }

    public AuctionManager(SimulationConfig config, ItemGenerator generator) {
        this.config = config;
        this.generator = generator;
    }

    /**
     * Generates items and constructs the auctions, once. Later calls return the same roster.
     *
     * @return the auction roster, ids {@code 1..total_auctions}
     */
    public List<Auction> prepareAuctions() {
        lock.lock();
        try {
            if (auctions.isEmpty()) {
                Duration timeout = config.getAuction().getTimeout();
                List<Auction> roster = new ArrayList<>();
                for (AuctionItem item : generator.generateItems(config.getAuction().getTotalAuctions())) {
                    roster.add(new Auction(item.id(), item, timeout));
                }
                auctions = Collections.unmodifiableList(roster);
                logger.info("Pre-generated {} auctions", roster.size());
            }
            return auctions;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the simulation with a bidder pool built from the configuration.
     *
     * @return the aggregated result
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public SimulationResult run() throws InterruptedException {
        Long seed = config.getSystem().getSeed();
        BidderPool pool = seed != null
            ? new BidderPool(config.getBidder(), RandomGenerators.mix(seed, 1L))
            : new BidderPool(config.getBidder());
        return run(pool);
    }

    /**
     * Runs the simulation and blocks until every auction has resolved and every pairing has
     * finished.
     *
     * @param pool the bidders to fan out
     * @return the aggregated result
     * @throws InterruptedException if the calling thread is interrupted while waiting; every
     *     auction and pairing is cancelled before this is thrown
     * @throws IllegalStateException if this manager has already run, or a task failed
     */
    public SimulationResult run(BidderPool pool) throws InterruptedException {
        if (!ran.compareAndSet(false, true)) {
            throw new IllegalStateException("auction manager has already run");
        }
        List<Auction> roster = prepareAuctions();

        ExecutorService auctionExecutor =
            Executors.newFixedThreadPool(roster.size(), new NamedThreadFactory("auction"));
        ExecutorService pairingExecutor = newPairingExecutor();
        ExecutorService coordinator = Executors.newSingleThreadExecutor(new NamedThreadFactory("bidder-pool"));

        try {
            markStart();
            logger.info("Starting all auctions");
            List<Future<?>> auctionTasks = new ArrayList<>(roster.size());
            for (Auction auction : roster) {
                auctionTasks.add(auctionExecutor.submit(() -> recordResult(auction.run(root))));
            }

            Thread.sleep(config.getSystem().getWarmupMs());

            logger.info("Activating bidders");
            Future<ParticipationTally> fanOut =
                coordinator.submit(() -> pool.participateInAll(roster, pairingExecutor, root));

            logger.debug("Waiting for completion");
            for (Future<?> task : auctionTasks) {
                await(task);
            }
            lastTally = await(fanOut);
            markEnd();
        } catch (InterruptedException e) {
            root.cancel();
            throw e;
        } finally {
            coordinator.shutdownNow();
            pairingExecutor.shutdownNow();
            auctionExecutor.shutdownNow();
        }

        SimulationResult result = aggregateResults();
        logger.info("Simulation complete: {} auctions, {} bids in {}ms",
            result.totalAuctions(), result.totalBids(), result.totalDuration().toMillis());
        return result;
    }

    private ExecutorService newPairingExecutor() {
        int threads = config.getSystem().getBidderThreads();
        NamedThreadFactory factory = new NamedThreadFactory("bidder");
        return threads == 0
            ? Executors.newCachedThreadPool(factory)
            : Executors.newFixedThreadPool(threads, factory);
    }

    private static <T> T await(Future<T> task) throws InterruptedException {
        try {
            return task.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Simulation task failed", e.getCause());
        }
    }

    /**
     * Appends one auction's result. Safe to call from any auction task.
     *
     * @param result a resolved auction's result
     */
    void recordResult(AuctionResult result) {
        lock.lock();
        try {
            results.add(result);
        } finally {
            lock.unlock();
        }
    }

    private void markStart() {
        lock.lock();
        try {
            startTime = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    private void markEnd() {
        lock.lock();
        try {
            endTime = Instant.now();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Aggregates every recorded result. An auction counts as successful when it completed with a
     * winner; every other auction counts as failed.
     *
     * @return the simulation result
     * @throws IllegalStateException if the run has not finished
     */
    public SimulationResult aggregateResults() {
        lock.lock();
        try {
            if (startTime == null || endTime == null) {
                throw new IllegalStateException("simulation has not finished");
            }
            int totalBids = 0;
            int successful = 0;
            int failed = 0;
            for (AuctionResult result : results) {
                totalBids += result.totalBids();
                if (result.isSuccessful()) {
                    successful++;
                } else {
                    failed++;
                }
            }
            return new SimulationResult(
                config.getAuction().getTotalAuctions(),
                Duration.between(startTime, endTime),
                startTime,
                endTime,
                results,
                successful,
                failed,
                totalBids,
                null
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the run: every auction stops collecting and every pending pairing is abandoned.
     * Auctions still resolve and produce their results.
     */
    public void cancel() {
        root.cancel();
    }

    public List<Auction> getAuctions() {
        lock.lock();
        try {
            return auctions;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return outcome counts of the bidder fan-out, once the run has finished
     */
    public Optional<ParticipationTally> getParticipationTally() {
        return Optional.ofNullable(lastTally);
    }

    public SimulationConfig getConfig() {
        return config;
    }
}
