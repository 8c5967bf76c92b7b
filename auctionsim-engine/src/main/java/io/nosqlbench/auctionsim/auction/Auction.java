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

import io.nosqlbench.auctionsim.model.AuctionItem;
import io.nosqlbench.auctionsim.model.AuctionResult;
import io.nosqlbench.auctionsim.model.Bid;
import io.nosqlbench.auctionsim.scope.Deadline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/// One timed, sealed-bid collection unit for a single item.
///
/// Bidders hand bids to a bounded inbound buffer with [#submit(Bid)] or
/// [#submit(Bid, Deadline)]. The thread that calls [#run(Deadline)] moves bids from the buffer
/// into the auction's bid list until the bidding window closes, then takes whatever is already
/// buffered without waiting and determines the winner. Bids still in flight when the window
/// closes are dropped; they are never waited for.
///
/// An auction runs at most once. See [AuctionState] for its lifecycle.
public class Auction implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(Auction.class);

    /// Inbound buffer capacity used when none is given.
    public static final int DEFAULT_BID_BUFFER_CAPACITY = 100;

    /// Upper bound on any single blocking wait, so an explicit close is noticed promptly.
    static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final int id;
    private final AuctionItem item;
    private final Duration timeout;
    private final BlockingQueue<Bid> inbound;

    private final ReentrantLock bidsLock = new ReentrantLock();
    private final List<Bid> bids = new ArrayList<>();

    private final AtomicReference<AuctionState> state = new AtomicReference<>(AuctionState.COLLECTING);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean closeRequested;
    private volatile Deadline biddingWindow;
    private final CountDownLatch windowOpened = new CountDownLatch(1);
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile AuctionResult result;

    public Auction(int id, AuctionItem item, Duration timeout) {
        this(id, item, timeout, DEFAULT_BID_BUFFER_CAPACITY);
    }

    public Auction(int id, AuctionItem item, Duration timeout, int bufferCapacity) {
        this.id = id;
        this.item = Objects.requireNonNull(item, "item");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("auction timeout must be positive, got " + timeout);
        }
        this.inbound = new ArrayBlockingQueue<>(bufferCapacity);
    }

    /// Runs the auction under an unbounded parent scope.
    ///
    /// @return the auction result
    public AuctionResult run() {
        return run(Deadline.unbounded());
    }

    /// Collects bids until this auction's timeout elapses, `parent` is done, or [#close()] is
    /// called, then drains already-buffered bids and resolves the winner. Always produces exactly
    /// one result. If the calling thread is interrupted while collecting, the auction moves
    /// straight to draining and the interrupt flag is left set.
    ///
    /// @param parent the enclosing cancellation scope
    /// @return the auction result
    /// @throws IllegalStateException if this auction has already been run
    public AuctionResult run(Deadline parent) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("auction #" + id + " has already been run");
        }
        startTime = Instant.now();
        if (isMilestone()) {
            logger.info("Auction #{} started: {} (base ${})", id, item.name(),
                String.format(Locale.ROOT, "%.2f", item.basePrice()));
        }

        try (Deadline window = parent.withTimeout(timeout)) {
            biddingWindow = window;
            windowOpened.countDown();
            if (closeRequested) {
                window.cancel();
            }
            collect(window);
            state.set(AuctionState.DRAINING);
            drainBuffered();
            endTime = Instant.now();
        }

        AuctionResult resolved = resolve();
        if (isMilestone()) {
            logger.info("Auction #{} ended: {} bids received", id, resolved.totalBids());
        }
        return resolved;
    }

    private void collect(Deadline window) {
        while (!window.isDone()) {
            long wait = Math.min(window.remainingNanos(), POLL_SLICE_NANOS);
            try {
                Bid bid = inbound.poll(wait, TimeUnit.NANOSECONDS);
                if (bid != null) {
                    record(bid);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Auction #{} interrupted while collecting bids", id);
                return;
            }
        }
    }

    private void drainBuffered() {
        List<Bid> buffered = new ArrayList<>();
        inbound.drainTo(buffered);
        for (Bid bid : buffered) {
            record(bid);
        }
        if (!buffered.isEmpty()) {
            logger.trace("Auction #{} drained {} buffered bids", id, buffered.size());
        }
    }

    private void record(Bid bid) {
        bidsLock.lock();
        try {
            bids.add(bid);
        } finally {
            bidsLock.unlock();
        }
    }

    private AuctionResult resolve() {
        if (!state.compareAndSet(AuctionState.DRAINING, AuctionState.RESOLVED)) {
            throw new IllegalStateException("auction #" + id + " cannot resolve from state " + state.get());
        }
        int totalBids;
        Optional<Bid> winner;
        bidsLock.lock();
        try {
            totalBids = bids.size();
            winner = bids.stream().min(Bid.WINNING_ORDER);
        } finally {
            bidsLock.unlock();
        }
        int dropped = inbound.size();
        inbound.clear();
        if (dropped > 0) {
            logger.debug("Auction #{} dropped {} bids that arrived after draining", id, dropped);
        }
        AuctionResult resolved = AuctionResult.of(id, item, totalBids, winner, startTime, endTime);
        result = resolved;
        return resolved;
    }

    /// Offers a bid without blocking.
    ///
    /// A `true` result does not mean the bid was recorded. A bid that enters the buffer while
    /// the auction is draining, after the final drain has run, is discarded when the auction
    /// resolves and never appears in [#getAllBids()] or the result.
    ///
    /// @param bid a bid addressed to this auction
    /// @return true if the bid entered the inbound buffer
    /// @throws IllegalArgumentException if the bid is addressed to another auction
    public boolean submit(Bid bid) {
        checkAddressedHere(bid);
        if (!state.get().acceptsBids()) {
            return false;
        }
        return inbound.offer(bid);
    }

    /// Offers a bid, waiting for buffer space until `window` is done.
    ///
    /// As with [#submit(Bid)], `true` only means the bid entered the inbound buffer; it may
    /// still be discarded if the auction was already draining.
    ///
    /// @param bid    a bid addressed to this auction
    /// @param window the sender's cancellation scope
    /// @return true if the bid entered the inbound buffer, false if the sender gave up
    /// @throws InterruptedException if the sending thread is interrupted while waiting
    public boolean submit(Bid bid, Deadline window) throws InterruptedException {
        checkAddressedHere(bid);
        while (state.get().acceptsBids()) {
            if (window.isDone()) {
                return false;
            }
            long wait = Math.min(window.remainingNanos(), POLL_SLICE_NANOS);
            if (inbound.offer(bid, wait, TimeUnit.NANOSECONDS)) {
                return true;
            }
        }
        return false;
    }

    private void checkAddressedHere(Bid bid) {
        if (bid.auctionId() != id) {
            throw new IllegalArgumentException("bid for auction #" + bid.auctionId()
                + " submitted to auction #" + id);
        }
    }

    /// Closes the bidding window early. Bids already buffered are still counted.
    /// Has no effect once the auction has left the collecting state.
    @Override
    public void close() {
        closeRequested = true;
        Deadline window = biddingWindow;
        if (window != null) {
            window.cancel();
        }
    }

    /// @return the live bidding window, empty until the auction starts running
    public Optional<Deadline> getBiddingWindow() {
        return Optional.ofNullable(biddingWindow);
    }

    /// Waits until this auction opens its bidding window or `limit` is done, whichever comes
    /// first. Returns at once if the window is already open, or closed.
    ///
    /// @param limit bounds the wait
    /// @return the bidding window, empty if `limit` was done before the auction started
    /// @throws InterruptedException if the waiting thread is interrupted
    public Optional<Deadline> awaitBiddingWindow(Deadline limit) throws InterruptedException {
        while (biddingWindow == null && !limit.isDone()) {
            long wait = Math.min(limit.remainingNanos(), POLL_SLICE_NANOS);
            windowOpened.await(wait, TimeUnit.NANOSECONDS);
        }
        return Optional.ofNullable(biddingWindow);
    }

    /// @return a copy of every bid received so far
    public List<Bid> getAllBids() {
        bidsLock.lock();
        try {
            return new ArrayList<>(bids);
        } finally {
            bidsLock.unlock();
        }
    }

    public Optional<AuctionResult> getResult() {
        return Optional.ofNullable(result);
    }

    public int getId() {
        return id;
    }

    public AuctionItem getItem() {
        return item;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public AuctionState getState() {
        return state.get();
    }

    public boolean hasStarted() {
        return started.get();
    }

    private boolean isMilestone() {
        return id % 10 == 0 || id == 1;
    }

    @Override
    public String toString() {
        return "Auction{id=" + id + ", item='" + item.name() + "', timeout=" + timeout.toMillis()
            + "ms, state=" + state.get() + "}";
    }
}
