package io.nosqlbench.auctionsim.scope;

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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A cancellation scope that becomes <em>done</em> either when its deadline passes or when it is
 * cancelled explicitly. Any number of concurrent tasks may hold the same scope and observe it.
 *
 * <h2>Hierarchy</h2>
 * <p>Scopes form a tree. A child created with {@link #withTimeout(Duration)} never outlives its
 * parent: its deadline is the earlier of the parent's deadline and its own timeout, and
 * cancelling the parent cancels every child that is still registered. Closing a child removes it
 * from its parent.</p>
 *
 * <pre>{@code
 * try (Deadline window = root.withTimeout(Duration.ofMillis(200))) {
 *     while (!window.isDone()) {
 *         Bid bid = queue.poll(window.remainingNanos(), TimeUnit.NANOSECONDS);
 *         ...
 *     }
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <ul>
 *   <li><strong>Observation:</strong> {@link #isDone()}, {@link #remainingNanos()} and
 *       {@link #await(long, TimeUnit)} may be called from any thread</li>
 *   <li><strong>Cancellation:</strong> {@link #cancel()} is idempotent and wakes every waiter</li>
 *   <li><strong>Children:</strong> registration and removal use a CopyOnWriteArrayList</li>
 * </ul>
 *
 * <p>Deadlines are measured on {@link System#nanoTime()}, so they are immune to wall-clock
 * adjustments.</p>
 */
public final class Deadline implements AutoCloseable {

    private final Deadline parent;
    private final long deadlineNanos;
    private final boolean bounded;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Deadline> children = new CopyOnWriteArrayList<>();

    private Deadline(Deadline parent, long deadlineNanos, boolean bounded) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    /**
     * Creates a root scope that is done only once cancelled.
     *
     * @return an unbounded root scope
     */
    public static Deadline unbounded() {
        return new Deadline(null, 0L, false);
    }

    /**
     * Creates a root scope that is done after the given timeout.
     *
     * @param timeout time from now until the scope is done
     * @return a bounded root scope
     */
    public static Deadline after(Duration timeout) {
        return new Deadline(null, System.nanoTime() + saturatedNanos(timeout), true);
    }

    /**
     * Creates a child scope that is done after {@code timeout}, or when this scope is done,
     * whichever comes first. A child of an already-cancelled scope starts cancelled.
     *
     * @param timeout the child's own timeout
     * @return the child scope
     */
    public Deadline withTimeout(Duration timeout) {
        long childDeadline = System.nanoTime() + saturatedNanos(timeout);
        if (bounded && deadlineNanos - childDeadline < 0) {
            childDeadline = deadlineNanos;
        }
        Deadline child = new Deadline(this, childDeadline, true);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    /**
     * @return true once the deadline has passed or the scope was cancelled
     */
    public boolean isDone() {
        return isCancelled() || (bounded && System.nanoTime() - deadlineNanos >= 0);
    }

    /**
     * @return true if {@link #cancel()} was called on this scope or an ancestor
     */
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Returns the time left before this scope is done. Zero once done; {@link Long#MAX_VALUE}
     * for an unbounded scope that has not been cancelled.
     *
     * @return remaining nanoseconds, never negative
     */
    public long remainingNanos() {
        if (isCancelled()) {
            return 0L;
        }
        if (!bounded) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    public Duration remaining() {
        return Duration.ofNanos(remainingNanos());
    }

    /**
     * Waits until this scope is done or the timeout elapses, whichever comes first.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return true if the scope is done when the wait ends
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        long waitNanos = Math.min(unit.toNanos(timeout), remainingNanos());
        if (waitNanos > 0) {
            cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
        }
        return isDone();
    }

    /**
     * Waits until this scope is done.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void awaitDone() throws InterruptedException {
        while (!isDone()) {
            await(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * Cancels this scope and every registered descendant. Idempotent.
     */
    public void cancel() {
        if (isCancelled()) {
            return;
        }
        cancelled.countDown();
        for (Deadline child : children) {
            child.cancel();
        }
        children.clear();
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    /**
     * Cancels this scope and detaches it from its parent.
     */
    @Override
    public void close() {
        cancel();
    }

    /**
     * @return the parent scope, or null for a root scope
     */
    public Deadline getParent() {
        return parent;
    }

    int getChildCount() {
        return children.size();
    }

    private static long saturatedNanos(Duration timeout) {
        if (timeout.isNegative()) {
            return 0L;
        }
        try {
            return Math.min(timeout.toNanos(), Long.MAX_VALUE / 4);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE / 4;
        }
    }

    @Override
    public String toString() {
        if (isCancelled()) {
            return "Deadline{cancelled}";
        }
        return bounded ? "Deadline{remaining=" + remaining().toMillis() + "ms}" : "Deadline{unbounded}";
    }
}
