package io.nosqlbench.auctionsim.monitor;

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

import io.nosqlbench.auctionsim.model.ResourceUsage;
import io.nosqlbench.auctionsim.util.NamedThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Samples JVM heap usage and live thread count at a fixed interval while a simulation runs.
 *
 * <p>Call {@link #start()} before the run and {@link #stop()} after it; {@link #getStats()} then
 * summarizes every sample, including the ones taken at start and stop. A monitor is single-use.</p>
 */
public class ResourceMonitor implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ResourceMonitor.class);

    private static final double BYTES_PER_MB = 1024.0d * 1024.0d;

    /** Sampling interval used when none is given. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500);

    /**
     * One point-in-time sample.
     *
     * @param timestamp   when the sample was taken
     * @param heapUsedMb  heap in use
     * @param liveThreads live JVM threads
     * @param cpuCount    processors available to the JVM
     */
    public record Snapshot(Instant timestamp, double heapUsedMb, int liveThreads, int cpuCount) {
    }

    private final Duration interval;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Snapshot> snapshots = new ArrayList<>();
    private Snapshot first;
    private Snapshot last;
    private ScheduledExecutorService sampler;

    public ResourceMonitor() {
        this(DEFAULT_INTERVAL);
    }

    public ResourceMonitor(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("sampling interval must be positive, got " + interval);
        }
        this.interval = interval;
    }

    /**
     * Takes the initial sample and starts periodic sampling.
     *
     * @throws IllegalStateException if the monitor was already started
     */
    public void start() {
        lock.lock();
        try {
            if (sampler != null) {
                throw new IllegalStateException("resource monitor already started");
            }
            first = takeSnapshot();
            snapshots.add(first);
            sampler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("resource-monitor"));
        } finally {
            lock.unlock();
        }
        long periodMs = interval.toMillis();
        sampler.scheduleAtFixedRate(this::sample, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.debug("Resource monitor started, sampling every {}ms", periodMs);
    }

    private void sample() {
        Snapshot snapshot = takeSnapshot();
        lock.lock();
        try {
            if (last == null) {
                snapshots.add(snapshot);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops periodic sampling and takes the final sample. Idempotent.
     */
    public void stop() {
        ScheduledExecutorService running;
        lock.lock();
        try {
            if (sampler == null || last != null) {
                return;
            }
            running = sampler;
            last = takeSnapshot();
            snapshots.add(last);
        } finally {
            lock.unlock();
        }
        running.shutdownNow();
        try {
            if (!running.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.warn("Resource monitor sampler did not terminate within 1s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Resource monitor stopped after {} samples", getSnapshots().size());
    }

    @Override
    public void close() {
        stop();
    }

    Snapshot takeSnapshot() {
        return new Snapshot(
            Instant.now(),
            memoryBean.getHeapMemoryUsage().getUsed() / BYTES_PER_MB,
            threadBean.getThreadCount(),
            Runtime.getRuntime().availableProcessors()
        );
    }

    /**
     * Summarizes the samples taken so far.
     *
     * @return resource usage, or null when the monitor was never started
     */
    public ResourceUsage getStats() {
        lock.lock();
        try {
            if (snapshots.isEmpty()) {
                return null;
            }
            Snapshot end = last != null ? last : snapshots.get(snapshots.size() - 1);
            double peak = first.heapUsedMb();
            int peakThreads = first.liveThreads();
            double total = 0.0d;
            for (Snapshot snapshot : snapshots) {
                peak = Math.max(peak, snapshot.heapUsedMb());
                peakThreads = Math.max(peakThreads, snapshot.liveThreads());
                total += snapshot.heapUsedMb();
            }
            return new ResourceUsage(
                first.heapUsedMb(),
                end.heapUsedMb(),
                peak,
                total / snapshots.size(),
                peakThreads,
                first.cpuCount(),
                snapshots.size()
            );
        } finally {
            lock.unlock();
        }
    }

    public List<Snapshot> getSnapshots() {
        lock.lock();
        try {
            return List.copyOf(snapshots);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Renders resource usage as a text report.
     *
     * @param usage the usage to render
     * @return the report
     */
    public static String formatReport(ResourceUsage usage) {
        StringBuilder sb = new StringBuilder();
        sb.append("\nRESOURCE USAGE REPORT\n");
        sb.append("=".repeat(56)).append("\n\n");
        sb.append("Memory Usage:\n");
        sb.append(String.format(Locale.ROOT, "   |- Initial:     %.2f MB%n", usage.initialMemoryMb()));
        sb.append(String.format(Locale.ROOT, "   |- Final:       %.2f MB%n", usage.finalMemoryMb()));
        sb.append(String.format(Locale.ROOT, "   |- Peak:        %.2f MB%n", usage.peakMemoryMb()));
        sb.append(String.format(Locale.ROOT, "   |- Average:     %.2f MB%n", usage.averageMemoryMb()));
        sb.append(String.format(Locale.ROOT, "   `- Delta:       %+.2f MB%n%n", usage.memoryDeltaMb()));
        sb.append("CPU & Concurrency:\n");
        sb.append(String.format(Locale.ROOT, "   |- Available CPUs:    %d%n", usage.cpuCount()));
        sb.append(String.format(Locale.ROOT, "   `- Peak Threads:      %d%n%n", usage.peakThreads()));
        sb.append("Efficiency Metrics:\n");
        double perThread = usage.peakThreads() > 0 ? usage.peakMemoryMb() / usage.peakThreads() : 0.0d;
        sb.append(String.format(Locale.ROOT, "   |- Memory Efficiency: %.3f MB/thread (peak)%n", perThread));
        sb.append(String.format(Locale.ROOT, "   `- Samples:           %d%n%n", usage.samples()));
        return sb.toString();
    }
}
