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
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceMonitorTest {

    @Test
    void testSamplesWhileRunning() throws InterruptedException {
        ResourceMonitor monitor = new ResourceMonitor(Duration.ofMillis(10));
        monitor.start();
        Thread.sleep(150);
        monitor.stop();

        ResourceUsage usage = monitor.getStats();
        assertThat(usage).isNotNull();
        assertThat(usage.samples()).isGreaterThanOrEqualTo(3);
        assertThat(usage.samples()).isEqualTo(monitor.getSnapshots().size());
        assertThat(usage.peakMemoryMb()).isGreaterThanOrEqualTo(usage.initialMemoryMb());
        assertThat(usage.peakMemoryMb()).isGreaterThanOrEqualTo(usage.finalMemoryMb());
        assertThat(usage.averageMemoryMb()).isLessThanOrEqualTo(usage.peakMemoryMb());
        assertThat(usage.peakThreads()).isPositive();
        assertThat(usage.cpuCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void testNoSamplesAfterStop() throws InterruptedException {
        ResourceMonitor monitor = new ResourceMonitor(Duration.ofMillis(5));
        monitor.start();
        Thread.sleep(30);
        monitor.stop();
        int samples = monitor.getSnapshots().size();
        Thread.sleep(50);
        assertThat(monitor.getSnapshots()).hasSize(samples);
    }

    @Test
    void testStatsBeforeStartAreAbsent() {
        assertThat(new ResourceMonitor().getStats()).isNull();
    }

    @Test
    void testStopIsIdempotentAndStartIsSingleUse() {
        ResourceMonitor monitor = new ResourceMonitor(Duration.ofSeconds(10));
        monitor.start();
        assertThatThrownBy(monitor::start).isInstanceOf(IllegalStateException.class);
        monitor.stop();
        monitor.close();
        assertThat(monitor.getStats().samples()).isEqualTo(2);
    }

    @Test
    void testStopWithoutStartIsHarmless() {
        ResourceMonitor monitor = new ResourceMonitor();
        monitor.stop();
        assertThat(monitor.getSnapshots()).isEmpty();
    }

    @Test
    void testNonPositiveIntervalIsRejected() {
        assertThatThrownBy(() -> new ResourceMonitor(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReportRendersEveryFigure() {
        String report = ResourceMonitor.formatReport(new ResourceUsage(12.0, 10.0, 30.0, 18.25, 10, 4, 7));
        assertThat(report).contains("Initial:     12.00 MB");
        assertThat(report).contains("Average:     18.25 MB");
        assertThat(report).contains("Delta:       -2.00 MB");
        assertThat(report).contains("Available CPUs:    4");
        assertThat(report).contains("Memory Efficiency: 3.000 MB/thread (peak)");
        assertThat(report).contains("Samples:           7");
    }
}
