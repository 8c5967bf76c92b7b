package io.nosqlbench.auctionsim.model;

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

/**
 * Resource usage sampled while a simulation ran. The engine never produces this itself; a
 * monitor owned by the caller attaches it to the {@link SimulationResult} after the run.
 *
 * @param initialMemoryMb heap in use when sampling started
 * @param finalMemoryMb   heap in use when sampling stopped
 * @param peakMemoryMb    largest heap usage observed
 * @param averageMemoryMb mean heap usage over all samples
 * @param peakThreads     largest live thread count observed
 * @param cpuCount        processors available to the JVM
 * @param samples         number of samples taken
 */
public record ResourceUsage(
    double initialMemoryMb,
    double finalMemoryMb,
    double peakMemoryMb,
    double averageMemoryMb,
    int peakThreads,
    int cpuCount,
    int samples
) {

    public double memoryDeltaMb() {
        return finalMemoryMb - initialMemoryMb;
    }
}
