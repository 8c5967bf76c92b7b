package io.nosqlbench.auctionsim.util;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CollectionSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.apache.commons.rng.sampling.distribution.DiscreteUniformSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;

/**
 * Factory and sampling helpers for the simulator's random sources, built on Apache Commons RNG.
 *
 * <p>None of the generators returned here are thread-safe. Callers either confine a generator to
 * one task or guard it with a lock.</p>
 */
public final class RandomGenerators {

    /**
     * Generator algorithms the simulator can be configured with.
     */
    public enum Algorithm {
        /** 256-bit state, fast, good statistical quality. The default. */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),
        /** 128-bit state. */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),
        /** 64-bit state; cheap to create, used for per-pairing generators. */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * @param algorithm generator algorithm
     * @param seed      seed for deterministic generation
     * @return a new generator
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * @param seed seed for deterministic generation
     * @return a new {@link Algorithm#XO_SHI_RO_256_PP} generator
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * @return a fresh, non-reproducible seed
     */
    public static long freshSeed() {
        return RandomSource.createLong();
    }

    /**
     * Combines a base seed with a discriminator into a well-spread derived seed, so related
     * generators (one per bidder, one per pairing) do not produce correlated streams.
     *
     * @param seed          base seed
     * @param discriminator value distinguishing the derived stream
     * @return the derived seed
     */
    public static long mix(long seed, long discriminator) {
        long z = seed + 0x9E3779B97F4A7C15L * (discriminator + 1);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /**
     * Draws from the closed range {@code [lower, upper]}.
     */
    public static int uniformInt(UniformRandomProvider rng, int lower, int upper) {
        if (lower == upper) {
            return lower;
        }
        return DiscreteUniformSampler.of(rng, lower, upper).sample();
    }

    /**
     * Draws from {@code [lower, upper)}, or returns {@code lower} when the range is empty.
     */
    public static double uniformDouble(UniformRandomProvider rng, double lower, double upper) {
        if (lower == upper) {
            return lower;
        }
        return ContinuousUniformSampler.of(rng, lower, upper).sample();
    }

    public static <T> T pick(UniformRandomProvider rng, List<T> values) {
        return new CollectionSampler<>(rng, values).sample();
    }
}
