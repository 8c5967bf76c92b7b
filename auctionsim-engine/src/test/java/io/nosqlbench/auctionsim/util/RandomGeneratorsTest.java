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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class RandomGeneratorsTest {

    @Test
    void testSameSeedSameSequence() {
        UniformRandomProvider rng1 = RandomGenerators.create(42L);
        UniformRandomProvider rng2 = RandomGenerators.create(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, 42L);
        for (int i = 0; i < 5; i++) {
            assertEquals(rng1.nextLong(), rng2.nextLong());
        }
    }

    @Test
    void testMixSpreadsNeighbouringDiscriminators() {
        assertNotEquals(RandomGenerators.mix(7L, 1L), RandomGenerators.mix(7L, 2L));
        assertNotEquals(RandomGenerators.mix(7L, 1L), RandomGenerators.mix(8L, 1L));
        assertEquals(RandomGenerators.mix(7L, 1L), RandomGenerators.mix(7L, 1L));
    }

    @Test
    void testUniformIntIsInclusive() {
        UniformRandomProvider rng = RandomGenerators.create(1L);
        List<Integer> draws = IntStream.range(0, 2000)
            .mapToObj(i -> RandomGenerators.uniformInt(rng, 3, 5))
            .toList();
        assertThat(draws).allMatch(v -> v >= 3 && v <= 5);
        assertThat(draws).contains(3, 4, 5);
        assertThat(RandomGenerators.uniformInt(rng, 9, 9)).isEqualTo(9);
    }

    @Test
    void testUniformDoubleStaysInRange() {
        UniformRandomProvider rng = RandomGenerators.create(2L);
        for (int i = 0; i < 1000; i++) {
            assertThat(RandomGenerators.uniformDouble(rng, 1.0, 2.5)).isBetween(1.0, 2.5);
        }
        assertThat(RandomGenerators.uniformDouble(rng, 1.5, 1.5)).isEqualTo(1.5);
    }

    @Test
    void testPickReturnsMember() {
        UniformRandomProvider rng = RandomGenerators.create(3L);
        List<String> values = List.of("a", "b", "c");
        for (int i = 0; i < 100; i++) {
            assertThat(values).contains(RandomGenerators.pick(rng, values));
        }
    }
}
