package io.nosqlbench.auctionsim.command.common;

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

import io.nosqlbench.auctionsim.config.SimulationConfig;
import picocli.CommandLine;

/**
 * Shared random seed option. When given, the seed fixes the item catalogue and every bidder's
 * decisions for the run; when absent, the configured seed (if any) is kept.
 */
public class RandomSeedOption {

    /**
     * A parsed seed specification.
     *
     * @param value the seed value, or null when none was given
     */
    public record Seed(Long value) {

        public Seed(long value) {
            this(Long.valueOf(value));
        }

        public Seed() {
            this((Long) null);
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "random";
        }
    }

    /**
     * Picocli type converter for {@link Seed}.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }
            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer.");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for items and bidder decisions (default: from config, else random)",
        converter = SeedConverter.class
    )
    private Seed seed;

    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    /**
     * Overlays the seed onto the configuration when one was given.
     *
     * @param config the configuration to update
     */
    public void applyTo(SimulationConfig config) {
        if (isSeedSpecified()) {
            config.getSystem().setSeed(seed.value());
        }
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
