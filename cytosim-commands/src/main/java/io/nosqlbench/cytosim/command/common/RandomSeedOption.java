/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.cytosim.command.common;

import io.nosqlbench.cytosim.generator.sampling.RandomSources;
import org.apache.commons.rng.RestorableUniformRandomProvider;
import picocli.CommandLine;

/**
 * Shared random seed and PRNG algorithm options.
 * Without a seed, every run draws a fresh time-based seed.
 */
public class RandomSeedOption {

    /**
     * Random seed specification.
     *
     * @param value the seed value, or null for a time-based seed
     */
    public record Seed(Long value) {

        public Seed(long value) {
            this(Long.valueOf(value));
        }

        public Seed() {
            this((Long) null);
        }

        /**
         * Gets the effective seed value, generating one from current time if needed.
         */
        public long effective() {
            return value != null ? value : System.nanoTime() ^ System.currentTimeMillis();
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "auto (time-based)";
        }
    }

    /**
     * Picocli type converter for {@link Seed} specifications.
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
        description = "Random seed for event generation (default: current time)",
        converter = SeedConverter.class
    )
    private Seed seed;

    @CommandLine.Option(
        names = {"-a", "--algorithm"},
        description = "PRNG algorithm (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
        defaultValue = "XO_SHI_RO_256_PP"
    )
    private RandomSources.Algorithm algorithm = RandomSources.Algorithm.XO_SHI_RO_256_PP;

    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    public RandomSources.Algorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * Creates the random stream for one run. Each call resolves the seed anew,
     * so an unseeded option yields a different stream every time.
     *
     * @return a provider seeded from this option
     */
    public RestorableUniformRandomProvider newRandom() {
        return RandomSources.create(algorithm, getSeedRecord().effective());
    }

    @Override
    public String toString() {
        return getSeedRecord() + " (" + algorithm + ")";
    }
}
