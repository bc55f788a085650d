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

package io.nosqlbench.cytosim.generator.sampling;

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Factory for the random streams that drive a simulation.
 *
 * <p>Based on Apache Commons RNG. A simulation draws every value from one
 * sequential stream, so the same seed, algorithm and parameters always yield
 * the same table.
 */
public final class RandomSources {

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiRo256++: 256-bit state, fast, excellent statistical quality. Default.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * XorShiRo128++: 128-bit state, for a smaller footprint.
         */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /**
         * SplitMix64: 64-bit state.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /**
         * Mersenne Twister: 19937-bit state, for comparison with other tools.
         */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomSources() {
    }

    /**
     * Creates a seeded stream.
     *
     * @param algorithm the PRNG algorithm
     * @param seed the seed
     * @return a restorable random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a seeded stream with the default algorithm.
     *
     * @param seed the seed
     * @return a restorable random provider
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates an unseeded stream; output differs on every run.
     *
     * @param algorithm the PRNG algorithm
     * @return a restorable random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create();
    }
}
