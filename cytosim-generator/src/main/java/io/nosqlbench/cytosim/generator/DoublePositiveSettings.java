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

package io.nosqlbench.cytosim.generator;

/// Distribution of the extra FL1/FL2 signal given to double-positive events.
///
/// Each boosted event gets two independent offsets, one for FL1 and one for FL2,
/// drawn from N(boostMean, boostStdDev²) truncated to [minimumBoost, +∞). The
/// floor keeps every offset strictly positive, so a boosted event always gains
/// signal on both channels.
///
/// The share of boosted events is a per-population parameter
/// (`double_positive_fraction`, default 0.10); this record only shapes the boost.
///
/// @param boostMean mean of the offset distribution
/// @param boostStdDev standard deviation of the offset distribution
/// @param minimumBoost smallest allowed offset; must be positive
public record DoublePositiveSettings(double boostMean, double boostStdDev, double minimumBoost) {

    public static final double DEFAULT_BOOST_MEAN = 20.0;
    public static final double DEFAULT_BOOST_STD_DEV = 5.0;
    public static final double DEFAULT_MINIMUM_BOOST = 0.5;

    public DoublePositiveSettings {
        if (!Double.isFinite(boostMean)) {
            throw new IllegalArgumentException("Boost mean must be finite, got: " + boostMean);
        }
        if (!(boostStdDev > 0) || !Double.isFinite(boostStdDev)) {
            throw new IllegalArgumentException("Boost standard deviation must be positive, got: " + boostStdDev);
        }
        if (!(minimumBoost > 0) || !Double.isFinite(minimumBoost)) {
            throw new IllegalArgumentException("Minimum boost must be positive, got: " + minimumBoost);
        }
    }

    /// @return N(20, 5) offsets with a 0.5 floor
    public static DoublePositiveSettings defaults() {
        return new DoublePositiveSettings(DEFAULT_BOOST_MEAN, DEFAULT_BOOST_STD_DEV, DEFAULT_MINIMUM_BOOST);
    }
}
