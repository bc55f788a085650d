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

import io.nosqlbench.cytosim.model.NormalCDF;
import org.apache.commons.rng.UniformRandomProvider;

/**
 * Truncated normal sampler using the inverse transform method.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 *   SETUP (once per sampler):
 *     a = (lower - μ) / σ,  b = (upper - μ) / σ
 *     Φ(a), Z = Φ(b) - Φ(a)
 *
 *   SAMPLING (per value):
 *     u  ~ U(0, 1)
 *     u' = Φ(a) + u · Z            maps (0,1) onto (Φ(a), Φ(b))
 *     x  = μ + σ · Φ⁻¹(u')         x ∈ [lower, upper]
 * }</pre>
 *
 * <p>Unlike clamping, this keeps the shape of the normal inside the bounds and
 * puts no probability mass outside them. Results are still clamped to the bounds
 * to absorb the error of the quantile approximation.
 */
public final class TruncatedNormalSampler implements ChannelSampler {

    private final double mean;
    private final double stdDev;
    private final double lower;
    private final double upper;
    private final double cdfAtLower;
    private final double cdfRange;
    private final UniformRandomProvider rng;

    /**
     * Creates a truncated normal sampler.
     *
     * @param mean the mean (μ) of the underlying normal
     * @param stdDev the standard deviation (σ) of the underlying normal
     * @param lower the lower bound; may be {@link Double#NEGATIVE_INFINITY}
     * @param upper the upper bound; may be {@link Double#POSITIVE_INFINITY}
     * @param rng the random stream to draw uniforms from
     * @throws IllegalArgumentException if stdDev ≤ 0, lower ≥ upper, or the bounds hold no mass
     */
    public TruncatedNormalSampler(double mean, double stdDev, double lower, double upper, UniformRandomProvider rng) {
        if (!(stdDev > 0)) {
            throw new IllegalArgumentException("Standard deviation must be positive, got: " + stdDev);
        }
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Lower bound must be less than upper bound: " + lower + " >= " + upper);
        }
        this.mean = mean;
        this.stdDev = stdDev;
        this.lower = lower;
        this.upper = upper;
        this.rng = rng;

        this.cdfAtLower = NormalCDF.cdf(lower, mean, stdDev);
        double cdfAtUpper = NormalCDF.cdf(upper, mean, stdDev);
        this.cdfRange = cdfAtUpper - cdfAtLower;

        if (cdfRange <= 0) {
            throw new IllegalArgumentException(
                "Truncation bounds [" + lower + ", " + upper + "] contain negligible probability mass "
                    + "for N(" + mean + ", " + stdDev + "²)");
        }
    }

    /**
     * Maps a unit-interval value to a truncated normal variate.
     *
     * @param u a value in the open interval (0, 1)
     * @return a variate in [lower, upper]
     */
    public double sample(double u) {
        double uPrime = cdfAtLower + u * cdfRange;
        uPrime = Math.min(Math.max(uPrime, Double.MIN_NORMAL), Math.nextDown(1.0));
        double x = mean + stdDev * InverseNormalCDF.standardNormalQuantile(uPrime);
        return Math.min(Math.max(x, lower), upper);
    }

    @Override
    public double sample() {
        return sample(openUnit(rng));
    }

    public double mean() {
        return mean;
    }

    public double stdDev() {
        return stdDev;
    }

    public double lower() {
        return lower;
    }

    public double upper() {
        return upper;
    }

    /// Draws a uniform value from the open interval (0, 1).
    static double openUnit(UniformRandomProvider rng) {
        double u;
        do {
            u = rng.nextDouble();
        } while (u == 0.0);
        return u;
    }
}
