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

package io.nosqlbench.cytosim.model;

import java.util.Objects;

/**
 * Normal distribution of one channel within one cell population.
 *
 * <h2>Purpose</h2>
 *
 * <p>Every population draws each of its four channels from an independent
 * normal distribution N(μ, σ²). This class holds those two parameters and the
 * density functions used by tests and plots to compare generated data against
 * the configured shape.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ChannelModel fsc = new ChannelModel(8.0, 1.5);
 * double p = fsc.cdf(9.5);   // ≈ 0.841
 * }</pre>
 *
 * @see PopulationSpec#channel(Channel)
 */
public final class ChannelModel {

    private final double mean;
    private final double stdDev;

    /**
     * Constructs a channel model.
     *
     * @param mean the mean (μ); must be finite
     * @param stdDev the standard deviation (σ); must be positive and finite
     * @throws IllegalArgumentException if either parameter is out of range
     */
    public ChannelModel(double mean, double stdDev) {
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("Mean must be finite, got: " + mean);
        }
        if (!(stdDev > 0) || !Double.isFinite(stdDev)) {
            throw new IllegalArgumentException("Standard deviation must be positive, got: " + stdDev);
        }
        this.mean = mean;
        this.stdDev = stdDev;
    }

    /**
     * Returns the mean of this channel distribution.
     * @return the mean (μ)
     */
    public double mean() {
        return mean;
    }

    /**
     * Returns the standard deviation of this channel distribution.
     * @return the standard deviation (σ)
     */
    public double stdDev() {
        return stdDev;
    }

    /**
     * Computes the cumulative probability P(X ≤ x).
     * @param x the value at which to evaluate the CDF
     * @return the cumulative probability, in range [0, 1]
     */
    public double cdf(double x) {
        return NormalCDF.cdf(x, mean, stdDev);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelModel)) return false;
        ChannelModel that = (ChannelModel) o;
        return Double.compare(that.mean, mean) == 0 && Double.compare(that.stdDev, stdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev);
    }

    @Override
    public String toString() {
        return "N(" + mean + ", " + stdDev + ")";
    }
}
