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

import io.nosqlbench.cytosim.model.ChannelModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

/// Normal sampler for one channel, bound at construction.
///
/// Draws come from a commons-rng [GaussianSampler] over the ziggurat
/// standard-normal sampler, consuming the shared random stream.
public final class NormalChannelSampler implements ChannelSampler {

    private final double mean;
    private final double stdDev;
    private final ContinuousSampler delegate;

    private NormalChannelSampler(ChannelModel model, UniformRandomProvider rng) {
        this.mean = model.mean();
        this.stdDev = model.stdDev();
        this.delegate = GaussianSampler.of(ZigguratSampler.NormalizedGaussian.of(rng), mean, stdDev);
    }

    /// Creates a sampler for the given channel model.
    ///
    /// @param model the channel distribution
    /// @param rng the random stream to draw from
    /// @return a bound sampler
    public static NormalChannelSampler of(ChannelModel model, UniformRandomProvider rng) {
        return new NormalChannelSampler(model, rng);
    }

    @Override
    public double sample() {
        return delegate.sample();
    }

    public double mean() {
        return mean;
    }

    public double stdDev() {
        return stdDev;
    }
}
