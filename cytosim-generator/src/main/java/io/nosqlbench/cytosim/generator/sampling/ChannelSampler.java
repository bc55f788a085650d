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

/// Sampler bound to one channel distribution and one random stream.
///
/// All distribution parameters are captured at construction, so drawing a value
/// needs no model reference:
///
/// ```java
/// ChannelSampler fsc = NormalChannelSampler.of(spec.channel(Channel.FSC), rng);
/// double value = fsc.sample();
/// ```
@FunctionalInterface
public interface ChannelSampler {

    /// Draws the next value.
    ///
    /// @return a variate from the bound distribution
    double sample();

    /// Fills an array with consecutive draws.
    ///
    /// @param target the array to fill
    default void fill(double[] target) {
        for (int i = 0; i < target.length; i++) {
            target[i] = sample();
        }
    }
}
