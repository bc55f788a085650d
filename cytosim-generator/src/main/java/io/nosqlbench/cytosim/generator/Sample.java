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

import io.nosqlbench.cytosim.model.Channel;

/// One simulated event: four channel readings and the population it came from.
///
/// @param fsc forward scatter
/// @param ssc side scatter
/// @param fl1 first fluorescence channel
/// @param fl2 second fluorescence channel
/// @param population the population label
/// @param doublePositive whether this event received the double-positive boost
public record Sample(double fsc, double ssc, double fl1, double fl2, String population, boolean doublePositive) {

    /// Reads one channel.
    ///
    /// @param channel the channel
    /// @return the reading
    public double value(Channel channel) {
        switch (channel) {
            case FSC: return fsc;
            case SSC: return ssc;
            case FL1: return fl1;
            case FL2: return fl2;
            default: throw new IllegalArgumentException("Unknown channel: " + channel);
        }
    }
}
