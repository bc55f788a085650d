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

import io.nosqlbench.cytosim.model.Channel;
import io.nosqlbench.cytosim.model.ChannelModel;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import io.nosqlbench.cytosim.model.PopulationSpec;

/// Renders the population registry as an aligned text table.
public final class RegistryFormatter {

    private RegistryFormatter() {
    }

    public static String format(PopulationRegistry registry) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-16s %10s", "Population", "proportion"));
        for (Channel channel : Channel.values()) {
            sb.append(String.format(" %15s", channel.columnName()));
        }
        sb.append(String.format(" %8s%n", "dbl-pos"));

        for (PopulationSpec spec : registry.snapshot()) {
            sb.append(String.format("%-16s %10.4f", spec.name(), spec.proportion()));
            for (Channel channel : Channel.values()) {
                ChannelModel model = spec.channel(channel);
                sb.append(String.format(" %15s", String.format("%.2f ± %.2f", model.mean(), model.stdDev())));
            }
            sb.append(String.format(" %8.3f%n", spec.doublePositiveFraction()));
        }

        double total = registry.proportionTotal();
        sb.append(String.format("%-16s %10.4f%s%n", "total", total,
            registry.isNormalized() ? "" : "  (proportions do not sum to 1)"));
        return sb.toString();
    }
}
