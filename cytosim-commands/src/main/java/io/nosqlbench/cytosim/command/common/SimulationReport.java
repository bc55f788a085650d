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

import io.nosqlbench.cytosim.generator.CytometryTable;
import io.nosqlbench.cytosim.generator.SimulationResult;
import io.nosqlbench.cytosim.model.Channel;
import io.nosqlbench.cytosim.model.stats.ChannelStatistics;

import java.io.PrintWriter;

/// Text summary of a simulation run: row totals, per-population counts and
/// shares, and per-population channel statistics of the reported (mixed) table.
public final class SimulationReport {

    private SimulationReport() {
    }

    /// Prints the summary.
    ///
    /// @param out destination
    /// @param result the run to describe
    /// @param requested the requested event count
    public static void print(PrintWriter out, SimulationResult result, int requested) {
        CytometryTable table = result.mixed();
        out.printf("Simulated %,d events (requested %,d)%n", table.rowCount(), requested);
        out.printf("Spillover: FL2->FL1 %.3f, FL1->FL2 %.3f%n",
            result.options().spillover().fl2IntoFl1(), result.options().spillover().fl1IntoFl2());
        out.println();

        out.printf("%-16s %10s %9s %10s%n", "Population", "Count", "Share", "Dbl-Pos");
        for (CytometryTable.PopulationRange range : table.ranges()) {
            int doublePositive = 0;
            for (int row = range.start(); row < range.end(); row++) {
                if (table.isDoublePositive(row)) doublePositive++;
            }
            double share = table.rowCount() > 0 ? 100.0 * range.size() / table.rowCount() : 0.0;
            out.printf("%-16s %,10d %8.2f%% %,10d%n", range.population(), range.size(), share, doublePositive);
        }
        out.println();

        out.printf("%-16s", "mean ± sd");
        for (Channel channel : Channel.values()) {
            out.printf(" %17s", channel.columnName());
        }
        out.println();
        for (String population : table.populations()) {
            if (table.count(population) == 0) {
                continue;
            }
            out.printf("%-16s", population);
            for (Channel channel : Channel.values()) {
                ChannelStatistics stats = ChannelStatistics.compute(channel, table.column(channel, population));
                out.printf(" %17s", String.format("%.2f ± %.2f", stats.mean(), stats.stdDev()));
            }
            out.println();
        }
        out.flush();
    }
}
