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

import java.util.ArrayList;
import java.util.List;

/// Concatenates per-population blocks into one [CytometryTable].
///
/// Blocks are copied in the order given, so each population's rows stay
/// contiguous and the table order follows the registry order. Empty blocks
/// keep a zero-length range so the population still appears in the table.
public final class TableAssembler {

    private TableAssembler() {
    }

    /// Assembles blocks into a table.
    ///
    /// @param blocks per-population blocks, in output order
    /// @return a new immutable table
    /// @throws IllegalArgumentException if two blocks carry the same population label
    public static CytometryTable assemble(List<PopulationBlock> blocks) {
        int total = 0;
        for (PopulationBlock block : blocks) {
            total += block.size();
        }

        double[][] columns = new double[Channel.values().length][total];
        boolean[] doublePositive = new boolean[total];
        List<CytometryTable.PopulationRange> ranges = new ArrayList<>(blocks.size());

        int offset = 0;
        for (PopulationBlock block : blocks) {
            for (CytometryTable.PopulationRange existing : ranges) {
                if (existing.population().equals(block.population())) {
                    throw new IllegalArgumentException("Duplicate population block: " + block.population());
                }
            }
            int size = block.size();
            for (Channel channel : Channel.values()) {
                System.arraycopy(block.column(channel), 0, columns[channel.ordinal()], offset, size);
            }
            System.arraycopy(block.doublePositiveFlags(), 0, doublePositive, offset, size);
            ranges.add(new CytometryTable.PopulationRange(block.population(), offset, offset + size));
            offset += size;
        }

        return new CytometryTable(columns, doublePositive, ranges);
    }
}
