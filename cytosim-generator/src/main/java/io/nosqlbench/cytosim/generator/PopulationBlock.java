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

import java.util.Objects;

/// Staging buffer holding the rows of one population while they are generated.
///
/// Blocks are mutable: the generator fills the channel columns, applies the
/// double-positive boost in place, and then hands the blocks to
/// [TableAssembler], which copies them into an immutable [CytometryTable].
public final class PopulationBlock {

    private final String population;
    private final double[][] columns;
    private final boolean[] doublePositive;

    /// Creates an empty block of `size` rows for a population.
    ///
    /// @param population the population label
    /// @param size the number of rows
    public PopulationBlock(String population, int size) {
        this.population = Objects.requireNonNull(population, "population cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Block size must not be negative, got: " + size);
        }
        this.columns = new double[Channel.values().length][size];
        this.doublePositive = new boolean[size];
    }

    public String population() {
        return population;
    }

    public int size() {
        return doublePositive.length;
    }

    /// Returns the live column for a channel; writes go straight into the block.
    ///
    /// @param channel the channel
    /// @return the backing array
    public double[] column(Channel channel) {
        return columns[channel.ordinal()];
    }

    /// Adds `offset` to one row of a channel, raising the result to `floor` if it falls short.
    public void boost(Channel channel, int row, double offset, double floor) {
        double[] column = columns[channel.ordinal()];
        column[row] = Math.max(column[row] + offset, floor);
    }

    public void markDoublePositive(int row) {
        doublePositive[row] = true;
    }

    public boolean isDoublePositive(int row) {
        return doublePositive[row];
    }

    /// @return how many rows are marked double-positive
    public int doublePositiveCount() {
        int count = 0;
        for (boolean flag : doublePositive) {
            if (flag) count++;
        }
        return count;
    }

    boolean[] doublePositiveFlags() {
        return doublePositive;
    }
}
