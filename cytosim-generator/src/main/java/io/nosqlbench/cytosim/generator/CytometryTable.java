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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, columnar table of simulated events.
 *
 * <h2>Layout</h2>
 *
 * <pre>{@code
 *   row   FSC     SSC     FL1     FL2     Population
 *   0     8.41    14.2    31.7    9.86    lymphocytes   ┐
 *   ...                                                 │ contiguous block,
 *   599   7.02    16.9    28.1    11.3    lymphocytes   ┘ registry order
 *   600   14.8    24.6    63.0    29.4    monocytes     ┐
 *   ...                                                 ┘
 * }</pre>
 *
 * <p>Columns are addressed by {@link Channel} and have the stable names
 * {@link #COLUMN_NAMES}. Each population's rows are contiguous and appear in the
 * order of the registry that produced them; {@link #ranges()} exposes the block
 * boundaries. A per-row double-positive flag records which events were boosted,
 * which gating tests can use as ground truth.
 *
 * <p>Accessors that return arrays return copies, so a table can be shared freely
 * and transforms such as {@link SpilloverTransform} always produce a new table.
 */
public final class CytometryTable {

    /** Column names in display order. */
    public static final List<String> COLUMN_NAMES = List.of("FSC", "SSC", "FL1", "FL2", "Population");

    /**
     * Row range [start, end) occupied by one population.
     *
     * @param population the population label
     * @param start first row, inclusive
     * @param end last row, exclusive
     */
    public record PopulationRange(String population, int start, int end) {
        public int size() {
            return end - start;
        }
    }

    private final double[][] columns;
    private final boolean[] doublePositive;
    private final List<PopulationRange> ranges;
    private final int rowCount;

    CytometryTable(double[][] columns, boolean[] doublePositive, List<PopulationRange> ranges) {
        this.columns = columns;
        this.doublePositive = doublePositive;
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
        this.rowCount = doublePositive.length;
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * Returns a copy of one channel column.
     * @param channel the channel
     * @return all values of that channel, in row order
     */
    public double[] column(Channel channel) {
        return columns[channel.ordinal()].clone();
    }

    /**
     * Returns a copy of one channel column restricted to one population.
     * @param channel the channel
     * @param population the population label
     * @return the population's values of that channel
     * @throws IllegalArgumentException if the population is not in this table
     */
    public double[] column(Channel channel, String population) {
        PopulationRange range = range(population)
            .orElseThrow(() -> new IllegalArgumentException("Population not in table: " + population));
        double[] slice = new double[range.size()];
        System.arraycopy(columns[channel.ordinal()], range.start(), slice, 0, range.size());
        return slice;
    }

    /**
     * Reads a single cell.
     * @param channel the channel
     * @param row the row index
     * @return the value
     */
    public double value(Channel channel, int row) {
        checkRow(row);
        return columns[channel.ordinal()][row];
    }

    /**
     * Returns the population label of a row.
     * @param row the row index
     * @return the population label
     */
    public String population(int row) {
        checkRow(row);
        for (PopulationRange range : ranges) {
            if (row < range.end()) {
                return range.population();
            }
        }
        throw new IllegalStateException("Row " + row + " is not covered by any population range");
    }

    public boolean isDoublePositive(int row) {
        checkRow(row);
        return doublePositive[row];
    }

    /**
     * Returns one row as a {@link Sample}.
     * @param row the row index
     * @return the sample
     */
    public Sample row(int row) {
        checkRow(row);
        return new Sample(
            columns[Channel.FSC.ordinal()][row],
            columns[Channel.SSC.ordinal()][row],
            columns[Channel.FL1.ordinal()][row],
            columns[Channel.FL2.ordinal()][row],
            population(row),
            doublePositive[row]);
    }

    /**
     * @return every row, in order
     */
    public List<Sample> rows() {
        List<Sample> rows = new ArrayList<>(rowCount);
        for (PopulationRange range : ranges) {
            for (int row = range.start(); row < range.end(); row++) {
                rows.add(new Sample(
                    columns[Channel.FSC.ordinal()][row],
                    columns[Channel.SSC.ordinal()][row],
                    columns[Channel.FL1.ordinal()][row],
                    columns[Channel.FL2.ordinal()][row],
                    range.population(),
                    doublePositive[row]));
            }
        }
        return rows;
    }

    /**
     * @return the population block boundaries, in row order
     */
    public List<PopulationRange> ranges() {
        return ranges;
    }

    /**
     * @return the population labels, in row order
     */
    public List<String> populations() {
        List<String> names = new ArrayList<>(ranges.size());
        for (PopulationRange range : ranges) {
            names.add(range.population());
        }
        return names;
    }

    /**
     * Finds the row range of a population.
     * @param population the population label
     * @return the range, or empty if the population has no block in this table
     */
    public Optional<PopulationRange> range(String population) {
        for (PopulationRange range : ranges) {
            if (range.population().equals(population)) {
                return Optional.of(range);
            }
        }
        return Optional.empty();
    }

    /**
     * @param population the population label
     * @return the number of rows of that population, 0 if absent
     */
    public int count(String population) {
        return range(population).map(PopulationRange::size).orElse(0);
    }

    /**
     * @return the number of rows flagged double-positive
     */
    public int doublePositiveCount() {
        int count = 0;
        for (boolean flag : doublePositive) {
            if (flag) count++;
        }
        return count;
    }

    /**
     * Returns a table with the same scatter columns, labels and flags but new
     * fluorescence columns. The arrays are adopted without copying.
     */
    CytometryTable withFluorescence(double[] fl1, double[] fl2) {
        if (fl1.length != rowCount || fl2.length != rowCount) {
            throw new IllegalArgumentException("Fluorescence columns must have " + rowCount + " rows");
        }
        double[][] replaced = new double[columns.length][];
        replaced[Channel.FSC.ordinal()] = columns[Channel.FSC.ordinal()];
        replaced[Channel.SSC.ordinal()] = columns[Channel.SSC.ordinal()];
        replaced[Channel.FL1.ordinal()] = fl1;
        replaced[Channel.FL2.ordinal()] = fl2;
        return new CytometryTable(replaced, doublePositive, ranges);
    }

    double[] columnView(Channel channel) {
        return columns[channel.ordinal()];
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + rowCount + ")");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CytometryTable{rows=").append(rowCount);
        for (PopulationRange range : ranges) {
            sb.append(", ").append(range.population()).append('=').append(range.size());
        }
        return sb.append('}').toString();
    }
}
