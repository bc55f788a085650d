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

import io.nosqlbench.cytosim.generator.sampling.NormalChannelSampler;
import io.nosqlbench.cytosim.generator.sampling.TruncatedNormalSampler;
import io.nosqlbench.cytosim.model.Channel;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import io.nosqlbench.cytosim.model.PopulationSpec;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CombinationSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Draws the raw, pre-spillover events of every population.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 *   registry.snapshot()
 *        │
 *        ▼
 *   AllocationPolicy ──► n_p per population
 *        │
 *        ▼   for each population, in registry order
 *   ┌──────────────────────────────────────────────────────────┐
 *   │ 1. n_p draws of FSC, SSC, FL1, FL2 ~ N(mean, std)        │
 *   │ 2. pick round(fraction · n_p) rows without replacement   │
 *   │ 3. add a positive boost to FL1 and FL2 of those rows     │
 *   │ 4. label rows with the population name                   │
 *   └──────────────────────────────────────────────────────────┘
 *        │
 *        ▼
 *   TableAssembler ──► CytometryTable (contiguous blocks)
 * }</pre>
 *
 * <p>The generator is a pure function of the registry snapshot, the requested
 * total and the random stream. Every value is drawn from the one stream passed
 * in, so a seeded stream reproduces the same table.
 *
 * @see SpilloverTransform
 */
public final class SampleGenerator {

    private static final Logger logger = LogManager.getLogger(SampleGenerator.class);

    private final GeneratorOptions options;

    public SampleGenerator() {
        this(GeneratorOptions.defaults());
    }

    public SampleGenerator(GeneratorOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public GeneratorOptions options() {
        return options;
    }

    /**
     * Generates the pre-spillover table.
     *
     * @param registry the population parameters; snapshotted on entry
     * @param totalCount the requested number of events
     * @param random the random stream
     * @return a table with one contiguous block per population
     * @throws InvalidSampleCountException if totalCount is not positive
     * @throws EmptyRegistryException if the registry has no populations
     */
    public CytometryTable generate(PopulationRegistry registry, int totalCount, UniformRandomProvider random) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(random, "random cannot be null");
        if (totalCount <= 0) {
            throw new InvalidSampleCountException(totalCount);
        }
        List<PopulationSpec> populations = registry.snapshot();
        if (populations.isEmpty()) {
            throw new EmptyRegistryException();
        }

        int[] counts = options.allocationPolicy().allocate(populations, totalCount);
        int allocated = 0;
        for (int count : counts) {
            allocated += count;
        }
        if (allocated != totalCount) {
            logger.debug("allocated {} rows for a requested total of {} ({} policy)",
                allocated, totalCount, options.allocationPolicy());
        }

        List<PopulationBlock> blocks = new ArrayList<>(populations.size());
        for (int i = 0; i < populations.size(); i++) {
            PopulationSpec spec = populations.get(i);
            PopulationBlock block = sample(spec, counts[i], random);
            logger.debug("{}: {} rows, {} double-positive", spec.name(), block.size(), block.doublePositiveCount());
            blocks.add(block);
        }

        CytometryTable table = TableAssembler.assemble(blocks);
        logger.info("generated {} events from {} populations", table.rowCount(), populations.size());
        return table;
    }

    /**
     * Draws and boosts the rows of one population.
     *
     * @param spec the population
     * @param size the number of rows
     * @param random the random stream
     * @return a filled block
     */
    public PopulationBlock sample(PopulationSpec spec, int size, UniformRandomProvider random) {
        PopulationBlock block = new PopulationBlock(spec.name(), size);
        for (Channel channel : Channel.values()) {
            NormalChannelSampler.of(spec.channel(channel), random).fill(block.column(channel));
        }
        applyDoublePositive(block, spec, random);
        return block;
    }

    /**
     * Boosts FL1 and FL2 of a uniformly chosen subset of rows. A boosted value
     * never ends below the channel mean plus the minimum boost.
     *
     * @param block the rows to modify in place
     * @param spec the population the rows were drawn from
     * @param random the random stream
     * @return the boosted row indices
     */
    int[] applyDoublePositive(PopulationBlock block, PopulationSpec spec, UniformRandomProvider random) {
        int size = block.size();
        int selected = doublePositiveCount(spec.doublePositiveFraction(), size);
        if (selected == 0) {
            return new int[0];
        }
        int[] rows = new CombinationSampler(random, size, selected).sample();

        DoublePositiveSettings boost = options.doublePositive();
        TruncatedNormalSampler offsets = new TruncatedNormalSampler(
            boost.boostMean(), boost.boostStdDev(), boost.minimumBoost(), Double.POSITIVE_INFINITY, random);
        double fl1Floor = spec.channel(Channel.FL1).mean() + boost.minimumBoost();
        double fl2Floor = spec.channel(Channel.FL2).mean() + boost.minimumBoost();
        for (int row : rows) {
            block.boost(Channel.FL1, row, offsets.sample(), fl1Floor);
            block.boost(Channel.FL2, row, offsets.sample(), fl2Floor);
            block.markDoublePositive(row);
        }
        return rows;
    }

    /**
     * Number of double-positive rows for a population of the given size.
     *
     * @param fraction the double-positive fraction
     * @param size the population size
     * @return {@code round(fraction × size)}, at most size
     */
    public static int doublePositiveCount(double fraction, int size) {
        return (int) Math.min(size, Math.round(fraction * size));
    }
}
