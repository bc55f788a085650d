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

import io.nosqlbench.cytosim.generator.sampling.RandomSources;
import io.nosqlbench.cytosim.model.Channel;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import io.nosqlbench.cytosim.model.PopulationSpec;
import io.nosqlbench.cytosim.model.stats.ChannelStatistics;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SampleGeneratorTest {

    private final SampleGenerator generator = new SampleGenerator();

    @Test
    void defaultPopulationsAreAllocatedInRegistryOrder() {
        CytometryTable table = generator.generate(PopulationRegistry.withDefaults(), 1000, RandomSources.create(42L));

        assertThat(table.rowCount()).isEqualTo(1000);
        assertThat(table.populations()).containsExactly("lymphocytes", "monocytes", "granulocytes");
        assertThat(table.ranges()).containsExactly(
            new CytometryTable.PopulationRange("lymphocytes", 0, 600),
            new CytometryTable.PopulationRange("monocytes", 600, 900),
            new CytometryTable.PopulationRange("granulocytes", 900, 1000));
        assertThat(table.population(0)).isEqualTo("lymphocytes");
        assertThat(table.population(599)).isEqualTo("lymphocytes");
        assertThat(table.population(600)).isEqualTo("monocytes");
        assertThat(table.population(999)).isEqualTo("granulocytes");
    }

    @Test
    void singlePopulationFillsEveryRow() {
        PopulationRegistry registry = new PopulationRegistry(List.of(
            PopulationSpec.builder("blasts").proportion(1.0).channel(Channel.FSC, 12, 2).build()));

        CytometryTable table = generator.generate(registry, 500, RandomSources.create(1L));

        assertThat(table.rowCount()).isEqualTo(500);
        for (int row = 0; row < table.rowCount(); row++) {
            assertThat(table.population(row)).isEqualTo("blasts");
        }
    }

    @Test
    void channelMomentsConvergeToConfiguredModel() {
        PopulationSpec spec = PopulationSpec.builder("lymphocytes").proportion(1.0)
            .channel(Channel.FSC, 8, 1.5)
            .channel(Channel.SSC, 15, 2)
            .channel(Channel.FL1, 30, 5)
            .channel(Channel.FL2, 10, 2)
            .doublePositiveFraction(0.0)
            .build();
        CytometryTable table = generator.generate(new PopulationRegistry(List.of(spec)), 100_000,
            RandomSources.create(7L));

        for (Channel channel : Channel.values()) {
            ChannelStatistics stats = ChannelStatistics.compute(channel, table.column(channel));
            double mean = spec.channel(channel).mean();
            double sd = spec.channel(channel).stdDev();
            assertThat(stats.mean()).as("%s mean", channel).isCloseTo(mean, within(mean * 0.02));
            assertThat(stats.stdDev()).as("%s sd", channel).isCloseTo(sd, within(sd * 0.03));
        }
    }

    @Test
    void doublePositiveSubsetIsRoundedFractionOfEachPopulation() {
        CytometryTable table = generator.generate(PopulationRegistry.withDefaults(), 1000, RandomSources.create(3L));

        for (CytometryTable.PopulationRange range : table.ranges()) {
            int flagged = 0;
            for (int row = range.start(); row < range.end(); row++) {
                if (table.isDoublePositive(row)) flagged++;
            }
            assertThat(flagged).as(range.population()).isEqualTo(Math.round(0.10 * range.size()));
        }
        assertThat(table.doublePositiveCount()).isEqualTo(100);
    }

    @Test
    void doublePositiveRowsGainFluorescenceOnly() {
        PopulationSpec spec = PopulationSpec.builder("cd4").proportion(1.0)
            .channel(Channel.FSC, 10, 1)
            .channel(Channel.SSC, 20, 1)
            .channel(Channel.FL1, 30, 1)
            .channel(Channel.FL2, 10, 1)
            .doublePositiveFraction(0.2)
            .build();
        CytometryTable table = generator.generate(new PopulationRegistry(List.of(spec)), 5000,
            RandomSources.create(11L));

        assertThat(table.doublePositiveCount()).isEqualTo(1000);
        for (Channel channel : Channel.values()) {
            double gain = mean(table, channel, true) - mean(table, channel, false);
            if (channel.isFluorescence()) {
                assertThat(gain).as("%s gain", channel).isCloseTo(20.0, within(1.0));
            } else {
                assertThat(gain).as("%s gain", channel).isCloseTo(0.0, within(0.2));
            }
        }
    }

    @Test
    void everyDoublePositiveRowExceedsPopulationMeans() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        CytometryTable table = generator.generate(registry, 100_000, RandomSources.create(42L));

        assertThat(table.doublePositiveCount()).isEqualTo(10_000);
        assertBoostedRowsAboveMeans(table, registry);
    }

    @Test
    void wideFluorescenceSpreadStillLiftsEveryBoostedRow() {
        PopulationRegistry registry = new PopulationRegistry(List.of(
            PopulationSpec.builder("dim").proportion(1.0)
                .channel(Channel.FL1, 5, 40)
                .channel(Channel.FL2, 3, 25)
                .doublePositiveFraction(0.5)
                .build()));
        CytometryTable table = generator.generate(registry, 20_000, RandomSources.create(13L));

        assertThat(table.doublePositiveCount()).isEqualTo(10_000);
        assertBoostedRowsAboveMeans(table, registry);
    }

    @Test
    void fractionBoundsSelectNoneOrAll() {
        PopulationRegistry none = new PopulationRegistry(List.of(
            PopulationSpec.builder("a").doublePositiveFraction(0.0).build()));
        assertThat(generator.generate(none, 300, RandomSources.create(5L)).doublePositiveCount()).isZero();

        PopulationRegistry all = new PopulationRegistry(List.of(
            PopulationSpec.builder("a").doublePositiveFraction(1.0).build()));
        assertThat(generator.generate(all, 300, RandomSources.create(5L)).doublePositiveCount()).isEqualTo(300);
    }

    @Test
    void sameSeedReproducesTable() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        CytometryTable first = generator.generate(registry, 2000, RandomSources.create(99L));
        CytometryTable second = generator.generate(registry, 2000, RandomSources.create(99L));
        CytometryTable other = generator.generate(registry, 2000, RandomSources.create(100L));

        for (Channel channel : Channel.values()) {
            assertThat(second.column(channel)).containsExactly(first.column(channel));
        }
        assertThat(other.column(Channel.FSC)).isNotEqualTo(first.column(Channel.FSC));
    }

    @Test
    void tinyPopulationKeepsAnEmptyBlock() {
        PopulationRegistry registry = new PopulationRegistry(List.of(
            PopulationSpec.builder("major").proportion(0.999).build(),
            PopulationSpec.builder("rare").proportion(0.001).build()));

        CytometryTable table = generator.generate(registry, 100, RandomSources.create(2L));

        assertThat(table.rowCount()).isEqualTo(100);
        assertThat(table.populations()).containsExactly("major", "rare");
        assertThat(table.count("rare")).isZero();
    }

    @Test
    void roundedAllocationAcceptsDriftWhileLargestRemainderDoesNot() {
        double third = 1.0 / 3.0;
        PopulationRegistry registry = new PopulationRegistry(List.of(
            PopulationSpec.builder("a").proportion(third).build(),
            PopulationSpec.builder("b").proportion(third).build(),
            PopulationSpec.builder("c").proportion(third).build()));

        assertThat(generator.generate(registry, 100, RandomSources.create(4L)).rowCount()).isEqualTo(99);

        SampleGenerator exact = new SampleGenerator(GeneratorOptions.builder()
            .allocationPolicy(AllocationPolicy.LARGEST_REMAINDER).build());
        CytometryTable table = exact.generate(registry, 100, RandomSources.create(4L));
        assertThat(table.rowCount()).isEqualTo(100);
        assertThat(table.count("a")).isEqualTo(34);
    }

    @Test
    void unnormalizedProportionsAreUsedAsGiven() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        registry.update("lymphocytes", "proportion", 0.9);

        CytometryTable table = generator.generate(registry, 1000, RandomSources.create(8L));

        assertThat(table.count("lymphocytes")).isEqualTo(900);
        assertThat(table.rowCount()).isEqualTo(1300);
    }

    @Test
    void rejectsNonPositiveCounts() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        assertThatThrownBy(() -> generator.generate(registry, 0, RandomSources.create(1L)))
            .isInstanceOf(InvalidSampleCountException.class);
        assertThatThrownBy(() -> generator.generate(registry, -5, RandomSources.create(1L)))
            .isInstanceOf(InvalidSampleCountException.class)
            .hasMessageContaining("-5");
    }

    @Test
    void rejectsEmptyRegistry() {
        assertThatThrownBy(() -> generator.generate(new PopulationRegistry(), 100, RandomSources.create(1L)))
            .isInstanceOf(EmptyRegistryException.class);
    }

    @Test
    void doublePositiveCountRounds() {
        assertThat(SampleGenerator.doublePositiveCount(0.1, 600)).isEqualTo(60);
        assertThat(SampleGenerator.doublePositiveCount(0.1, 5)).isEqualTo(1);
        assertThat(SampleGenerator.doublePositiveCount(0.1, 4)).isZero();
        assertThat(SampleGenerator.doublePositiveCount(1.0, 7)).isEqualTo(7);
    }

    private static void assertBoostedRowsAboveMeans(CytometryTable table, PopulationRegistry registry) {
        for (CytometryTable.PopulationRange range : table.ranges()) {
            PopulationSpec spec = registry.get(range.population());
            double fl1Mean = spec.channel(Channel.FL1).mean();
            double fl2Mean = spec.channel(Channel.FL2).mean();
            for (int row = range.start(); row < range.end(); row++) {
                if (table.isDoublePositive(row)) {
                    assertThat(table.value(Channel.FL1, row)).as("FL1 row %d", row).isGreaterThan(fl1Mean);
                    assertThat(table.value(Channel.FL2, row)).as("FL2 row %d", row).isGreaterThan(fl2Mean);
                }
            }
        }
    }

    private static double mean(CytometryTable table, Channel channel, boolean doublePositive) {
        List<Double> values = new ArrayList<>();
        for (int row = 0; row < table.rowCount(); row++) {
            if (table.isDoublePositive(row) == doublePositive) {
                values.add(table.value(channel, row));
            }
        }
        return values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }
}
