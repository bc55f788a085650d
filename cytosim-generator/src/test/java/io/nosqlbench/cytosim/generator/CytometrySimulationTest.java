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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CytometrySimulationTest {

    @Test
    void mixedTableIsSpilloverOfRawTable() {
        SimulationResult result = new CytometrySimulation()
            .run(PopulationRegistry.withDefaults(), 2000, RandomSources.create(21L));

        CytometryTable raw = result.raw();
        CytometryTable mixed = result.mixed();
        assertThat(result.rowCount()).isEqualTo(2000);
        assertThat(mixed.ranges()).isEqualTo(raw.ranges());
        for (int row = 0; row < raw.rowCount(); row += 97) {
            double fl1 = raw.value(Channel.FL1, row);
            double fl2 = raw.value(Channel.FL2, row);
            assertThat(mixed.value(Channel.FL1, row)).isCloseTo(fl1 + 0.10 * fl2, within(1e-9));
            assertThat(mixed.value(Channel.FL2, row)).isCloseTo(fl2 + 0.05 * fl1, within(1e-9));
            assertThat(mixed.value(Channel.FSC, row)).isEqualTo(raw.value(Channel.FSC, row));
        }
    }

    @Test
    void optionsFlowThroughToBothStages() {
        GeneratorOptions options = GeneratorOptions.builder()
            .spillover(SpilloverCoefficients.none())
            .allocationPolicy(AllocationPolicy.LARGEST_REMAINDER)
            .build();

        SimulationResult result = new CytometrySimulation(options)
            .run(PopulationRegistry.withDefaults(), 999, RandomSources.create(5L));

        assertThat(result.options()).isSameAs(options);
        assertThat(result.rowCount()).isEqualTo(999);
        assertThat(result.mixed().column(Channel.FL1)).containsExactly(result.raw().column(Channel.FL1));
    }

    @Test
    void generationFailuresPropagate() {
        CytometrySimulation simulation = new CytometrySimulation();
        assertThatThrownBy(() -> simulation.run(PopulationRegistry.withDefaults(), 0, RandomSources.create(1L)))
            .isInstanceOf(InvalidSampleCountException.class);
        assertThatThrownBy(() -> simulation.run(new PopulationRegistry(), 10, RandomSources.create(1L)))
            .isInstanceOf(EmptyRegistryException.class);
    }

    @Test
    void defaultOptions() {
        GeneratorOptions defaults = GeneratorOptions.defaults();
        assertThat(defaults.allocationPolicy()).isEqualTo(AllocationPolicy.ROUNDED);
        assertThat(defaults.spillover()).isEqualTo(SpilloverCoefficients.defaults());
        assertThat(defaults.doublePositive()).isEqualTo(DoublePositiveSettings.defaults());
        assertThat(defaults.toBuilder().build().spillover()).isEqualTo(defaults.spillover());
    }
}
