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

import io.nosqlbench.cytosim.model.PopulationRegistry;
import io.nosqlbench.cytosim.model.PopulationSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AllocationPolicyTest {

    @Test
    void roundedDefaults() {
        List<PopulationSpec> populations = PopulationRegistry.defaultPopulations();
        assertThat(AllocationPolicy.ROUNDED.allocate(populations, 1000)).containsExactly(600, 300, 100);
        assertThat(AllocationPolicy.ROUNDED.allocate(populations, 10)).containsExactly(6, 3, 1);
    }

    @Test
    void roundedMayOvershoot() {
        List<PopulationSpec> halves = List.of(
            PopulationSpec.builder("a").proportion(0.5).build(),
            PopulationSpec.builder("b").proportion(0.5).build());
        // round(0.5) is 1 for each
        assertThat(AllocationPolicy.ROUNDED.allocate(halves, 1)).containsExactly(1, 1);
        assertThat(AllocationPolicy.LARGEST_REMAINDER.allocate(halves, 1)).containsExactly(1, 0);
    }

    @Test
    void largestRemainderSumsToTotal() {
        List<PopulationSpec> populations = List.of(
            PopulationSpec.builder("a").proportion(0.45).build(),
            PopulationSpec.builder("b").proportion(0.35).build(),
            PopulationSpec.builder("c").proportion(0.2).build());
        for (int total : new int[] {1, 7, 13, 99, 1001}) {
            int[] counts = AllocationPolicy.LARGEST_REMAINDER.allocate(populations, total);
            assertThat(counts[0] + counts[1] + counts[2]).as("total %d", total).isEqualTo(total);
        }
        assertThat(AllocationPolicy.LARGEST_REMAINDER.allocate(populations, 7)).containsExactly(3, 3, 1);
    }
}
