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

import io.nosqlbench.cytosim.model.PopulationSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * How a requested total is split into per-population row counts.
 *
 * <p>Proportions are independent shares of the total and are not required to
 * sum to 1.
 *
 * <pre>{@code
 *   proportions 0.6 / 0.3 / 0.1, total 1000   → 600 / 300 / 100  (both policies)
 *   proportions 1/3 / 1/3 / 1/3, total 10
 *     ROUNDED            → 3 / 3 / 3   (sum 9, drift accepted)
 *     LARGEST_REMAINDER  → 4 / 3 / 3   (sum 10)
 * }</pre>
 */
public enum AllocationPolicy {

    /**
     * {@code n = round(proportion × total)} per population. The sum may drift
     * from the requested total by rounding; the drift is accepted.
     */
    ROUNDED {
        @Override
        public int[] allocate(List<PopulationSpec> populations, int total) {
            int[] counts = new int[populations.size()];
            for (int i = 0; i < counts.length; i++) {
                counts[i] = (int) Math.round(populations.get(i).proportion() * total);
            }
            return counts;
        }
    },

    /**
     * Floors each share, then hands the leftover rows to the largest fractional
     * remainders (earlier populations win ties), so the counts sum to
     * {@code round(Σ proportion × total)} exactly. For normalized proportions
     * that is the requested total.
     */
    LARGEST_REMAINDER {
        @Override
        public int[] allocate(List<PopulationSpec> populations, int total) {
            int size = populations.size();
            int[] counts = new int[size];
            double[] remainders = new double[size];
            double exactTotal = 0.0;
            long floored = 0;
            for (int i = 0; i < size; i++) {
                double exact = populations.get(i).proportion() * total;
                exactTotal += exact;
                counts[i] = (int) Math.floor(exact);
                remainders[i] = exact - counts[i];
                floored += counts[i];
            }
            long leftover = Math.round(exactTotal) - floored;

            List<Integer> order = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                order.add(i);
            }
            order.sort(Comparator.comparingDouble((Integer i) -> remainders[i]).reversed()
                .thenComparingInt(i -> i));
            for (int k = 0; k < leftover && k < size; k++) {
                counts[order.get(k)]++;
            }
            return counts;
        }
    };

    /**
     * Computes per-population row counts.
     *
     * @param populations the populations, in registry order
     * @param total the requested total, positive
     * @return one count per population, same order
     */
    public abstract int[] allocate(List<PopulationSpec> populations, int total);
}
