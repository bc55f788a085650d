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

import java.util.Objects;

/// Configuration options for a simulation run.
///
/// # Overview
///
/// GeneratorOptions gathers the constants of the population model that are not
/// per-population parameters:
/// - **Allocation policy**: how proportions become row counts
/// - **Double-positive boost**: the offset distribution for boosted events
/// - **Spillover**: the FL1/FL2 crosstalk coefficients
///
/// # Usage
///
/// ```java
/// // Defaults: ROUNDED, N(20, 5) boost, spillover 0.10 / 0.05
/// GeneratorOptions defaults = GeneratorOptions.defaults();
///
/// GeneratorOptions exact = GeneratorOptions.builder()
///     .allocationPolicy(AllocationPolicy.LARGEST_REMAINDER)
///     .spillover(new SpilloverCoefficients(0.2, 0.1))
///     .build();
/// ```
public final class GeneratorOptions {

    private final AllocationPolicy allocationPolicy;
    private final DoublePositiveSettings doublePositive;
    private final SpilloverCoefficients spillover;

    private GeneratorOptions(Builder builder) {
        this.allocationPolicy = builder.allocationPolicy;
        this.doublePositive = builder.doublePositive;
        this.spillover = builder.spillover;
    }

    /// @return the policy turning proportions into row counts
    public AllocationPolicy allocationPolicy() {
        return allocationPolicy;
    }

    /// @return the boost applied to double-positive events
    public DoublePositiveSettings doublePositive() {
        return doublePositive;
    }

    /// @return the spillover coefficients applied after assembly
    public SpilloverCoefficients spillover() {
        return spillover;
    }

    /// Returns the default options.
    ///
    /// @return ROUNDED allocation, default boost, default spillover
    public static GeneratorOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialized with these options' values.
    ///
    /// @return a pre-populated builder
    public Builder toBuilder() {
        return new Builder()
            .allocationPolicy(allocationPolicy)
            .doublePositive(doublePositive)
            .spillover(spillover);
    }

    @Override
    public String toString() {
        return "GeneratorOptions{" +
            "allocationPolicy=" + allocationPolicy +
            ", doublePositive=" + doublePositive +
            ", spillover=" + spillover +
            '}';
    }

    /// Builder for GeneratorOptions.
    public static final class Builder {
        private AllocationPolicy allocationPolicy = AllocationPolicy.ROUNDED;
        private DoublePositiveSettings doublePositive = DoublePositiveSettings.defaults();
        private SpilloverCoefficients spillover = SpilloverCoefficients.defaults();

        Builder() {
        }

        public Builder allocationPolicy(AllocationPolicy allocationPolicy) {
            this.allocationPolicy = Objects.requireNonNull(allocationPolicy, "allocationPolicy");
            return this;
        }

        public Builder doublePositive(DoublePositiveSettings doublePositive) {
            this.doublePositive = Objects.requireNonNull(doublePositive, "doublePositive");
            return this;
        }

        public Builder spillover(SpilloverCoefficients spillover) {
            this.spillover = Objects.requireNonNull(spillover, "spillover");
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(this);
        }
    }
}
