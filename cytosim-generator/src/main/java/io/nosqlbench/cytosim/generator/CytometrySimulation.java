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
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Objects;

/// Runs the full pipeline: sample generation followed by spillover.
///
/// ```java
/// CytometrySimulation simulation = new CytometrySimulation(GeneratorOptions.defaults());
/// SimulationResult result = simulation.run(registry, 10_000, RandomSources.create(42L));
/// CytometryTable table = result.mixed();
/// ```
///
/// Failures from either stage propagate unchanged and no partial result is returned.
public final class CytometrySimulation {

    private final GeneratorOptions options;
    private final SampleGenerator generator;
    private final SpilloverTransform spillover;

    public CytometrySimulation() {
        this(GeneratorOptions.defaults());
    }

    public CytometrySimulation(GeneratorOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.generator = new SampleGenerator(options);
        this.spillover = new SpilloverTransform(options.spillover());
    }

    public GeneratorOptions options() {
        return options;
    }

    /// Generates a table and applies spillover.
    ///
    /// @param registry the population parameters
    /// @param totalCount the requested number of events
    /// @param random the random stream
    /// @return the raw and mixed tables
    /// @throws InvalidSampleCountException if totalCount is not positive
    /// @throws EmptyRegistryException if the registry is empty
    public SimulationResult run(PopulationRegistry registry, int totalCount, UniformRandomProvider random) {
        CytometryTable raw = generator.generate(registry, totalCount, random);
        CytometryTable mixed = spillover.apply(raw);
        return new SimulationResult(raw, mixed, options);
    }
}
