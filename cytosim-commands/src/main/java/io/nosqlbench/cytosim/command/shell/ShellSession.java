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

package io.nosqlbench.cytosim.command.shell;

import io.nosqlbench.cytosim.generator.CytometrySimulation;
import io.nosqlbench.cytosim.generator.GeneratorOptions;
import io.nosqlbench.cytosim.generator.SimulationResult;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Objects;
import java.util.Optional;

/// State carried across commands of one interactive session: the registry
/// being edited, the generator options, one random stream, and the last run.
public final class ShellSession {

    public static final int DEFAULT_COUNT = 10_000;

    private final PopulationRegistry registry;
    private final GeneratorOptions options;
    private UniformRandomProvider random;
    private SimulationResult lastResult;

    public ShellSession(PopulationRegistry registry, GeneratorOptions options, UniformRandomProvider random) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    public PopulationRegistry registry() {
        return registry;
    }

    public GeneratorOptions options() {
        return options;
    }

    /// Replaces the random stream, e.g. after a `seed` command.
    public void random(UniformRandomProvider random) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /// Runs a simulation against the current registry and remembers it.
    ///
    /// @param count the requested number of events
    /// @return the new result
    public SimulationResult simulate(int count) {
        SimulationResult result = new CytometrySimulation(options).run(registry, count, random);
        lastResult = result;
        return result;
    }

    public Optional<SimulationResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }
}
