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

package io.nosqlbench.cytosim.command;

import io.nosqlbench.cytosim.command.common.GeneratorOptionsMixin;
import io.nosqlbench.cytosim.command.common.PopulationsOption;
import io.nosqlbench.cytosim.command.common.RandomSeedOption;
import io.nosqlbench.cytosim.command.common.SimulationReport;
import io.nosqlbench.cytosim.generator.CytometrySimulation;
import io.nosqlbench.cytosim.generator.SimulationResult;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Generate a synthetic event table and print its summary.
///
/// ## Usage
///
/// ```bash
/// cytosim simulate --count 10000 --seed 42
/// cytosim simulate -n 50000 --populations panel.json --allocation LARGEST_REMAINDER
/// cytosim simulate -n 1000 --fl2-into-fl1 0.2 --fl1-into-fl2 0.1
/// ```
@CommandLine.Command(
    name = "simulate",
    header = "Generate synthetic flow cytometry events",
    description = "Draws events for each population, applies the double-positive boost and "
        + "fluorescence spillover, and prints per-population counts and channel statistics.",
    exitCodeList = {
        "0: Success",
        "1: Invalid parameters or input file"
    }
)
public class CMD_simulate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_simulate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 1;

    @CommandLine.Option(
        names = {"-n", "--count"},
        description = "Number of events to generate (default: ${DEFAULT-VALUE})",
        defaultValue = "10000"
    )
    private int count = 10000;

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private PopulationsOption populationsOption = new PopulationsOption();

    @CommandLine.Mixin
    private GeneratorOptionsMixin generatorOptions = new GeneratorOptionsMixin();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            PopulationRegistry registry = populationsOption.loadRegistry();
            CytometrySimulation simulation = new CytometrySimulation(generatorOptions.toGeneratorOptions());
            logger.debug("simulating {} events with seed {}", count, randomSeedOption);
            SimulationResult result = simulation.run(registry, count, randomSeedOption.newRandom());
            SimulationReport.print(out, result, count);
            return EXIT_SUCCESS;
        } catch (IOException e) {
            logger.error("Error reading populations", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.error("Simulation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_ERROR;
        }
    }
}
