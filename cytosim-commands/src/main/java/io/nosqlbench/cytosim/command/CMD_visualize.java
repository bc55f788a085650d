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
import io.nosqlbench.cytosim.command.plot.BraillePlot;
import io.nosqlbench.cytosim.command.plot.CytometryPlots;
import io.nosqlbench.cytosim.generator.CytometrySimulation;
import io.nosqlbench.cytosim.generator.CytometryTable;
import io.nosqlbench.cytosim.generator.SimulationResult;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Simulate a sample and draw it as terminal plots.
///
/// ## Usage
///
/// ```bash
/// cytosim visualize --seed 7
/// cytosim visualize --log-scale --width 100 --height 30
/// cytosim visualize --raw --no-color
/// ```
@CommandLine.Command(
    name = "visualize",
    header = "Plot a simulated sample in the terminal",
    description = "Renders FSC vs SSC and FL1 vs FL2 scatter plots and FSC and FL1 histograms, "
        + "one colored series per population.",
    exitCodeList = {
        "0: Success",
        "1: Invalid parameters or input file"
    }
)
public class CMD_visualize implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_visualize.class);

    @CommandLine.Option(
        names = {"-n", "--count"},
        description = "Number of events to generate (default: ${DEFAULT-VALUE})",
        defaultValue = "10000"
    )
    private int count = 10000;

    @CommandLine.Option(
        names = {"-l", "--log-scale"},
        description = "Plot log10 of values clipped to at least 1"
    )
    private boolean logScale = false;

    @CommandLine.Option(
        names = {"--raw"},
        description = "Plot the table before spillover"
    )
    private boolean raw = false;

    @CommandLine.Option(
        names = {"-w", "--width"},
        description = "Plot width in characters (default: ${DEFAULT-VALUE})",
        defaultValue = "72"
    )
    private int width = 72;

    @CommandLine.Option(
        names = {"--height"},
        description = "Plot height in lines (default: ${DEFAULT-VALUE})",
        defaultValue = "20"
    )
    private int height = 20;

    @CommandLine.Option(
        names = {"--no-color"},
        description = "Disable ANSI colors"
    )
    private boolean noColor = false;

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
            SimulationResult result = new CytometrySimulation(generatorOptions.toGeneratorOptions())
                .run(registry, count, randomSeedOption.newRandom());
            CytometryTable table = raw ? result.raw() : result.mixed();
            CytometryPlots plots = new CytometryPlots(new BraillePlot(width, height, !noColor), logScale);
            out.print(plots.render(table));
            out.flush();
            return 0;
        } catch (IOException e) {
            logger.error("Error reading populations", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        } catch (RuntimeException e) {
            logger.error("Visualization failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
