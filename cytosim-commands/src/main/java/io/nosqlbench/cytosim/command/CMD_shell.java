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
import io.nosqlbench.cytosim.command.shell.CytosimShell;
import io.nosqlbench.cytosim.command.shell.ShellSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Interactive session for editing populations and re-running simulations.
///
/// ## Usage
///
/// ```bash
/// cytosim shell --seed 42
/// cytosim> simulate 5000
/// cytosim> set lymphocytes.fl1_mean 45
/// cytosim> visualize log
/// ```
@CommandLine.Command(
    name = "shell",
    header = "Interactive simulation shell",
    description = "Starts a line-editing shell with simulate, visualize, parameters, show, help and quit commands.",
    exitCodeList = {
        "0: Session ended normally",
        "1: Could not start the session"
    }
)
public class CMD_shell implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_shell.class);

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private PopulationsOption populationsOption = new PopulationsOption();

    @CommandLine.Mixin
    private GeneratorOptionsMixin generatorOptions = new GeneratorOptionsMixin();

    @CommandLine.Option(
        names = {"--no-color"},
        description = "Disable ANSI colors in plots"
    )
    private boolean noColor = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        ShellSession session;
        try {
            session = new ShellSession(populationsOption.loadRegistry(),
                generatorOptions.toGeneratorOptions(), randomSeedOption.newRandom());
        } catch (IOException | RuntimeException e) {
            logger.error("Could not start shell: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            new CytosimShell(session, terminal, !noColor).run();
            return 0;
        } catch (IOException e) {
            logger.error("Terminal error", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
