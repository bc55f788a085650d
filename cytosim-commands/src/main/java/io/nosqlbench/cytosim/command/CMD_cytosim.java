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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Synthetic flow cytometry data generator.
///
/// This is the top level command which serves as an entry point for all sub-commands.
@CommandLine.Command(name = "cytosim",
    mixinStandardHelpOptions = true,
    version = "cytosim 0.1.0",
    description = "Generate, inspect and plot synthetic flow cytometry events",
    subcommands = {
        CommandLine.HelpCommand.class, CMD_simulate.class, CMD_visualize.class,
        CMD_parameters.class, CMD_shell.class
    })
public class CMD_cytosim implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_cytosim.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Without a sub-command, print usage.
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /// Builds the configured command line; shared by [#main] and tests.
    ///
    /// @return a command line for a new command instance
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_cytosim())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// run a cytosim command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        logger.debug("exiting with {}", exitCode);
        System.exit(exitCode);
    }
}
