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

import io.nosqlbench.cytosim.command.common.PopulationsOption;
import io.nosqlbench.cytosim.command.common.RegistryFormatter;
import io.nosqlbench.cytosim.model.PopulationConfig;
import io.nosqlbench.cytosim.model.PopulationField;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Show, edit and save population parameters.
///
/// Edits are applied in order: all `--set` assignments first, then any
/// `--rebalance`. The first invalid edit stops the command and nothing is saved.
///
/// ## Usage
///
/// ```bash
/// cytosim parameters
/// cytosim parameters --set lymphocytes.fsc_mean=9.5 --set monocytes.fl1_std=6
/// cytosim parameters --rebalance granulocytes=0.2 --output panel.json
/// cytosim parameters --populations panel.json --fields
/// ```
@CommandLine.Command(
    name = "parameters",
    header = "Show or edit population parameters",
    description = "Prints the population table, applies edits, and optionally writes the result as JSON.",
    exitCodeList = {
        "0: Success",
        "1: Invalid edit or unreadable/unwritable file"
    }
)
public class CMD_parameters implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_parameters.class);

    /// A `population.field=value` edit.
    ///
    /// @param population the population name
    /// @param field the field key
    /// @param value the new value
    public record Assignment(String population, String field, double value) {
    }

    /// Parses `population.field=value`; the population name may itself contain dots.
    public static class AssignmentConverter implements CommandLine.ITypeConverter<Assignment> {
        @Override
        public Assignment convert(String text) {
            int eq = text.indexOf('=');
            int dot = eq < 0 ? -1 : text.lastIndexOf('.', eq);
            if (eq < 0 || dot <= 0 || dot == eq - 1) {
                throw new CommandLine.TypeConversionException(
                    "Expected population.field=value, got: " + text);
            }
            String valueText = text.substring(eq + 1).trim();
            try {
                return new Assignment(text.substring(0, dot).trim(), text.substring(dot + 1, eq).trim(),
                    Double.parseDouble(valueText));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException("Not a number: '" + valueText + "' in " + text);
            }
        }
    }

    /// Parses `population=proportion`.
    public static class RebalanceConverter implements CommandLine.ITypeConverter<Assignment> {
        @Override
        public Assignment convert(String text) {
            int eq = text.indexOf('=');
            if (eq <= 0) {
                throw new CommandLine.TypeConversionException("Expected population=proportion, got: " + text);
            }
            String valueText = text.substring(eq + 1).trim();
            try {
                return new Assignment(text.substring(0, eq).trim(), PopulationField.PROPORTION.key(),
                    Double.parseDouble(valueText));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException("Not a number: '" + valueText + "' in " + text);
            }
        }
    }

    @CommandLine.Mixin
    private PopulationsOption populationsOption = new PopulationsOption();

    @CommandLine.Option(
        names = {"--set"},
        description = "Edit one field, as population.field=value (repeatable)",
        converter = AssignmentConverter.class
    )
    private List<Assignment> assignments = new ArrayList<>();

    @CommandLine.Option(
        names = {"--rebalance"},
        description = "Set population=proportion and rescale the others so proportions sum to 1",
        converter = RebalanceConverter.class
    )
    private Assignment rebalance;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the resulting populations to this JSON file"
    )
    private Path output;

    @CommandLine.Option(
        names = {"--fields"},
        description = "List the editable field keys"
    )
    private boolean listFields = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            PopulationRegistry registry = populationsOption.loadRegistry();
            for (Assignment assignment : assignments) {
                registry.update(assignment.population(), assignment.field(), assignment.value());
            }
            if (rebalance != null) {
                registry.rebalance(rebalance.population(), rebalance.value());
            }

            out.print(RegistryFormatter.format(registry));
            if (listFields) {
                out.println();
                out.println("Editable fields: " + PopulationField.keys());
            }
            if (output != null) {
                PopulationConfig.from(registry).save(output);
                out.println("Wrote " + registry.size() + " populations to " + output);
            }
            out.flush();
            return 0;
        } catch (IOException e) {
            logger.error("Error reading or writing populations", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        } catch (RuntimeException e) {
            logger.error("Parameter edit rejected: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
