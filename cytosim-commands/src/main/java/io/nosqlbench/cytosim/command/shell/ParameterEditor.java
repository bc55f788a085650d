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

import io.nosqlbench.cytosim.model.PopulationField;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import io.nosqlbench.cytosim.model.PopulationSpec;
import io.nosqlbench.cytosim.model.PopulationValidationException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

import java.io.PrintWriter;
import java.util.Locale;

/// Prompts for every field of every population, one value at a time.
///
/// A blank answer keeps the current value. Unparseable or out-of-range answers
/// are reported and the same field is asked again; the registry only ever holds
/// accepted values. After the walk, proportions that no longer sum to 1 can be
/// normalized.
final class ParameterEditor {

    private final LineReader reader;
    private final PrintWriter out;

    ParameterEditor(LineReader reader, PrintWriter out) {
        this.reader = reader;
        this.out = out;
    }

    /// Edits the registry in place.
    ///
    /// @return the number of fields changed
    int edit(PopulationRegistry registry) {
        int changed = 0;
        try {
            for (String name : registry.names()) {
                out.printf("Editing %s (blank keeps the current value)%n", name);
                out.flush();
                for (PopulationField field : PopulationField.values()) {
                    if (editField(registry, name, field)) {
                        changed++;
                    }
                }
            }
            if (!registry.isNormalized()) {
                String answer = reader.readLine(String.format(
                    "Proportions sum to %.4f. Normalize to 1? [Y/n] ", registry.proportionTotal())).trim();
                if (answer.isEmpty() || answer.toLowerCase(Locale.ROOT).startsWith("y")) {
                    registry.normalize();
                    out.println("Proportions normalized.");
                }
            }
        } catch (EndOfFileException | UserInterruptException e) {
            out.println();
            out.println("Editing stopped; accepted values are kept.");
        }
        out.flush();
        return changed;
    }

    private boolean editField(PopulationRegistry registry, String name, PopulationField field) {
        while (true) {
            PopulationSpec current = registry.get(name);
            String answer = reader.readLine(String.format("  %s [%s]: ", field.key(), current.value(field))).trim();
            if (answer.isEmpty()) {
                return false;
            }
            double value;
            try {
                value = Double.parseDouble(answer);
            } catch (NumberFormatException e) {
                out.printf("  Not a number: %s%n", answer);
                out.flush();
                continue;
            }
            try {
                registry.update(name, field, value);
                return true;
            } catch (PopulationValidationException e) {
                out.printf("  %s%n", e.getMessage());
                out.flush();
            }
        }
    }
}
