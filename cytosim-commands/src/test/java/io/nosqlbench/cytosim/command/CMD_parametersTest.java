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

import io.nosqlbench.cytosim.model.PopulationConfig;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CMD_parametersTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = CMD_cytosim.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void showsDefaults() {
        assertThat(run("parameters", "--fields")).isZero();
        assertThat(out.toString())
            .contains("lymphocytes").contains("monocytes").contains("granulocytes")
            .contains("double_positive_fraction");
    }

    @Test
    void appliesEditsAndWritesJson(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("panel.json");

        int exitCode = run("parameters", "--set", "lymphocytes.proportion=0.5",
            "--set", "monocytes.FL1-MEAN=65", "--output", file.toString());

        assertThat(exitCode).isZero();
        PopulationRegistry saved = PopulationConfig.load(file).toRegistry();
        assertThat(saved.get("lymphocytes").proportion()).isEqualTo(0.5);
        assertThat(saved.get("monocytes").value(io.nosqlbench.cytosim.model.PopulationField.FL1_MEAN)).isEqualTo(65.0);
        assertThat(out.toString()).contains("do not sum to 1");
    }

    @Test
    void rebalanceNormalizes(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("rebalanced.json");

        assertThat(run("parameters", "--rebalance", "granulocytes=0.2", "-o", file.toString())).isZero();

        PopulationRegistry saved = PopulationConfig.load(file).toRegistry();
        assertThat(saved.get("granulocytes").proportion()).isCloseTo(0.2, within(1e-12));
        assertThat(saved.isNormalized()).isTrue();
    }

    @Test
    void invalidEditFailsWithoutWriting(@TempDir Path dir) {
        Path file = dir.resolve("never.json");

        int exitCode = run("parameters", "--set", "lymphocytes.fsc_std=-1", "-o", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("fsc_std").contains("lymphocytes");
        assertThat(file).doesNotExist();
    }

    @Test
    void unknownPopulationIsReported() {
        assertThat(run("parameters", "--set", "eosinophils.fsc_mean=3")).isEqualTo(1);
        assertThat(err.toString()).contains("eosinophils");
    }

    @Test
    void malformedAssignmentIsUsageError() {
        assertThat(run("parameters", "--set", "lymphocytes=3")).isEqualTo(2);
        assertThat(run("parameters", "--set", "lymphocytes.fsc_mean=big")).isEqualTo(2);
    }

    @Test
    void assignmentConverterAllowsDottedNames() {
        CMD_parameters.Assignment assignment = new CMD_parameters.AssignmentConverter().convert("cd4.t.cells.fl1_mean=12.5");
        assertThat(assignment.population()).isEqualTo("cd4.t.cells");
        assertThat(assignment.field()).isEqualTo("fl1_mean");
        assertThat(assignment.value()).isEqualTo(12.5);
    }
}
