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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_simulateTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = CMD_cytosim.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void printsPerPopulationCounts() {
        int exitCode = run("simulate", "-n", "1000", "-s", "42");

        assertThat(exitCode).isZero();
        String text = out.toString();
        assertThat(text).contains("Simulated").contains("Population").contains("mean ± sd");
        assertThat(line(text, "lymphocytes")).contains(" 600 ").contains(" 60");
        assertThat(line(text, "monocytes")).contains(" 300 ");
        assertThat(line(text, "granulocytes")).contains(" 100 ");
    }

    @Test
    void sameSeedSameReport() {
        run("simulate", "-n", "500", "-s", "7");
        String first = out.toString();
        out.getBuffer().setLength(0);
        run("simulate", "-n", "500", "-s", "7", "--algorithm", "xo_shi_ro_256_pp");
        assertThat(out.toString()).isEqualTo(first);
    }

    @Test
    void rejectsNonPositiveCount() {
        assertThat(run("simulate", "-n", "0")).isEqualTo(1);
        assertThat(err.toString()).contains("must be positive");
    }

    @Test
    void rejectsInvalidSpillover() {
        assertThat(run("simulate", "-n", "100", "--fl2-into-fl1", "1.5")).isEqualTo(1);
        assertThat(err.toString()).contains("fl2_into_fl1");
    }

    @Test
    void rejectsMissingPopulationsFile(@TempDir Path dir) {
        assertThat(run("simulate", "--populations", dir.resolve("missing.json").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("does not exist");
    }

    @Test
    void usesPopulationsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("panel.json");
        Files.writeString(file, "{\"populations\":[{\"name\":\"blasts\",\"proportion\":1.0,"
            + "\"fsc\":{\"mean\":10,\"std_dev\":2},\"ssc\":{\"mean\":10,\"std_dev\":2},"
            + "\"fl1\":{\"mean\":10,\"std_dev\":2},\"fl2\":{\"mean\":10,\"std_dev\":2}}]}");

        assertThat(run("simulate", "-n", "250", "-s", "1", "-p", file.toString())).isZero();
        assertThat(line(out.toString(), "blasts")).contains(" 250 ");
        assertThat(out.toString()).doesNotContain("lymphocytes");
    }

    @Test
    void topLevelWithoutSubcommandPrintsUsage() {
        assertThat(run()).isZero();
        assertThat(out.toString()).contains("simulate").contains("visualize").contains("parameters").contains("shell");
    }

    private static String line(String text, String prefix) {
        for (String line : text.split("\\R")) {
            if (line.startsWith(prefix)) {
                return line;
            }
        }
        throw new AssertionError("no line starting with " + prefix + " in:\n" + text);
    }
}
