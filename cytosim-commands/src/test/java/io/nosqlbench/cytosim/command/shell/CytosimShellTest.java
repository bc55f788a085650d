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

import io.nosqlbench.cytosim.generator.GeneratorOptions;
import io.nosqlbench.cytosim.generator.sampling.RandomSources;
import io.nosqlbench.cytosim.model.Channel;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import org.jline.terminal.Terminal;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CytosimShellTest {

    private final ShellSession session = new ShellSession(PopulationRegistry.withDefaults(),
        GeneratorOptions.defaults(), RandomSources.create(1L));

    private String run(String input) throws Exception {
        Charset charset = Charset.defaultCharset();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (Terminal terminal = new DumbTerminal(new ByteArrayInputStream(input.getBytes(charset)), output)) {
            new CytosimShell(session, terminal, false).run();
        }
        return output.toString(charset);
    }

    @Test
    void simulateThenVisualize() throws Exception {
        String text = run("visualize\nsimulate 500\nvisualize log\nquit\n");

        assertThat(text).contains("No data yet");
        assertThat(text).contains("Simulated").contains("lymphocytes");
        assertThat(text).contains("FSC vs SSC (log10)").contains("FL1 Histogram (log10)");
        assertThat(text).contains("bye");
        assertThat(session.lastResult()).isPresent();
        assertThat(session.lastResult().get().rowCount()).isEqualTo(500);
    }

    @Test
    void errorsAreReportedAndTheLoopContinues() throws Exception {
        String text = run("set lymphocytes.fsc_std -1\nsimulate 0\nfrobnicate\nvisualize sideways\nshow\n");

        assertThat(text).contains("must be strictly positive");
        assertThat(text).contains("must be positive");
        assertThat(text).contains("Unknown command: frobnicate");
        assertThat(text).contains("usage: visualize [log|linear]");
        assertThat(text).contains("granulocytes");
        assertThat(session.registry().get("lymphocytes").channel(Channel.FSC).stdDev()).isEqualTo(1.5);
    }

    @Test
    void setAndRebalance() throws Exception {
        run("set monocytes.fl1_mean 70\nset granulocytes.fl2_std=9\nrebalance lymphocytes 0.5\n");

        PopulationRegistry registry = session.registry();
        assertThat(registry.get("monocytes").channel(Channel.FL1).mean()).isEqualTo(70.0);
        assertThat(registry.get("granulocytes").channel(Channel.FL2).stdDev()).isEqualTo(9.0);
        assertThat(registry.get("lymphocytes").proportion()).isEqualTo(0.5);
        assertThat(registry.isNormalized()).isTrue();
    }

    @Test
    void interactiveParameterWalk() throws Exception {
        // proportion kept, fsc_mean 9, fsc_std rejected then 2, ssc_mean not a number then kept; input ends
        String text = run("parameters\n\n9\n-1\n2\nabc\n\n");

        assertThat(text).contains("Editing lymphocytes");
        assertThat(text).contains("must be strictly positive");
        assertThat(text).contains("Not a number: abc");
        assertThat(text).contains("Editing stopped");
        PopulationRegistry registry = session.registry();
        assertThat(registry.get("lymphocytes").channel(Channel.FSC).mean()).isEqualTo(9.0);
        assertThat(registry.get("lymphocytes").channel(Channel.FSC).stdDev()).isEqualTo(2.0);
        assertThat(registry.get("lymphocytes").channel(Channel.SSC).mean()).isEqualTo(15.0);
    }

    @Test
    void parameterWalkOffersNormalization() throws Exception {
        StringBuilder input = new StringBuilder("parameters\n0.9\n");
        for (int i = 1; i < 30; i++) {
            input.append('\n');
        }
        input.append("y\nquit\n");

        String text = run(input.toString());

        assertThat(text).contains("Normalize to 1?").contains("Proportions normalized.");
        assertThat(session.registry().isNormalized()).isTrue();
        assertThat(session.registry().get("lymphocytes").proportion()).isCloseTo(0.9 / 1.3, within(1e-12));
    }

    @Test
    void saveAndLoad(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("panel.json");
        run("set lymphocytes.fl1_mean 44\nsave " + file + "\nset lymphocytes.fl1_mean 10\nload " + file + "\n");

        assertThat(file).exists();
        assertThat(session.registry().get("lymphocytes").channel(Channel.FL1).mean()).isEqualTo(44.0);
    }

    @Test
    void reseedingRepeatsTheStream() throws Exception {
        run("seed 5\nsimulate 200\n");
        double first = session.lastResult().orElseThrow().mixed().value(Channel.FSC, 0);
        run("seed 5\nsimulate 200\n");
        double second = session.lastResult().orElseThrow().mixed().value(Channel.FSC, 0);
        assertThat(second).isEqualTo(first);
    }
}
