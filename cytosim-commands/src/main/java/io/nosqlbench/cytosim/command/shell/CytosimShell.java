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

import io.nosqlbench.cytosim.command.common.RegistryFormatter;
import io.nosqlbench.cytosim.command.common.SimulationReport;
import io.nosqlbench.cytosim.command.plot.BraillePlot;
import io.nosqlbench.cytosim.command.plot.CytometryPlots;
import io.nosqlbench.cytosim.generator.SimulationResult;
import io.nosqlbench.cytosim.generator.sampling.RandomSources;
import io.nosqlbench.cytosim.model.PopulationConfig;
import io.nosqlbench.cytosim.model.PopulationField;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Read-eval-print loop over a [ShellSession].
///
/// Every command reports its own errors and the loop continues; only `quit`,
/// end of input or an interrupt ends the session.
public final class CytosimShell {

    private static final Logger logger = LogManager.getLogger(CytosimShell.class);

    static final String PROMPT = "cytosim> ";

    private static final List<String> COMMANDS = List.of(
        "simulate", "visualize", "parameters", "set", "rebalance", "show", "fields",
        "save", "load", "seed", "help", "quit", "exit");

    private final ShellSession session;
    private final LineReader reader;
    private final PrintWriter out;
    private final BraillePlot plot;

    /// @param session the session state
    /// @param terminal the terminal to read from and write to
    /// @param color whether plots use ANSI colors
    public CytosimShell(ShellSession session, Terminal terminal, boolean color) {
        this.session = session;
        this.out = terminal.writer();
        this.reader = LineReaderBuilder.builder()
            .terminal(terminal)
            .completer(completer())
            .build();
        int width = Math.max(40, Math.min(100, terminal.getWidth() - 12));
        this.plot = new BraillePlot(width, 20, color);
    }

    /// Runs until `quit` or end of input.
    ///
    /// @return the number of commands executed
    public int run() {
        out.println("cytosim shell. Type 'help' for commands.");
        out.flush();
        int executed = 0;
        while (true) {
            String line;
            try {
                line = reader.readLine(PROMPT);
            } catch (EndOfFileException | UserInterruptException e) {
                break;
            }
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] args = line.split("\\s+");
            String cmd = args[0].toLowerCase(Locale.ROOT);
            if ("quit".equals(cmd) || "exit".equals(cmd) || "q".equals(cmd)) {
                break;
            }
            try {
                dispatch(cmd, args);
            } catch (RuntimeException e) {
                logger.debug("command '{}' failed", line, e);
                out.println("Error: " + e.getMessage());
            }
            out.flush();
            executed++;
        }
        out.println("bye");
        out.flush();
        return executed;
    }

    private void dispatch(String cmd, String[] args) {
        switch (cmd) {
            case "help":
                printHelp();
                break;
            case "simulate":
                simulate(args);
                break;
            case "visualize":
                visualize(args);
                break;
            case "parameters":
                int changed = new ParameterEditor(reader, out).edit(session.registry());
                out.printf("%d field(s) changed.%n", changed);
                break;
            case "set":
                set(args);
                break;
            case "rebalance":
                requireArgs(args, 3, "rebalance <population> <proportion>");
                session.registry().rebalance(args[1], parseNumber(args[2]));
                out.print(RegistryFormatter.format(session.registry()));
                break;
            case "show":
                out.print(RegistryFormatter.format(session.registry()));
                break;
            case "fields":
                out.println(PopulationField.keys());
                break;
            case "save":
                requireArgs(args, 2, "save <file.json>");
                save(Path.of(args[1]));
                break;
            case "load":
                requireArgs(args, 2, "load <file.json>");
                load(Path.of(args[1]));
                break;
            case "seed":
                requireArgs(args, 2, "seed <long>");
                long seed = parseLong(args[1]);
                session.random(RandomSources.create(seed));
                out.println("Random stream reseeded with " + seed);
                break;
            default:
                out.println("Unknown command: " + cmd + ". Type 'help' for commands.");
        }
    }

    private void simulate(String[] args) {
        int count = ShellSession.DEFAULT_COUNT;
        if (args.length > 1) {
            count = Math.toIntExact(parseLong(args[1]));
        }
        SimulationResult result = session.simulate(count);
        SimulationReport.print(out, result, count);
    }

    private void visualize(String[] args) {
        boolean logScale = false;
        if (args.length > 1) {
            String mode = args[1].toLowerCase(Locale.ROOT);
            if ("log".equals(mode)) {
                logScale = true;
            } else if (!"linear".equals(mode)) {
                throw new IllegalArgumentException("usage: visualize [log|linear]");
            }
        }
        Optional<SimulationResult> result = session.lastResult();
        if (result.isEmpty()) {
            out.println("No data yet; run 'simulate' first.");
            return;
        }
        out.print(new CytometryPlots(plot, logScale).render(result.get().mixed()));
    }

    private void set(String[] args) {
        String target;
        String valueText;
        if (args.length == 2 && args[1].contains("=")) {
            target = args[1].substring(0, args[1].indexOf('='));
            valueText = args[1].substring(args[1].indexOf('=') + 1);
        } else {
            requireArgs(args, 3, "set <population>.<field> <value>");
            target = args[1];
            valueText = args[2];
        }
        int dot = target.lastIndexOf('.');
        if (dot <= 0 || dot == target.length() - 1) {
            throw new IllegalArgumentException("usage: set <population>.<field> <value>");
        }
        String population = target.substring(0, dot);
        session.registry().update(population, target.substring(dot + 1), parseNumber(valueText));
        out.printf("%s updated.%n", target);
    }

    private void save(Path path) {
        try {
            PopulationConfig.from(session.registry()).save(path);
            out.println("Saved " + session.registry().size() + " populations to " + path);
        } catch (IOException e) {
            logger.error("could not save populations to {}", path, e);
            out.println("Error: could not write " + path + ": " + e.getMessage());
        }
    }

    private void load(Path path) {
        try {
            PopulationConfig config = PopulationConfig.load(path);
            session.registry().replaceAll(config.toRegistry().snapshot());
            out.println("Loaded " + session.registry().size() + " populations from " + path);
        } catch (IOException e) {
            logger.error("could not load populations from {}", path, e);
            out.println("Error: could not read " + path + ": " + e.getMessage());
        }
    }

    private void printHelp() {
        out.println("simulate [n]                   generate n events (default " + ShellSession.DEFAULT_COUNT + ") and summarize");
        out.println("visualize [log|linear]         plot the last simulation");
        out.println("parameters                     edit every population field interactively");
        out.println("set <pop>.<field> <value>      edit one field");
        out.println("rebalance <pop> <proportion>   set a proportion and rescale the others");
        out.println("show                           print the population table");
        out.println("fields                         list editable field keys");
        out.println("save <file> | load <file>      write or read populations as JSON");
        out.println("seed <long>                    reseed the random stream");
        out.println("quit|exit                      leave the shell");
    }

    private static void requireArgs(String[] args, int count, String usage) {
        if (args.length < count) {
            throw new IllegalArgumentException("usage: " + usage);
        }
    }

    private static double parseNumber(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + text, e);
        }
    }

    private static long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + text, e);
        }
    }

    private Completer completer() {
        return (ln, parsed, candidates) -> {
            String word = parsed.word();
            if (parsed.wordIndex() == 0) {
                COMMANDS.stream()
                    .filter(c -> word == null || c.startsWith(word.toLowerCase(Locale.ROOT)))
                    .forEach(c -> candidates.add(new Candidate(c)));
                return;
            }
            String cmd = parsed.words().get(0).toLowerCase(Locale.ROOT);
            if ("visualize".equals(cmd)) {
                candidates.add(new Candidate("log"));
                candidates.add(new Candidate("linear"));
            } else if ("set".equals(cmd)) {
                for (String name : session.registry().names()) {
                    for (PopulationField field : PopulationField.values()) {
                        candidates.add(new Candidate(name + "." + field.key()));
                    }
                }
            } else if ("rebalance".equals(cmd)) {
                session.registry().names().forEach(n -> candidates.add(new Candidate(n)));
            }
        };
    }
}
