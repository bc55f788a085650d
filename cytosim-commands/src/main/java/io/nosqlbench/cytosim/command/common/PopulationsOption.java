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

package io.nosqlbench.cytosim.command.common;

import io.nosqlbench.cytosim.model.PopulationConfig;
import io.nosqlbench.cytosim.model.PopulationRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared option for loading population definitions from a JSON file.
 * Without a file, the three default populations are used.
 */
public class PopulationsOption {

    private static final Logger logger = LogManager.getLogger(PopulationsOption.class);

    @CommandLine.Option(
        names = {"-p", "--populations"},
        description = "Population definitions JSON file (default: built-in lymphocytes, monocytes, granulocytes)"
    )
    private Path populationsFile;

    /**
     * Builds a fresh registry from the file, or from the defaults.
     *
     * @return a new registry
     * @throws IOException if the file cannot be read
     */
    public PopulationRegistry loadRegistry() throws IOException {
        if (populationsFile == null) {
            return PopulationRegistry.withDefaults();
        }
        if (!Files.exists(populationsFile)) {
            throw new IOException("Populations file does not exist: " + populationsFile);
        }
        PopulationRegistry registry = PopulationConfig.load(populationsFile).toRegistry();
        logger.info("loaded {} populations from {}", registry.size(), populationsFile);
        if (!registry.isNormalized()) {
            logger.warn("population proportions in {} sum to {}, not 1", populationsFile, registry.proportionTotal());
        }
        return registry;
    }
}
