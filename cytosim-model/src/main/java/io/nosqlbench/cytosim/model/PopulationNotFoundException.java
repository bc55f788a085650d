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

package io.nosqlbench.cytosim.model;

import java.util.Collection;

/// Thrown when a population name is not registered.
public class PopulationNotFoundException extends RuntimeException {

    private final String population;

    public PopulationNotFoundException(String population, Collection<String> known) {
        super("Unknown population '" + population + "'; available: " + String.join(", ", known));
        this.population = population;
    }

    public String getPopulation() {
        return population;
    }
}
