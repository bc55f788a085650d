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

/// Thrown when a population parameter edit or definition is outside its domain.
///
/// The registry guarantees that a failed edit leaves the prior value in place,
/// so callers may report the message and keep going.
public class PopulationValidationException extends RuntimeException {

    private final String population;
    private final PopulationField field;
    private final Double rejectedValue;

    public PopulationValidationException(String message) {
        super(message);
        this.population = null;
        this.field = null;
        this.rejectedValue = null;
    }

    public PopulationValidationException(String population, PopulationField field, double value, String reason) {
        super("Invalid " + field.key() + " for population '" + population + "': " + value + " (" + reason + ")");
        this.population = population;
        this.field = field;
        this.rejectedValue = value;
    }

    /// @return the population whose edit was rejected, if known
    public String getPopulation() {
        return population;
    }

    /// @return the rejected field, if known
    public PopulationField getField() {
        return field;
    }

    /// @return the rejected value, if known
    public Double getRejectedValue() {
        return rejectedValue;
    }
}
