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

package io.nosqlbench.cytosim.generator;

/// Thrown when a spillover coefficient lies outside [0, 1).
///
/// Negative spillover has no optical meaning, and a coefficient of 1 or more
/// would move at least as much signal into a channel as its own detector sees.
public class InvalidSpilloverCoefficientException extends RuntimeException {

    private final String coefficient;
    private final double value;

    public InvalidSpilloverCoefficientException(String coefficient, double value) {
        super("Spillover coefficient " + coefficient + " must be in [0, 1), got: " + value);
        this.coefficient = coefficient;
        this.value = value;
    }

    public String getCoefficient() {
        return coefficient;
    }

    public double getValue() {
        return value;
    }
}
