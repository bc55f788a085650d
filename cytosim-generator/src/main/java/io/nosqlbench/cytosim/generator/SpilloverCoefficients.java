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

/// Fractions of one fluorescence channel's signal that appear in the other.
///
/// ```text
///   FL1' = FL1 + fl2IntoFl1 · FL2
///   FL2' = FL2 + fl1IntoFl2 · FL1
/// ```
///
/// Both coefficients must lie in [0, 1); anything else is rejected with
/// [InvalidSpilloverCoefficientException] at construction.
///
/// @param fl2IntoFl1 share of FL2 signal added to FL1
/// @param fl1IntoFl2 share of FL1 signal added to FL2
public record SpilloverCoefficients(double fl2IntoFl1, double fl1IntoFl2) {

    /// Default FL2 → FL1 spillover.
    public static final double DEFAULT_FL2_INTO_FL1 = 0.10;

    /// Default FL1 → FL2 spillover.
    public static final double DEFAULT_FL1_INTO_FL2 = 0.05;

    public SpilloverCoefficients {
        check("fl2_into_fl1", fl2IntoFl1);
        check("fl1_into_fl2", fl1IntoFl2);
    }

    /// @return coefficients 0.10 (FL2 into FL1) and 0.05 (FL1 into FL2)
    public static SpilloverCoefficients defaults() {
        return new SpilloverCoefficients(DEFAULT_FL2_INTO_FL1, DEFAULT_FL1_INTO_FL2);
    }

    /// @return coefficients that leave the fluorescence channels unchanged
    public static SpilloverCoefficients none() {
        return new SpilloverCoefficients(0.0, 0.0);
    }

    /// @return true if both coefficients are zero
    public boolean isIdentity() {
        return fl2IntoFl1 == 0.0 && fl1IntoFl2 == 0.0;
    }

    private static void check(String name, double value) {
        if (!(value >= 0.0 && value < 1.0)) {
            throw new InvalidSpilloverCoefficientException(name, value);
        }
    }
}
