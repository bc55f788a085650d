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

import io.nosqlbench.cytosim.model.Channel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Models optical crosstalk between the two fluorescence channels.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 *   for every row, using the PRE-transform values on both right-hand sides:
 *
 *     FL1' = FL1 + c₁ · FL2        c₁ = fl2IntoFl1
 *     FL2' = FL2 + c₂ · FL1        c₂ = fl1IntoFl2
 *
 *   FSC and SSC are untouched.
 * }</pre>
 *
 * <p>Both outputs are computed from the same input pair. Updating FL1 first and
 * then reading it back for FL2 would add {@code c₂·c₁·FL2} of extra signal to FL2.
 *
 * <p>{@link #apply(CytometryTable)} never modifies its input; it returns a new
 * table so callers keep the raw signal.
 */
public final class SpilloverTransform {

    private static final Logger logger = LogManager.getLogger(SpilloverTransform.class);

    private final SpilloverCoefficients coefficients;

    public SpilloverTransform(SpilloverCoefficients coefficients) {
        this.coefficients = coefficients;
    }

    public SpilloverCoefficients coefficients() {
        return coefficients;
    }

    /**
     * Applies spillover to every row.
     *
     * @param table the pre-spillover table; not modified
     * @return a new table with mixed fluorescence channels
     */
    public CytometryTable apply(CytometryTable table) {
        double[] fl1 = table.columnView(Channel.FL1);
        double[] fl2 = table.columnView(Channel.FL2);
        double[] mixed1 = new double[fl1.length];
        double[] mixed2 = new double[fl2.length];

        double c1 = coefficients.fl2IntoFl1();
        double c2 = coefficients.fl1IntoFl2();
        for (int row = 0; row < fl1.length; row++) {
            double a = fl1[row];
            double b = fl2[row];
            mixed1[row] = a + c1 * b;
            mixed2[row] = b + c2 * a;
        }

        logger.debug("applied spillover fl2->fl1={} fl1->fl2={} to {} rows", c1, c2, fl1.length);
        return table.withFluorescence(mixed1, mixed2);
    }

    /**
     * Applies spillover with the given coefficients.
     *
     * @param table the pre-spillover table; not modified
     * @param coefficients the spillover coefficients
     * @return a new table with mixed fluorescence channels
     */
    public static CytometryTable apply(CytometryTable table, SpilloverCoefficients coefficients) {
        return new SpilloverTransform(coefficients).apply(table);
    }

    /**
     * Applies spillover to a single (FL1, FL2) pair.
     *
     * @param fl1 pre-transform FL1
     * @param fl2 pre-transform FL2
     * @return the mixed pair as {@code {FL1', FL2'}}
     */
    public double[] mix(double fl1, double fl2) {
        return new double[] {
            fl1 + coefficients.fl2IntoFl1() * fl2,
            fl2 + coefficients.fl1IntoFl2() * fl1
        };
    }
}
