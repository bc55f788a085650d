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

import io.nosqlbench.cytosim.generator.AllocationPolicy;
import io.nosqlbench.cytosim.generator.DoublePositiveSettings;
import io.nosqlbench.cytosim.generator.GeneratorOptions;
import io.nosqlbench.cytosim.generator.SpilloverCoefficients;
import picocli.CommandLine;

/**
 * Shared options controlling row allocation, the double-positive boost and spillover.
 */
public class GeneratorOptionsMixin {

    @CommandLine.Option(
        names = {"--allocation"},
        description = "Row allocation policy (${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE})",
        defaultValue = "ROUNDED"
    )
    private AllocationPolicy allocation = AllocationPolicy.ROUNDED;

    @CommandLine.Option(
        names = {"--fl2-into-fl1"},
        description = "Fraction of FL2 signal spilling into FL1 (default: ${DEFAULT-VALUE})",
        defaultValue = "0.10"
    )
    private double fl2IntoFl1 = SpilloverCoefficients.DEFAULT_FL2_INTO_FL1;

    @CommandLine.Option(
        names = {"--fl1-into-fl2"},
        description = "Fraction of FL1 signal spilling into FL2 (default: ${DEFAULT-VALUE})",
        defaultValue = "0.05"
    )
    private double fl1IntoFl2 = SpilloverCoefficients.DEFAULT_FL1_INTO_FL2;

    @CommandLine.Option(
        names = {"--no-spillover"},
        description = "Disable spillover entirely"
    )
    private boolean noSpillover = false;

    @CommandLine.Option(
        names = {"--boost-mean"},
        description = "Mean of the double-positive FL1/FL2 boost (default: ${DEFAULT-VALUE})",
        defaultValue = "20.0"
    )
    private double boostMean = DoublePositiveSettings.DEFAULT_BOOST_MEAN;

    @CommandLine.Option(
        names = {"--boost-std"},
        description = "Standard deviation of the double-positive boost (default: ${DEFAULT-VALUE})",
        defaultValue = "5.0"
    )
    private double boostStdDev = DoublePositiveSettings.DEFAULT_BOOST_STD_DEV;

    /**
     * Builds generator options from the parsed flags.
     *
     * @return the options
     * @throws io.nosqlbench.cytosim.generator.InvalidSpilloverCoefficientException for out-of-range coefficients
     * @throws IllegalArgumentException for invalid boost settings
     */
    public GeneratorOptions toGeneratorOptions() {
        SpilloverCoefficients spillover = noSpillover
            ? SpilloverCoefficients.none()
            : new SpilloverCoefficients(fl2IntoFl1, fl1IntoFl2);
        return GeneratorOptions.builder()
            .allocationPolicy(allocation)
            .doublePositive(new DoublePositiveSettings(boostMean, boostStdDev, DoublePositiveSettings.DEFAULT_MINIMUM_BOOST))
            .spillover(spillover)
            .build();
    }
}
