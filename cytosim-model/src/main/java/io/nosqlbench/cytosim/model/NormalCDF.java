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

/// Forward normal CDF Φ(x) = P(X ≤ x) using the error function.
///
/// ```text
///   Φ(x) = ½[1 + erf(x/√2)]
///
///     Φ(-2) ≈ 0.0228
///     Φ(0)  = 0.5
///     Φ(2)  ≈ 0.9772
/// ```
///
/// Used by [ChannelModel#cdf(double)] and by the truncated-normal boost sampler
/// in the generator module.
public final class NormalCDF {

    private NormalCDF() {
    }

    /// Computes the standard normal CDF for X ~ N(0,1).
    ///
    /// @param x the value at which to evaluate the CDF
    /// @return the probability P(X ≤ x)
    public static double standardNormalCDF(double x) {
        return 0.5 * (1.0 + erf(x / Math.sqrt(2.0)));
    }

    /// Computes the CDF for a normal distribution with the given mean and stdDev.
    ///
    /// @param x the value at which to evaluate the CDF
    /// @param mean the mean (μ)
    /// @param stdDev the standard deviation (σ)
    /// @return the probability P(X ≤ x) for X ~ N(mean, stdDev²)
    public static double cdf(double x, double mean, double stdDev) {
        return standardNormalCDF((x - mean) / stdDev);
    }

    // Abramowitz and Stegun 7.1.26, |error| < 1.5e-7
    private static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        x = Math.abs(x);

        double a1 = 0.254829592;
        double a2 = -0.284496736;
        double a3 = 1.421413741;
        double a4 = -1.453152027;
        double a5 = 1.061405429;
        double p = 0.3275911;

        double t = 1.0 / (1.0 + p * x);
        double poly = t * (a1 + t * (a2 + t * (a3 + t * (a4 + t * a5))));
        double y = 1.0 - poly * Math.exp(-x * x);

        return sign * y;
    }
}
