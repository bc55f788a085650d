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

package io.nosqlbench.cytosim.model.stats;

import io.nosqlbench.cytosim.model.Channel;
import io.nosqlbench.cytosim.model.ChannelModel;

import java.util.Objects;

/**
 * Descriptive statistics of one channel column.
 *
 * <h2>Statistics Included</h2>
 *
 * <ul>
 *   <li><b>count</b> - number of observations</li>
 *   <li><b>min/max</b> - observed range</li>
 *   <li><b>mean</b> - arithmetic mean</li>
 *   <li><b>variance/stdDev</b> - population variance and its root</li>
 *   <li><b>skewness</b> - asymmetry (0 = symmetric)</li>
 *   <li><b>kurtosis</b> - tail heaviness (3 = normal)</li>
 * </ul>
 *
 * <p>Used by the {@code simulate} command to summarize each population and by
 * tests to compare generated columns against their configured {@link ChannelModel}.
 */
public final class ChannelStatistics {

    private final Channel channel;
    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    private final double variance;
    private final double skewness;
    private final double kurtosis;

    public ChannelStatistics(Channel channel, long count, double min, double max,
                             double mean, double variance, double skewness, double kurtosis) {
        this.channel = channel;
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.variance = variance;
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    /**
     * Computes statistics from a column of values, in two passes.
     *
     * @param channel the channel the values belong to
     * @param values the observed values
     * @return computed statistics
     * @throws IllegalArgumentException if values is empty
     */
    public static ChannelStatistics compute(Channel channel, double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }

        long count = values.length;

        double min = values[0];
        double max = values[0];
        double sum = 0;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        double mean = sum / count;

        double m2 = 0;
        double m3 = 0;
        double m4 = 0;
        for (double v : values) {
            double diff = v - mean;
            double diff2 = diff * diff;
            m2 += diff2;
            m3 += diff2 * diff;
            m4 += diff2 * diff2;
        }

        double variance = m2 / count;
        double stdDev = Math.sqrt(variance);

        double skewness = 0;
        double kurtosis = 3;
        if (stdDev > 0) {
            skewness = (m3 / count) / (stdDev * stdDev * stdDev);
            kurtosis = (m4 / count) / (variance * variance);
        }

        return new ChannelStatistics(channel, count, min, max, mean, variance, skewness, kurtosis);
    }

    public Channel channel() {
        return channel;
    }

    public long count() {
        return count;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public double mean() {
        return mean;
    }

    public double variance() {
        return variance;
    }

    public double stdDev() {
        return Math.sqrt(variance);
    }

    public double skewness() {
        return skewness;
    }

    public double kurtosis() {
        return kurtosis;
    }

    /**
     * Relative error of the observed mean and standard deviation against a model.
     *
     * @param model the configured distribution
     * @return the larger of |mean - μ| / σ and |sd - σ| / σ
     */
    public double deviationFrom(ChannelModel model) {
        double meanError = Math.abs(mean - model.mean()) / model.stdDev();
        double sdError = Math.abs(stdDev() - model.stdDev()) / model.stdDev();
        return Math.max(meanError, sdError);
    }

    @Override
    public String toString() {
        return String.format("%s[n=%d, mean=%.4f, sd=%.4f, min=%.4f, max=%.4f, skew=%.3f, kurt=%.3f]",
            channel.columnName(), count, mean, stdDev(), min, max, skewness, kurtosis);
    }
}
