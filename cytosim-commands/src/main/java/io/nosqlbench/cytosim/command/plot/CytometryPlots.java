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

package io.nosqlbench.cytosim.command.plot;

import io.nosqlbench.cytosim.generator.CytometryTable;
import io.nosqlbench.cytosim.model.Channel;

import java.util.ArrayList;
import java.util.List;

/// Standard cytometry views of a [CytometryTable]: FSC vs SSC and FL1 vs FL2
/// scatter plots, plus FSC and FL1 histograms, each colored by population.
///
/// With log scaling, values are clipped to at least 1 and then replaced by
/// their base-10 logarithm, so axis ticks read as decades.
public final class CytometryPlots {

    /// Smallest value kept before taking the logarithm.
    public static final double LOG_FLOOR = 1.0;

    private final BraillePlot plot;
    private final boolean logScale;

    /// @param plot the renderer
    /// @param logScale whether to plot log10 of the clipped values
    public CytometryPlots(BraillePlot plot, boolean logScale) {
        this.plot = plot;
        this.logScale = logScale;
    }

    public boolean isLogScale() {
        return logScale;
    }

    /// Renders all four views with titles.
    public String render(CytometryTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append(title(Channel.FSC.columnName() + " vs " + Channel.SSC.columnName())).append('\n');
        sb.append(scatter(table, Channel.FSC, Channel.SSC)).append('\n');
        sb.append(title(Channel.FL1.columnName() + " vs " + Channel.FL2.columnName())).append('\n');
        sb.append(scatter(table, Channel.FL1, Channel.FL2)).append('\n');
        sb.append(title(Channel.FSC.columnName() + " Histogram")).append('\n');
        sb.append(histogram(table, Channel.FSC)).append('\n');
        sb.append(title(Channel.FL1.columnName() + " Histogram")).append('\n');
        sb.append(histogram(table, Channel.FL1));
        return sb.toString();
    }

    /// Scatter plot of two channels with one series per population.
    public String scatter(CytometryTable table, Channel x, Channel y) {
        List<double[]> xs = new ArrayList<>();
        List<double[]> ys = new ArrayList<>();
        List<String> labels = table.populations();
        for (String population : labels) {
            xs.add(scale(table.column(x, population)));
            ys.add(scale(table.column(y, population)));
        }
        return plot.scatter(xs, ys, labels);
    }

    /// Histogram of one channel with one series per population.
    public String histogram(CytometryTable table, Channel channel) {
        List<double[]> series = new ArrayList<>();
        List<String> labels = table.populations();
        for (String population : labels) {
            series.add(scale(table.column(channel, population)));
        }
        return plot.histogram(series, labels);
    }

    double[] scale(double[] values) {
        if (!logScale) {
            return values;
        }
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = log10Clipped(values[i]);
        }
        return scaled;
    }

    /// @return log10 of the value after clipping it to [LOG_FLOOR, +∞)
    public static double log10Clipped(double value) {
        return Math.log10(Math.max(LOG_FLOOR, value));
    }

    private String title(String name) {
        return logScale ? name + " (log10)" : name;
    }
}
