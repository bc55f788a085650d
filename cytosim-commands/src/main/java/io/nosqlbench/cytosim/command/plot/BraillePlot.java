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

import java.util.Arrays;
import java.util.List;

/// Unicode braille plotting for terminal output.
///
/// Each braille character (U+2800 to U+28FF) is a 2-column by 4-row dot matrix,
/// so a plot of `width × height` characters has `2·width × 4·height` dots:
///
/// ```
/// ┌───┬───┐
/// │ 1 │ 4 │  Bit positions:
/// ├───┼───┤  1=0x01, 2=0x02, 3=0x04, 4=0x08
/// │ 2 │ 5 │  5=0x10, 6=0x20, 7=0x40, 8=0x80
/// ├───┼───┤
/// │ 3 │ 6 │  Character = 0x2800 + (dot bits)
/// ├───┼───┤
/// │ 7 │ 8 │
/// └───┴───┘
/// ```
///
/// Series are overlaid on shared axes. A cell touched by several series takes
/// the color of the series owning most of its dots.
public final class BraillePlot {

    /// ANSI color codes, one per series.
    public static final String[] SERIES_COLORS = {
        "\u001B[94m",  // Bright Blue
        "\u001B[91m",  // Bright Red
        "\u001B[92m",  // Bright Green
        "\u001B[93m",  // Bright Yellow
        "\u001B[95m",  // Bright Magenta
        "\u001B[96m",  // Bright Cyan
    };

    public static final String RESET = "\u001B[0m";

    private static final char VERTICAL_LINE = '│';
    private static final char HORIZONTAL_LINE = '─';
    private static final char CORNER_BL = '└';

    private static final int BRAILLE_BASE = 0x2800;
    private static final int[] LEFT_COLUMN_BITS = {0x01, 0x02, 0x04, 0x40};
    private static final int[] RIGHT_COLUMN_BITS = {0x08, 0x10, 0x20, 0x80};

    private static final int Y_LABEL_WIDTH = 8;

    private final int width;
    private final int height;
    private final boolean color;

    /// @param width plot width in characters
    /// @param height plot height in lines
    /// @param color whether to emit ANSI colors
    public BraillePlot(int width, int height, boolean color) {
        if (width < 4 || height < 2) {
            throw new IllegalArgumentException("Plot must be at least 4x2 characters, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.color = color;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /// Renders overlaid scatter series.
    ///
    /// @param xSeries x values, one array per series
    /// @param ySeries y values, parallel to xSeries
    /// @param labels legend labels, or null for no legend
    /// @return the rendered plot, ending in a newline
    public String scatter(List<double[]> xSeries, List<double[]> ySeries, List<String> labels) {
        if (xSeries.size() != ySeries.size()) {
            throw new IllegalArgumentException("x and y series counts differ: " + xSeries.size() + " vs " + ySeries.size());
        }
        Range xRange = Range.of(xSeries);
        Range yRange = Range.of(ySeries);
        if (xRange == null || yRange == null) {
            return "(no data)\n";
        }

        int gridWidth = width * 2;
        int gridHeight = height * 4;
        int[][] seriesGrid = new int[gridHeight][gridWidth];
        for (int[] row : seriesGrid) {
            Arrays.fill(row, -1);
        }

        for (int s = 0; s < xSeries.size(); s++) {
            double[] x = xSeries.get(s);
            double[] y = ySeries.get(s);
            int n = Math.min(x.length, y.length);
            for (int i = 0; i < n; i++) {
                int px = xRange.pixel(x[i], gridWidth);
                int py = yRange.pixel(y[i], gridHeight);
                seriesGrid[gridHeight - 1 - py][px] = s;
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < height; row++) {
            appendYLabel(sb, row, yRange.max, yRange.min);
            for (int col = 0; col < width; col++) {
                int[] seriesBits = new int[xSeries.size()];
                int combinedBits = 0;
                for (int dx = 0; dx < 2; dx++) {
                    for (int dy = 0; dy < 4; dy++) {
                        int s = seriesGrid[row * 4 + dy][col * 2 + dx];
                        if (s >= 0) {
                            int bit = dx == 0 ? LEFT_COLUMN_BITS[dy] : RIGHT_COLUMN_BITS[dy];
                            seriesBits[s] |= bit;
                            combinedBits |= bit;
                        }
                    }
                }
                appendCell(sb, combinedBits, dominant(seriesBits));
            }
            sb.append('\n');
        }
        appendXAxis(sb, xRange);
        appendLegend(sb, labels, xSeries.size());
        return sb.toString();
    }

    /// Renders overlaid histograms on a shared value range. Bar heights are
    /// scaled to the tallest bin of any series.
    ///
    /// @param seriesData values, one array per series
    /// @param labels legend labels, or null for no legend
    /// @return the rendered plot, ending in a newline
    public String histogram(List<double[]> seriesData, List<String> labels) {
        Range range = Range.of(seriesData);
        if (range == null) {
            return "(no data)\n";
        }

        int bins = width * 2;
        int[][] counts = new int[seriesData.size()][bins];
        int maxCount = 0;
        for (int s = 0; s < seriesData.size(); s++) {
            for (double v : seriesData.get(s)) {
                counts[s][range.pixel(v, bins)]++;
            }
            for (int c : counts[s]) {
                maxCount = Math.max(maxCount, c);
            }
        }

        int gridHeight = height * 4;
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < height; row++) {
            appendYLabel(sb, row, maxCount, 0);
            for (int col = 0; col < width; col++) {
                int[] seriesBits = new int[seriesData.size()];
                int combinedBits = 0;
                for (int dx = 0; dx < 2; dx++) {
                    int bin = col * 2 + dx;
                    for (int s = 0; s < seriesData.size(); s++) {
                        int filledRows = maxCount > 0 ? (int) Math.round((double) counts[s][bin] / maxCount * gridHeight) : 0;
                        for (int dy = 0; dy < 4; dy++) {
                            int rowFromBottom = gridHeight - 1 - (row * 4 + dy);
                            if (rowFromBottom < filledRows) {
                                int bit = dx == 0 ? LEFT_COLUMN_BITS[dy] : RIGHT_COLUMN_BITS[dy];
                                seriesBits[s] |= bit;
                                combinedBits |= bit;
                            }
                        }
                    }
                }
                appendCell(sb, combinedBits, dominant(seriesBits));
            }
            sb.append('\n');
        }
        appendXAxis(sb, range);
        appendLegend(sb, labels, seriesData.size());
        return sb.toString();
    }

    private static int dominant(int[] seriesBits) {
        int dominant = -1;
        int maxBits = 0;
        for (int s = 0; s < seriesBits.length; s++) {
            int count = Integer.bitCount(seriesBits[s]);
            if (count > maxBits) {
                maxBits = count;
                dominant = s;
            }
        }
        return dominant;
    }

    private void appendCell(StringBuilder sb, int bits, int series) {
        if (color && series >= 0 && bits > 0) {
            sb.append(SERIES_COLORS[series % SERIES_COLORS.length]);
            sb.append((char) (BRAILLE_BASE + bits));
            sb.append(RESET);
        } else {
            sb.append((char) (BRAILLE_BASE + bits));
        }
    }

    private void appendYLabel(StringBuilder sb, int row, double top, double bottom) {
        if (row == 0) {
            sb.append(String.format("%" + (Y_LABEL_WIDTH - 1) + "s", formatTick(top))).append(VERTICAL_LINE);
        } else if (row == height - 1) {
            sb.append(String.format("%" + (Y_LABEL_WIDTH - 1) + "s", formatTick(bottom))).append(VERTICAL_LINE);
        } else {
            sb.append(" ".repeat(Y_LABEL_WIDTH - 1)).append(VERTICAL_LINE);
        }
    }

    private void appendXAxis(StringBuilder sb, Range range) {
        sb.append(" ".repeat(Y_LABEL_WIDTH - 1)).append(CORNER_BL);
        sb.append(String.valueOf(HORIZONTAL_LINE).repeat(width));
        sb.append('\n');

        String minLabel = formatTick(range.min);
        String midLabel = formatTick((range.min + range.max) / 2);
        String maxLabel = formatTick(range.max);
        StringBuilder axis = new StringBuilder(" ".repeat(Y_LABEL_WIDTH)).append(minLabel);
        int midStart = Y_LABEL_WIDTH + width / 2 - midLabel.length() / 2;
        axis.append(" ".repeat(Math.max(1, midStart - axis.length()))).append(midLabel);
        int maxStart = Y_LABEL_WIDTH + width - maxLabel.length();
        axis.append(" ".repeat(Math.max(1, maxStart - axis.length()))).append(maxLabel);
        sb.append(axis).append('\n');
    }

    private void appendLegend(StringBuilder sb, List<String> labels, int seriesCount) {
        if (labels == null || seriesCount == 0) {
            return;
        }
        for (int s = 0; s < seriesCount; s++) {
            String label = s < labels.size() ? labels.get(s) : "Series " + (s + 1);
            sb.append("   ");
            if (color) {
                sb.append(SERIES_COLORS[s % SERIES_COLORS.length]).append('●').append(RESET);
            } else {
                sb.append('●');
            }
            sb.append(' ').append(label).append('\n');
        }
    }

    static String formatTick(double value) {
        double abs = Math.abs(value);
        if (abs >= 10_000 || (abs > 0 && abs < 0.01)) {
            return String.format("%.2e", value);
        }
        return String.format("%.2f", value);
    }

    /// Closed value range shared by all series of a plot.
    private static final class Range {
        private final double min;
        private final double max;

        private Range(double min, double max) {
            this.min = min;
            this.max = max == min ? min + 1 : max;
        }

        static Range of(List<double[]> series) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] values : series) {
                for (double v : values) {
                    if (v < min) min = v;
                    if (v > max) max = v;
                }
            }
            return min <= max ? new Range(min, max) : null;
        }

        int pixel(double value, int cells) {
            int p = (int) ((value - min) / (max - min) * (cells - 1));
            return Math.max(0, Math.min(cells - 1, p));
        }
    }
}
