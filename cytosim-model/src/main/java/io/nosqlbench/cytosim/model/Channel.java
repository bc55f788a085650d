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


/// Measurement channels of the simulated cytometer.
///
/// Scatter channels are proxies for cell size (FSC) and internal complexity (SSC).
/// FL1 and FL2 are the two fluorescence detectors, which are the only channels
/// subject to spillover and to the double-positive boost.
public enum Channel {

    /// Forward scatter.
    FSC("FSC", false),
    /// Side scatter.
    SSC("SSC", false),
    /// First fluorescence detector.
    FL1("FL1", true),
    /// Second fluorescence detector.
    FL2("FL2", true);

    private final String columnName;
    private final boolean fluorescence;

    Channel(String columnName, boolean fluorescence) {
        this.columnName = columnName;
        this.fluorescence = fluorescence;
    }

    /// @return the stable column name used in tables and plots
    public String columnName() {
        return columnName;
    }

    /// @return true for FL1 and FL2
    public boolean isFluorescence() {
        return fluorescence;
    }
}
