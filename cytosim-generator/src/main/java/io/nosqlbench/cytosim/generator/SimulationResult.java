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

/// Output of one simulation run.
///
/// @param raw the table before spillover, with the double-positive boost applied
/// @param mixed the table after spillover; this is what a cytometer would report
/// @param options the options the run used
public record SimulationResult(CytometryTable raw, CytometryTable mixed, GeneratorOptions options) {

    /// @return the number of events in the run
    public int rowCount() {
        return mixed.rowCount();
    }
}
