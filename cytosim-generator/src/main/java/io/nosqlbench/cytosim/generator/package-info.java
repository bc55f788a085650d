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

/// Synthetic event generation for flow cytometry.
///
/// [io.nosqlbench.cytosim.generator.SampleGenerator] draws per-population events
/// from a [io.nosqlbench.cytosim.model.PopulationRegistry] snapshot,
/// [io.nosqlbench.cytosim.generator.TableAssembler] concatenates them into a
/// [io.nosqlbench.cytosim.generator.CytometryTable], and
/// [io.nosqlbench.cytosim.generator.SpilloverTransform] mixes the fluorescence
/// channels. [io.nosqlbench.cytosim.generator.CytometrySimulation] runs all three.
package io.nosqlbench.cytosim.generator;
