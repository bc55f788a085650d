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

/// Cell population parameters for synthetic flow cytometry.
///
/// [io.nosqlbench.cytosim.model.PopulationRegistry] owns the mutable set of
/// [io.nosqlbench.cytosim.model.PopulationSpec]s for one session; each spec holds
/// a proportion, a double-positive fraction and one
/// [io.nosqlbench.cytosim.model.ChannelModel] per
/// [io.nosqlbench.cytosim.model.Channel]. Definitions can be loaded from and
/// saved to JSON with [io.nosqlbench.cytosim.model.PopulationConfig].
package io.nosqlbench.cytosim.model;
