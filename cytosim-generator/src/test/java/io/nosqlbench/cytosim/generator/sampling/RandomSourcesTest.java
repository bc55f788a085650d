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

package io.nosqlbench.cytosim.generator.sampling;

import io.nosqlbench.cytosim.model.ChannelModel;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RandomSourcesTest {

    @Test
    void testSameSeedSameStream() {
        for (RandomSources.Algorithm algorithm : RandomSources.Algorithm.values()) {
            UniformRandomProvider a = RandomSources.create(algorithm, 1234L);
            UniformRandomProvider b = RandomSources.create(algorithm, 1234L);
            for (int i = 0; i < 16; i++) {
                assertEquals(a.nextLong(), b.nextLong(), algorithm.name());
            }
        }
    }

    @Test
    void testNormalChannelSamplerFill() {
        NormalChannelSampler sampler = NormalChannelSampler.of(new ChannelModel(30, 5), RandomSources.create(9L));
        assertEquals(30.0, sampler.mean());
        assertEquals(5.0, sampler.stdDev());

        double[] values = new double[20_000];
        sampler.fill(values);
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        assertEquals(30.0, sum / values.length, 0.2);
    }
}
