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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelStatisticsTest {

    @Test
    void testBasicMoments() {
        ChannelStatistics stats = ChannelStatistics.compute(Channel.FL1, new double[] {2, 4, 4, 4, 5, 5, 7, 9});
        assertEquals(Channel.FL1, stats.channel());
        assertEquals(8, stats.count());
        assertEquals(2.0, stats.min());
        assertEquals(9.0, stats.max());
        assertEquals(5.0, stats.mean(), 1e-12);
        assertEquals(4.0, stats.variance(), 1e-12);
        assertEquals(2.0, stats.stdDev(), 1e-12);
    }

    @Test
    void testConstantColumn() {
        ChannelStatistics stats = ChannelStatistics.compute(Channel.FSC, new double[] {3, 3, 3});
        assertEquals(0.0, stats.stdDev());
        assertEquals(0.0, stats.skewness());
        assertEquals(3.0, stats.kurtosis());
    }

    @Test
    void testDeviationFromModel() {
        ChannelStatistics stats = ChannelStatistics.compute(Channel.SSC, new double[] {9, 11});
        assertEquals(0.0, stats.deviationFrom(new ChannelModel(10, 1)), 1e-12);
        assertEquals(2.0, stats.deviationFrom(new ChannelModel(12, 1)), 1e-12);
    }

    @Test
    void testEmptyRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChannelStatistics.compute(Channel.FL2, new double[0]));
    }
}
