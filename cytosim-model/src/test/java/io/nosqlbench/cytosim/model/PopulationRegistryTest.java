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

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PopulationRegistryTest {

    @Test
    void testDefaultsInOrder() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        assertEquals(List.of("lymphocytes", "monocytes", "granulocytes"), registry.names());
        assertEquals(0.6, registry.get("lymphocytes").proportion());
        assertEquals(new ChannelModel(15, 3), registry.get("monocytes").channel(Channel.FSC));
        assertEquals(new ChannelModel(50, 7), registry.get("granulocytes").channel(Channel.FL2));
        assertTrue(registry.isNormalized());
    }

    @Test
    void testUpdateProportion() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        registry.update("lymphocytes", "proportion", 0.5);
        assertEquals(0.5, registry.get("lymphocytes").proportion());
        // others are not rescaled by a plain update
        assertEquals(0.3, registry.get("monocytes").proportion());
        assertFalse(registry.isNormalized());
    }

    @Test
    void testRejectedUpdateKeepsPriorValue() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        PopulationValidationException e = assertThrows(PopulationValidationException.class,
            () -> registry.update("lymphocytes", "fsc_std", -1));
        assertEquals("lymphocytes", e.getPopulation());
        assertEquals(PopulationField.FSC_STD, e.getField());
        assertEquals(-1.0, e.getRejectedValue());
        assertEquals(1.5, registry.get("lymphocytes").channel(Channel.FSC).stdDev());
    }

    @Test
    void testRejectsOutOfDomainValues() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        assertThrows(PopulationValidationException.class, () -> registry.update("monocytes", "proportion", 0.0));
        assertThrows(PopulationValidationException.class, () -> registry.update("monocytes", "proportion", 1.2));
        assertThrows(PopulationValidationException.class, () -> registry.update("monocytes", "ssc_std", 0.0));
        assertThrows(PopulationValidationException.class, () -> registry.update("monocytes", "fl1_mean", Double.NaN));
        assertThrows(PopulationValidationException.class,
            () -> registry.update("monocytes", "double_positive_fraction", 1.5));
        assertEquals(PopulationRegistry.defaultPopulations(), registry.list());
    }

    @Test
    void testUnknownNamesAndFields() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        assertThrows(PopulationNotFoundException.class, () -> registry.get("eosinophils"));
        assertThrows(PopulationNotFoundException.class, () -> registry.update("eosinophils", "fsc_mean", 3));
        assertThrows(PopulationValidationException.class, () -> registry.update("monocytes", "fsc_median", 3));
    }

    @Test
    void testNegativeMeanAllowed() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        registry.update("monocytes", PopulationField.FL2_MEAN, -5.0);
        assertEquals(-5.0, registry.get("monocytes").channel(Channel.FL2).mean());
    }

    @Test
    void testUpdateAllIsAtomic() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        Map<PopulationField, Double> edits = new EnumMap<>(PopulationField.class);
        edits.put(PopulationField.FSC_MEAN, 9.0);
        edits.put(PopulationField.SSC_STD, -2.0);
        assertThrows(PopulationValidationException.class, () -> registry.updateAll("lymphocytes", edits));
        assertEquals(8.0, registry.get("lymphocytes").channel(Channel.FSC).mean());

        edits.put(PopulationField.SSC_STD, 2.5);
        PopulationSpec updated = registry.updateAll("lymphocytes", edits);
        assertEquals(9.0, updated.channel(Channel.FSC).mean());
        assertEquals(2.5, updated.channel(Channel.SSC).stdDev());
    }

    @Test
    void testSnapshotIsDetached() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        List<PopulationSpec> snapshot = registry.snapshot();
        registry.update("granulocytes", "fl1_mean", 99);
        assertEquals(40.0, snapshot.get(2).channel(Channel.FL1).mean());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(0));
    }

    @Test
    void testRegisterAppendsAndRejectsDuplicates() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        PopulationSpec eosinophils = PopulationSpec.builder("eosinophils").proportion(0.05)
            .channel(Channel.FSC, 18, 3).build();
        registry.register(eosinophils);
        assertEquals("eosinophils", registry.names().get(3));
        assertThrows(PopulationValidationException.class, () -> registry.register(eosinophils));
        assertEquals(4, registry.size());
    }

    @Test
    void testRebalance() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        registry.rebalance("granulocytes", 0.2);
        assertEquals(0.2, registry.get("granulocytes").proportion(), 1e-12);
        assertEquals(0.6 / 0.9 * 0.8, registry.get("lymphocytes").proportion(), 1e-12);
        assertEquals(0.3 / 0.9 * 0.8, registry.get("monocytes").proportion(), 1e-12);
        assertTrue(registry.isNormalized());
    }

    @Test
    void testRebalanceToOneLeavesNothingForOthers() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        assertThrows(PopulationValidationException.class, () -> registry.rebalance("lymphocytes", 1.0));
        assertEquals(PopulationRegistry.defaultPopulations(), registry.list());
    }

    @Test
    void testNormalize() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        registry.update("lymphocytes", "proportion", 0.9);
        registry.normalize();
        assertTrue(registry.isNormalized());
        assertEquals(0.9 / 1.3, registry.get("lymphocytes").proportion(), 1e-12);
        assertThrows(PopulationValidationException.class, () -> new PopulationRegistry().normalize());
    }

    @Test
    void testReplaceAll() {
        PopulationRegistry registry = PopulationRegistry.withDefaults();
        PopulationSpec only = PopulationSpec.builder("blasts").build();
        registry.replaceAll(List.of(only));
        assertEquals(List.of("blasts"), registry.names());
        assertThrows(PopulationValidationException.class, () -> registry.replaceAll(List.of(only, only)));
        assertEquals(List.of("blasts"), registry.names());
    }
}
