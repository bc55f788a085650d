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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single source of truth for the population parameters of one simulation session.
 *
 * <h2>Lifecycle</h2>
 *
 * <p>A registry is created with the built-in defaults ({@link #withDefaults()}) or
 * from a configuration file, mutated in place through the validated operations
 * below, and discarded with the session. Populations are kept in registration
 * order, which is the order the generator emits them in.
 *
 * <h2>Validation</h2>
 *
 * <p>Every mutator validates before it writes. A rejected edit throws
 * {@link PopulationValidationException} and leaves the registry exactly as it was.
 *
 * <pre>{@code
 * PopulationRegistry registry = PopulationRegistry.withDefaults();
 * registry.update("lymphocytes", PopulationField.PROPORTION, 0.5);
 * registry.get("lymphocytes").proportion();   // 0.5
 * }</pre>
 *
 * <h2>Concurrency</h2>
 *
 * <p>Mutators and {@link #snapshot()} are synchronized; generation works on a
 * snapshot so it never observes a half-applied edit.
 */
public final class PopulationRegistry {

    private static final Logger logger = LogManager.getLogger(PopulationRegistry.class);

    /** Tolerance used by {@link #isNormalized()}. */
    public static final double PROPORTION_TOLERANCE = 1e-9;

    private final Map<String, PopulationSpec> populations = new LinkedHashMap<>();

    /**
     * Creates an empty registry.
     */
    public PopulationRegistry() {
    }

    /**
     * Creates a registry holding the given populations in order.
     *
     * @param specs the populations to register
     * @throws PopulationValidationException if two specs share a name
     */
    public PopulationRegistry(List<PopulationSpec> specs) {
        for (PopulationSpec spec : specs) {
            register(spec);
        }
    }

    /**
     * Creates a registry with the three built-in leukocyte populations.
     *
     * <pre>
     * name          proportion  FSC        SSC       FL1      FL2
     * lymphocytes   0.6         (8, 1.5)   (15, 2)   (30, 5)  (10, 2)
     * monocytes     0.3         (15, 3)    (25, 3)   (60, 8)  (30, 5)
     * granulocytes  0.1         (20, 4)    (35, 4)   (40, 6)  (50, 7)
     * </pre>
     *
     * @return a new registry with default populations
     */
    public static PopulationRegistry withDefaults() {
        return new PopulationRegistry(defaultPopulations());
    }

    /**
     * Returns the built-in population definitions.
     * @return lymphocytes, monocytes and granulocytes, in that order
     */
    public static List<PopulationSpec> defaultPopulations() {
        return List.of(
            PopulationSpec.builder("lymphocytes").proportion(0.6)
                .channel(Channel.FSC, 8, 1.5)
                .channel(Channel.SSC, 15, 2)
                .channel(Channel.FL1, 30, 5)
                .channel(Channel.FL2, 10, 2)
                .build(),
            PopulationSpec.builder("monocytes").proportion(0.3)
                .channel(Channel.FSC, 15, 3)
                .channel(Channel.SSC, 25, 3)
                .channel(Channel.FL1, 60, 8)
                .channel(Channel.FL2, 30, 5)
                .build(),
            PopulationSpec.builder("granulocytes").proportion(0.1)
                .channel(Channel.FSC, 20, 4)
                .channel(Channel.SSC, 35, 4)
                .channel(Channel.FL1, 40, 6)
                .channel(Channel.FL2, 50, 7)
                .build()
        );
    }

    /**
     * Looks up a population by name.
     *
     * @param name the population name
     * @return the current spec
     * @throws PopulationNotFoundException if no population has that name
     */
    public synchronized PopulationSpec get(String name) {
        PopulationSpec spec = name == null ? null : populations.get(name);
        if (spec == null) {
            throw new PopulationNotFoundException(name, populations.keySet());
        }
        return spec;
    }

    /**
     * Returns every population in registration order.
     * @return an unmodifiable copy of the current specs
     */
    public synchronized List<PopulationSpec> list() {
        return List.copyOf(populations.values());
    }

    /**
     * Returns an immutable view of the registry as it is right now.
     *
     * <p>Specs are immutable, so the copied list is a complete snapshot; later
     * edits to this registry do not affect it.
     *
     * @return the populations in registration order
     */
    public List<PopulationSpec> snapshot() {
        return list();
    }

    /**
     * Returns the registered names in order.
     * @return an unmodifiable list of names
     */
    public synchronized List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(populations.keySet()));
    }

    public synchronized boolean contains(String name) {
        return populations.containsKey(name);
    }

    public synchronized int size() {
        return populations.size();
    }

    public synchronized boolean isEmpty() {
        return populations.isEmpty();
    }

    /**
     * Adds a user-defined population at the end of the iteration order.
     *
     * @param spec the population to add
     * @throws PopulationValidationException if the name is already registered
     */
    public synchronized void register(PopulationSpec spec) {
        if (populations.containsKey(spec.name())) {
            throw new PopulationValidationException("Population '" + spec.name() + "' is already registered");
        }
        populations.put(spec.name(), spec);
        logger.debug("registered population {}", spec.name());
    }

    /**
     * Replaces the whole registry contents, keeping the given order.
     *
     * @param specs the new populations
     * @throws PopulationValidationException if two specs share a name; nothing is applied
     */
    public synchronized void replaceAll(List<PopulationSpec> specs) {
        Map<String, PopulationSpec> staged = new LinkedHashMap<>();
        for (PopulationSpec spec : specs) {
            if (staged.putIfAbsent(spec.name(), spec) != null) {
                throw new PopulationValidationException("Population '" + spec.name() + "' is listed twice");
            }
        }
        populations.clear();
        populations.putAll(staged);
        logger.debug("replaced registry with {}", staged.keySet());
    }

    /**
     * Replaces one field of a population.
     *
     * @param name the population name
     * @param field the field to change
     * @param value the new value
     * @return the updated spec
     * @throws PopulationNotFoundException if the population is unknown
     * @throws PopulationValidationException if the value is outside the field's domain;
     *     the prior value is retained
     */
    public synchronized PopulationSpec update(String name, PopulationField field, double value) {
        PopulationSpec current = get(name);
        PopulationSpec updated;
        try {
            updated = current.with(field, value);
        } catch (PopulationValidationException e) {
            logger.debug("rejected edit: {}", e.getMessage());
            throw e;
        }
        populations.put(name, updated);
        logger.debug("{}.{} {} -> {}", name, field.key(), current.value(field), value);
        return updated;
    }

    /**
     * Replaces one field of a population, addressing the field by key.
     *
     * @param name the population name
     * @param fieldKey a field key such as {@code fsc_std}
     * @param value the new value
     * @return the updated spec
     * @throws PopulationValidationException if the key is unknown or the value invalid
     */
    public PopulationSpec update(String name, String fieldKey, double value) {
        return update(name, PopulationField.fromKey(fieldKey), value);
    }

    /**
     * Applies several field edits to one population, all or nothing.
     *
     * @param name the population name
     * @param edits the fields to change and their new values
     * @return the updated spec
     * @throws PopulationValidationException if any value is invalid; nothing is applied
     */
    public synchronized PopulationSpec updateAll(String name, Map<PopulationField, Double> edits) {
        PopulationSpec updated = get(name);
        for (Map.Entry<PopulationField, Double> edit : edits.entrySet()) {
            updated = updated.with(edit.getKey(), edit.getValue());
        }
        populations.put(name, updated);
        return updated;
    }

    /**
     * Sets one population's proportion and rescales the others so the total is 1.
     *
     * <p>The remaining share {@code 1 - proportion} is distributed across the other
     * populations in proportion to their current values.
     *
     * @param name the population to change
     * @param proportion the new proportion, in (0, 1]
     * @return the updated registry contents, in order
     * @throws PopulationValidationException if the proportion is invalid, if a rescaled
     *     proportion would fall outside (0, 1], or if the other populations have no
     *     share to rescale; nothing is applied
     */
    public synchronized List<PopulationSpec> rebalance(String name, double proportion) {
        PopulationSpec target = get(name);
        PopulationField.PROPORTION.validate(name, proportion);

        double othersTotal = 0.0;
        for (PopulationSpec spec : populations.values()) {
            if (!spec.name().equals(name)) {
                othersTotal += spec.proportion();
            }
        }
        double remaining = 1.0 - proportion;

        Map<String, PopulationSpec> staged = new LinkedHashMap<>();
        for (PopulationSpec spec : populations.values()) {
            if (spec.name().equals(name)) {
                staged.put(name, target.with(PopulationField.PROPORTION, proportion));
            } else {
                if (othersTotal <= 0.0) {
                    throw new PopulationValidationException("Cannot rebalance: other populations have no share");
                }
                double scaled = spec.proportion() / othersTotal * remaining;
                staged.put(spec.name(), spec.with(PopulationField.PROPORTION, scaled));
            }
        }
        populations.clear();
        populations.putAll(staged);
        logger.debug("rebalanced proportions around {}={}", name, proportion);
        return list();
    }

    /**
     * Divides every proportion by the current total so the proportions sum to 1.
     *
     * @return the updated registry contents, in order
     * @throws PopulationValidationException if the registry is empty; nothing is applied
     */
    public synchronized List<PopulationSpec> normalize() {
        double total = proportionTotal();
        if (populations.isEmpty() || !(total > 0.0)) {
            throw new PopulationValidationException("Cannot normalize: no population proportions to scale");
        }
        Map<String, PopulationSpec> staged = new LinkedHashMap<>();
        for (PopulationSpec spec : populations.values()) {
            staged.put(spec.name(), spec.with(PopulationField.PROPORTION, spec.proportion() / total));
        }
        populations.clear();
        populations.putAll(staged);
        logger.debug("normalized proportions from total {}", total);
        return list();
    }

    /**
     * Returns the sum of all proportions.
     * @return the proportion total; not required to be 1
     */
    public synchronized double proportionTotal() {
        double total = 0.0;
        for (PopulationSpec spec : populations.values()) {
            total += spec.proportion();
        }
        return total;
    }

    /**
     * Checks whether the proportions sum to 1 within {@link #PROPORTION_TOLERANCE}.
     * @return true if normalized
     */
    public boolean isNormalized() {
        return Math.abs(proportionTotal() - 1.0) <= PROPORTION_TOLERANCE;
    }

    @Override
    public synchronized String toString() {
        return "PopulationRegistry" + populations.keySet();
    }
}
