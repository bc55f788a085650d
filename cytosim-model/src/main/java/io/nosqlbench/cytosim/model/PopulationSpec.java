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

import java.util.Arrays;
import java.util.Objects;

/**
 * Parameters of one named cell population.
 *
 * <h2>Purpose</h2>
 *
 * <p>A population contributes {@code proportion × total} rows to a simulated
 * table. Each row draws FSC, SSC, FL1 and FL2 from the population's four
 * {@link ChannelModel}s, and a {@code double_positive_fraction} share of the
 * rows receives an additional FL1/FL2 boost.
 *
 * <h2>Immutability</h2>
 *
 * <p>Instances never change. Edits go through {@link #with(PopulationField, double)},
 * which validates the value and returns a new spec, so a rejected edit can never
 * leave a half-updated population behind.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * PopulationSpec lymphocytes = PopulationSpec.builder("lymphocytes")
 *     .proportion(0.6)
 *     .channel(Channel.FSC, 8, 1.5)
 *     .channel(Channel.SSC, 15, 2)
 *     .channel(Channel.FL1, 30, 5)
 *     .channel(Channel.FL2, 10, 2)
 *     .build();
 *
 * PopulationSpec wider = lymphocytes.with(PopulationField.FSC_STD, 2.5);
 * }</pre>
 *
 * @see PopulationRegistry
 */
public final class PopulationSpec {

    /** Share of each population's rows that receive the double-positive boost. */
    public static final double DEFAULT_DOUBLE_POSITIVE_FRACTION = 0.10;

    private final String name;
    private final double[] values;

    private PopulationSpec(String name, double[] values) {
        this.name = name;
        this.values = values;
    }

    /**
     * Returns the population name.
     * @return the name, unique within a registry
     */
    public String name() {
        return name;
    }

    /**
     * Returns the share of the requested total allocated to this population.
     * @return the proportion in (0, 1]
     */
    public double proportion() {
        return values[PopulationField.PROPORTION.ordinal()];
    }

    /**
     * Returns the share of rows receiving the double-positive boost.
     * @return the fraction in [0, 1]
     */
    public double doublePositiveFraction() {
        return values[PopulationField.DOUBLE_POSITIVE_FRACTION.ordinal()];
    }

    /**
     * Returns the current value of a field.
     * @param field the field to read
     * @return the field value
     */
    public double value(PopulationField field) {
        return values[field.ordinal()];
    }

    /**
     * Returns the normal distribution configured for a channel.
     * @param channel the measurement channel
     * @return the channel model
     */
    public ChannelModel channel(Channel channel) {
        return new ChannelModel(
            values[PopulationField.meanOf(channel).ordinal()],
            values[PopulationField.stdDevOf(channel).ordinal()]);
    }

    /**
     * Returns a copy of this spec with one field replaced.
     *
     * @param field the field to replace
     * @param value the new value
     * @return a new spec; this instance is unchanged
     * @throws PopulationValidationException if the value is outside the field's domain
     */
    public PopulationSpec with(PopulationField field, double value) {
        field.validate(name, value);
        double[] copy = values.clone();
        copy[field.ordinal()] = value;
        return new PopulationSpec(name, copy);
    }

    /**
     * Returns a copy of this spec under another name.
     * @param newName the new population name
     * @return a renamed copy
     */
    public PopulationSpec renamed(String newName) {
        return new PopulationSpec(requireName(newName), values.clone());
    }

    /**
     * Returns a builder initialized with this spec's values.
     * @return a pre-populated builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder(name);
        System.arraycopy(values, 0, builder.values, 0, values.length);
        return builder;
    }

    /**
     * Starts a new spec. Proportion defaults to 1.0, every channel to N(0, 1)
     * and the double-positive fraction to {@link #DEFAULT_DOUBLE_POSITIVE_FRACTION}.
     *
     * @param name the population name
     * @return a new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PopulationSpec)) return false;
        PopulationSpec that = (PopulationSpec) o;
        return name.equals(that.name) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PopulationSpec{name=").append(name);
        for (PopulationField field : PopulationField.values()) {
            sb.append(", ").append(field.key()).append('=').append(values[field.ordinal()]);
        }
        return sb.append('}').toString();
    }

    private static String requireName(String name) {
        Objects.requireNonNull(name, "population name cannot be null");
        if (name.isBlank()) {
            throw new PopulationValidationException("Population name must not be blank");
        }
        return name.trim();
    }

    /**
     * Builder for {@link PopulationSpec}. Every field is validated in {@link #build()}.
     */
    public static final class Builder {
        private final String name;
        private final double[] values = new double[PopulationField.values().length];

        Builder(String name) {
            this.name = requireName(name);
            values[PopulationField.PROPORTION.ordinal()] = 1.0;
            values[PopulationField.DOUBLE_POSITIVE_FRACTION.ordinal()] = DEFAULT_DOUBLE_POSITIVE_FRACTION;
            for (Channel channel : Channel.values()) {
                values[PopulationField.stdDevOf(channel).ordinal()] = 1.0;
            }
        }

        public Builder proportion(double proportion) {
            return set(PopulationField.PROPORTION, proportion);
        }

        public Builder doublePositiveFraction(double fraction) {
            return set(PopulationField.DOUBLE_POSITIVE_FRACTION, fraction);
        }

        public Builder channel(Channel channel, double mean, double stdDev) {
            set(PopulationField.meanOf(channel), mean);
            return set(PopulationField.stdDevOf(channel), stdDev);
        }

        public Builder set(PopulationField field, double value) {
            values[field.ordinal()] = value;
            return this;
        }

        /**
         * Builds the spec.
         * @return a validated, immutable spec
         * @throws PopulationValidationException if any field is outside its domain
         */
        public PopulationSpec build() {
            for (PopulationField field : PopulationField.values()) {
                field.validate(name, values[field.ordinal()]);
            }
            return new PopulationSpec(name, values.clone());
        }
    }
}
