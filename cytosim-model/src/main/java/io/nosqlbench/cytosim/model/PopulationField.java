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
import java.util.Locale;
import java.util.stream.Collectors;

/// Editable parameters of a [PopulationSpec], addressed by snake_case key.
///
/// Each field carries its own validation domain:
///
/// | field                      | domain              |
/// |----------------------------|---------------------|
/// | `proportion`               | (0, 1]              |
/// | `*_mean`                   | finite              |
/// | `*_std`                    | (0, +∞), finite     |
/// | `double_positive_fraction` | [0, 1]              |
public enum PopulationField {

    PROPORTION("proportion", null, Domain.PROPORTION),
    FSC_MEAN("fsc_mean", Channel.FSC, Domain.MEAN),
    FSC_STD("fsc_std", Channel.FSC, Domain.STD_DEV),
    SSC_MEAN("ssc_mean", Channel.SSC, Domain.MEAN),
    SSC_STD("ssc_std", Channel.SSC, Domain.STD_DEV),
    FL1_MEAN("fl1_mean", Channel.FL1, Domain.MEAN),
    FL1_STD("fl1_std", Channel.FL1, Domain.STD_DEV),
    FL2_MEAN("fl2_mean", Channel.FL2, Domain.MEAN),
    FL2_STD("fl2_std", Channel.FL2, Domain.STD_DEV),
    DOUBLE_POSITIVE_FRACTION("double_positive_fraction", null, Domain.FRACTION);

    private enum Domain {
        PROPORTION,
        MEAN,
        STD_DEV,
        FRACTION
    }

    private final String key;
    private final Channel channel;
    private final Domain domain;

    PopulationField(String key, Channel channel, Domain domain) {
        this.key = key;
        this.channel = channel;
        this.domain = domain;
    }

    /// @return the snake_case key, e.g. `fsc_std`
    public String key() {
        return key;
    }

    /// @return the channel this field parameterizes, or null for proportion and fraction
    public Channel channel() {
        return channel;
    }

    /// @return true if this field is a channel standard deviation
    public boolean isStdDev() {
        return domain == Domain.STD_DEV;
    }

    /// @return true if this field is a channel mean
    public boolean isMean() {
        return domain == Domain.MEAN;
    }

    /// Checks a candidate value against this field's domain.
    ///
    /// @param population the population name, used in the error message
    /// @param value the candidate value
    /// @throws PopulationValidationException if the value is outside the domain
    public void validate(String population, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new PopulationValidationException(population, this, value, "value must be a finite number");
        }
        switch (domain) {
            case PROPORTION:
                if (value <= 0.0 || value > 1.0) {
                    throw new PopulationValidationException(population, this, value, "must be in (0, 1]");
                }
                break;
            case STD_DEV:
                if (value <= 0.0) {
                    throw new PopulationValidationException(population, this, value, "must be strictly positive");
                }
                break;
            case FRACTION:
                if (value < 0.0 || value > 1.0) {
                    throw new PopulationValidationException(population, this, value, "must be in [0, 1]");
                }
                break;
            default:
                break;
        }
    }

    /// Resolves a field by key, ignoring case and allowing `-` for `_`.
    ///
    /// @param key a field key such as `fsc_std` or `FSC-STD`
    /// @return the matching field
    /// @throws PopulationValidationException if the key names no field
    public static PopulationField fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (PopulationField field : values()) {
                if (field.key.equals(normalized)) {
                    return field;
                }
            }
        }
        throw new PopulationValidationException(
            "Unknown parameter '" + key + "'; expected one of " + keys());
    }

    /// @return all field keys, comma separated, in declaration order
    public static String keys() {
        return Arrays.stream(values()).map(PopulationField::key).collect(Collectors.joining(", "));
    }

    /// Returns the mean field for a channel.
    ///
    /// @param channel the channel
    /// @return the `*_mean` field
    public static PopulationField meanOf(Channel channel) {
        switch (channel) {
            case FSC: return FSC_MEAN;
            case SSC: return SSC_MEAN;
            case FL1: return FL1_MEAN;
            case FL2: return FL2_MEAN;
            default: throw new IllegalArgumentException("Unknown channel: " + channel);
        }
    }

    /// Returns the standard deviation field for a channel.
    ///
    /// @param channel the channel
    /// @return the `*_std` field
    public static PopulationField stdDevOf(Channel channel) {
        switch (channel) {
            case FSC: return FSC_STD;
            case SSC: return SSC_STD;
            case FL1: return FL1_STD;
            case FL2: return FL2_STD;
            default: throw new IllegalArgumentException("Unknown channel: " + channel);
        }
    }
}
