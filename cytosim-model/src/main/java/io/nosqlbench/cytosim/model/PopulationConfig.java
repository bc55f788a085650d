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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON-serializable population definitions.
 *
 * <h2>Purpose</h2>
 *
 * <p>Lets a session start from a file instead of the built-in defaults, and lets
 * the {@code parameters} command save an edited set of populations.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "populations": [
 *     {
 *       "name": "lymphocytes",
 *       "proportion": 0.6,
 *       "double_positive_fraction": 0.1,     // optional, default 0.1
 *       "fsc": {"mean": 8.0,  "std_dev": 1.5},
 *       "ssc": {"mean": 15.0, "std_dev": 2.0},
 *       "fl1": {"mean": 30.0, "std_dev": 5.0},
 *       "fl2": {"mean": 10.0, "std_dev": 2.0}
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>Values pass through the same validation as registry edits, so a file with a
 * non-positive {@code std_dev} or a proportion outside (0, 1] is rejected with
 * {@link PopulationValidationException}.
 *
 * @see PopulationRegistry
 */
public class PopulationConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("populations")
    private List<PopulationEntry> populations = new ArrayList<>();

    /**
     * Definition of a single population.
     */
    public static class PopulationEntry {
        @SerializedName("name")
        private String name;

        @SerializedName("proportion")
        private Double proportion;

        @SerializedName("double_positive_fraction")
        private Double doublePositiveFraction;

        @SerializedName("fsc")
        private ChannelEntry fsc;

        @SerializedName("ssc")
        private ChannelEntry ssc;

        @SerializedName("fl1")
        private ChannelEntry fl1;

        @SerializedName("fl2")
        private ChannelEntry fl2;

        public PopulationEntry() {
        }

        PopulationEntry(PopulationSpec spec) {
            this.name = spec.name();
            this.proportion = spec.proportion();
            this.doublePositiveFraction = spec.doublePositiveFraction();
            this.fsc = new ChannelEntry(spec.channel(Channel.FSC));
            this.ssc = new ChannelEntry(spec.channel(Channel.SSC));
            this.fl1 = new ChannelEntry(spec.channel(Channel.FL1));
            this.fl2 = new ChannelEntry(spec.channel(Channel.FL2));
        }

        PopulationSpec toSpec() {
            if (name == null || name.isBlank()) {
                throw new PopulationValidationException("Population entry is missing a name");
            }
            if (proportion == null) {
                throw new PopulationValidationException("Population '" + name + "' is missing a proportion");
            }
            PopulationSpec.Builder builder = PopulationSpec.builder(name).proportion(proportion);
            if (doublePositiveFraction != null) {
                builder.doublePositiveFraction(doublePositiveFraction);
            }
            applyChannel(builder, Channel.FSC, fsc);
            applyChannel(builder, Channel.SSC, ssc);
            applyChannel(builder, Channel.FL1, fl1);
            applyChannel(builder, Channel.FL2, fl2);
            return builder.build();
        }

        private void applyChannel(PopulationSpec.Builder builder, Channel channel, ChannelEntry entry) {
            if (entry == null || entry.mean == null || entry.stdDev == null) {
                throw new PopulationValidationException(
                    "Population '" + name + "' needs mean and std_dev for " + channel.columnName());
            }
            builder.channel(channel, entry.mean, entry.stdDev);
        }
    }

    /**
     * Mean and standard deviation of one channel.
     */
    public static class ChannelEntry {
        @SerializedName("mean")
        private Double mean;

        @SerializedName("std_dev")
        private Double stdDev;

        public ChannelEntry() {
        }

        ChannelEntry(ChannelModel model) {
            this.mean = model.mean();
            this.stdDev = model.stdDev();
        }
    }

    public PopulationConfig() {
    }

    /**
     * Captures the current contents of a registry.
     *
     * @param registry the registry to capture
     * @return a config with one entry per population, in order
     */
    public static PopulationConfig from(PopulationRegistry registry) {
        PopulationConfig config = new PopulationConfig();
        for (PopulationSpec spec : registry.list()) {
            config.populations.add(new PopulationEntry(spec));
        }
        return config;
    }

    /**
     * Validates every entry and builds a registry from them.
     *
     * @return a new registry in file order
     * @throws PopulationValidationException if any entry is invalid or names repeat
     */
    public PopulationRegistry toRegistry() {
        List<PopulationSpec> specs = new ArrayList<>();
        if (populations != null) {
            for (int i = 0; i < populations.size(); i++) {
                PopulationEntry entry = populations.get(i);
                if (entry == null) {
                    throw new PopulationValidationException("Population entry " + i + " is null");
                }
                specs.add(entry.toSpec());
            }
        }
        return new PopulationRegistry(specs);
    }

    /**
     * @return the number of population entries
     */
    public int size() {
        return populations == null ? 0 : populations.size();
    }

    /**
     * Parses a config from JSON text.
     *
     * @param json the JSON text
     * @return the parsed config
     * @throws PopulationValidationException if the JSON is malformed
     */
    public static PopulationConfig fromJson(String json) {
        try {
            PopulationConfig config = GSON.fromJson(json, PopulationConfig.class);
            return config == null ? new PopulationConfig() : config;
        } catch (JsonParseException e) {
            throw new PopulationValidationException("Malformed population config: " + e.getMessage());
        }
    }

    /**
     * Reads a config from a reader.
     *
     * @param reader the source
     * @return the parsed config
     * @throws PopulationValidationException if the JSON is malformed
     */
    public static PopulationConfig load(Reader reader) {
        try {
            PopulationConfig config = GSON.fromJson(reader, PopulationConfig.class);
            return config == null ? new PopulationConfig() : config;
        } catch (JsonParseException e) {
            throw new PopulationValidationException("Malformed population config: " + e.getMessage());
        }
    }

    /**
     * Reads a config from a file.
     *
     * @param path the JSON file
     * @return the parsed config
     * @throws IOException if the file cannot be read
     */
    public static PopulationConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        }
    }

    /**
     * @return this config as pretty-printed JSON
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Writes this config as JSON.
     * @param writer the destination
     */
    public void save(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Writes this config to a file, creating parent directories as needed.
     *
     * @param path the destination file
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path)) {
            save(writer);
        }
    }
}
