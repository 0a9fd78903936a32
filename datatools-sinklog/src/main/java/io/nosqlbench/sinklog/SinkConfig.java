/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.sinklog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * An immutable set of string settings from which a sink is produced. Each sink
 * kind reads the keys it understands and ignores the rest.
 *
 * <h2>Common Keys</h2>
 * <ul>
 *   <li>{@value #TYPE} - the registered sink type, required by {@link SinkFactory#produce(SinkConfig)}</li>
 *   <li>{@value #COLOR} - presence enables colored labels on the console sink</li>
 *   <li>{@value #FILE_NAME} - base name of the file sink's file, required by that sink</li>
 *   <li>{@value #REOPEN_INTERVAL} - seconds between file reopens, defaults to 300</li>
 *   <li>{@value #LOGGER_NAME} - target logger of the log4j sink</li>
 * </ul>
 *
 * <h2>Sources</h2>
 * <pre>{@code
 * SinkConfig console = SinkConfig.of("type", "std_out", "color", "");
 * SinkConfig file = SinkConfig.builder()
 *     .with("type", "file")
 *     .with("file_name", "app.log")
 *     .build();
 * // -Dsinklog.type=file -Dsinklog.file_name=app.log
 * SinkConfig fromProps = SinkConfig.fromSystemProperties();
 * }</pre>
 */
public final class SinkConfig {

    public static final String TYPE = "type";
    public static final String COLOR = "color";
    public static final String FILE_NAME = "file_name";
    public static final String REOPEN_INTERVAL = "reopen_interval";
    public static final String LOGGER_NAME = "logger_name";

    /** Prefix of the system properties read by {@link #fromSystemProperties()}. */
    public static final String SYSTEM_PROPERTY_PREFIX = "sinklog.";

    private static final SinkConfig EMPTY = new SinkConfig(Map.of());

    private final Map<String, String> values;

    private SinkConfig(Map<String, String> values) {
        this.values = values;
    }

    public static SinkConfig empty() {
        return EMPTY;
    }

    /**
     * @param values the settings to copy
     * @return a configuration holding a copy of {@code values}
     */
    public static SinkConfig of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return new SinkConfig(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * @param keysAndValues alternating keys and values
     * @return a configuration holding the given pairs
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static SinkConfig of(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keys and values must be given in pairs");
        }
        Builder builder = builder();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            builder.with(keysAndValues[i], keysAndValues[i + 1]);
        }
        return builder.build();
    }

    /**
     * Reads every property whose name starts with {@code prefix}, with the
     * prefix removed from the key.
     *
     * @param properties the properties to scan
     * @param prefix the key prefix, may be empty
     * @return the matching settings
     */
    public static SinkConfig fromProperties(Properties properties, String prefix) {
        Builder builder = builder();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(prefix)) {
                builder.with(name.substring(prefix.length()), properties.getProperty(name));
            }
        }
        return builder.build();
    }

    /**
     * @return the settings given as {@code -Dsinklog.<key>=<value>}
     * @see #SYSTEM_PROPERTY_PREFIX
     */
    public static SinkConfig fromSystemProperties() {
        return fromProperties(System.getProperties(), SYSTEM_PROPERTY_PREFIX);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * @param key the required key
     * @param message the failure description when the key is absent
     * @return the value of {@code key}
     * @throws SinkConfigException if {@code key} is absent
     */
    public String require(String key, String message) throws SinkConfigException {
        String value = values.get(key);
        if (value == null) {
            throw new SinkConfigException(key, message);
        }
        return value;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, String> asMap() {
        return values;
    }

    /**
     * @param key the key to set
     * @param value the value to set
     * @return a copy of this configuration with {@code key} set to {@code value}
     */
    public SinkConfig with(String key, String value) {
        return builder().withAll(this).with(key, value).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SinkConfig)) {
            return false;
        }
        return values.equals(((SinkConfig) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /** Accumulates settings for a {@link SinkConfig}. */
    public static final class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder with(String key, String value) {
            values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder withAll(SinkConfig other) {
            values.putAll(other.values);
            return this;
        }

        public SinkConfig build() {
            return values.isEmpty() ? EMPTY : new SinkConfig(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
