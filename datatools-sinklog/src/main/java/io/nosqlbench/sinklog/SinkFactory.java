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

import io.nosqlbench.sinklog.sinks.ConsoleLogSink;
import io.nosqlbench.sinklog.sinks.FileLogSink;
import io.nosqlbench.sinklog.sinks.NullLogSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A registry of sink constructors keyed by type name, and the factory that
 * produces sinks from configurations using it.
 *
 * <h2>Built-in Types</h2>
 * <ul>
 *   <li>{@code ""} - {@link NullLogSink}</li>
 *   <li>{@code "std_out"} - {@link ConsoleLogSink}</li>
 *   <li>{@code "file"} - {@link FileLogSink}</li>
 * </ul>
 *
 * <h2>Custom Types</h2>
 * <pre>{@code
 * SinkFactory.global().register("memory", config -> new MemorySink(config));
 * LogSink sink = SinkFactory.global().produce(SinkConfig.of("type", "memory"));
 * }</pre>
 *
 * <p>Types can also be contributed through {@link SinkProvider} services.
 * Entries are added or replaced, never removed. Registration is meant to
 * happen during initialization; lookups are safe from any thread.</p>
 */
public class SinkFactory {

    public static final String NULL_TYPE = "";
    public static final String STD_OUT_TYPE = "std_out";
    public static final String FILE_TYPE = "file";

    private static final Logger logger = LogManager.getLogger(SinkFactory.class);

    private final Map<String, SinkConstructor> constructors = new ConcurrentHashMap<>();

    /**
     * Creates a factory holding only the built-in types.
     */
    public SinkFactory() {
        register(NULL_TYPE, NullLogSink::create);
        register(STD_OUT_TYPE, ConsoleLogSink::new);
        register(FILE_TYPE, FileLogSink::new);
    }

    /**
     * @return the process-wide factory: the built-in types plus every
     *     {@link SinkProvider} visible to this library's class loader
     */
    public static SinkFactory global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Adds a sink type, replacing any constructor registered under the same name.
     *
     * @param typeName the value of the {@value SinkConfig#TYPE} key that selects this constructor
     * @param constructor builds sinks of this type
     * @return this factory
     */
    public SinkFactory register(String typeName, SinkConstructor constructor) {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(constructor, "constructor");
        if (constructors.put(typeName, constructor) != null) {
            logger.debug("Replaced sink type '{}'", typeName);
        }
        return this;
    }

    /**
     * Registers every {@link SinkProvider} that {@link ServiceLoader} finds.
     *
     * @param classLoader the loader to search
     * @return this factory
     */
    public SinkFactory registerProviders(ClassLoader classLoader) {
        for (SinkProvider provider : ServiceLoader.load(SinkProvider.class, classLoader)) {
            register(provider.typeName(), provider);
            logger.debug("Registered sink type '{}' from {}", provider.typeName(), provider.getClass().getName());
        }
        return this;
    }

    public boolean isRegistered(String typeName) {
        return constructors.containsKey(typeName);
    }

    /**
     * @return a sorted snapshot of the registered type names
     */
    public SortedSet<String> registeredTypes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(constructors.keySet()));
    }

    /**
     * Produces a sink of the type named by the {@value SinkConfig#TYPE} key.
     *
     * @param config the sink configuration
     * @return a new, fully constructed sink
     * @throws SinkConfigException if the type is missing or not registered, or the sink rejects its configuration
     * @throws SinkResourceException if the sink cannot acquire its resource
     * @throws SinkException for failures of sink types that define their own
     */
    public LogSink produce(SinkConfig config) throws SinkException {
        String type = config.require(SinkConfig.TYPE, "Sink factory configuration requires a type of sink");
        SinkConstructor constructor = constructors.get(type);
        if (constructor == null) {
            throw new SinkConfigException(SinkConfig.TYPE,
                "Couldn't produce sink for type: '" + type + "', registered types are " + registeredTypes());
        }
        return constructor.create(config);
    }

    private static final class GlobalHolder {
        private static final SinkFactory INSTANCE =
            new SinkFactory().registerProviders(SinkFactory.class.getClassLoader());
    }
}
