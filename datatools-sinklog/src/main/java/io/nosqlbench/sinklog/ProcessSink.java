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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Holds the one sink a process logs through. The sink is built lazily, on the
 * first {@link #configure(SinkConfig)} or {@link #get()}, and is never
 * replaced afterwards.
 *
 * <h2>First Call Wins</h2>
 * <p>The configuration of the first successful construction stays in effect.
 * Later {@code configure} calls return the existing sink and are otherwise
 * ignored; a differing configuration is reported as a warning on this class's
 * logger. Call {@code configure} at startup, before anything logs, or the
 * default configuration will have been used already.</p>
 *
 * <h2>Default Configuration</h2>
 * <p>{@link #get()} builds the sink from {@link #defaultConfig()}: the
 * {@code sinklog.*} system properties when they name a type, otherwise the
 * colored console.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Concurrent first calls construct exactly one sink and all of them observe
 * it. A construction that fails publishes nothing, so a later call tries again.</p>
 *
 * @see SinkLog
 */
public final class ProcessSink {

    /** The configuration used when neither the caller nor system properties provide one. */
    public static final SinkConfig BUILT_IN_DEFAULT =
        SinkConfig.of(SinkConfig.TYPE, SinkFactory.STD_OUT_TYPE, SinkConfig.COLOR, "");

    private static final Logger logger = LogManager.getLogger(ProcessSink.class);

    private final SinkFactory factory;
    private final Supplier<SinkConfig> defaultConfig;
    private final Object constructionLock = new Object();
    private volatile Installed installed;

    /**
     * @param factory the factory that builds the sink
     * @param defaultConfig supplies the configuration used by {@link #get()} when nothing was configured
     */
    public ProcessSink(SinkFactory factory, Supplier<SinkConfig> defaultConfig) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
    }

    /**
     * @return the holder of the process-wide sink, backed by {@link SinkFactory#global()}
     */
    public static ProcessSink global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * @return the {@code sinklog.*} system properties if they contain a type,
     *     otherwise {@link #BUILT_IN_DEFAULT}
     */
    public static SinkConfig defaultConfig() {
        SinkConfig fromProperties = SinkConfig.fromSystemProperties();
        return fromProperties.contains(SinkConfig.TYPE) ? fromProperties : BUILT_IN_DEFAULT;
    }

    /**
     * Builds the sink from {@code config} unless one exists already.
     *
     * @param config the sink configuration
     * @return the sink in effect, which was built from {@code config} only if this was the first call
     * @throws SinkException if this call constructs the sink and construction fails
     */
    public LogSink configure(SinkConfig config) throws SinkException {
        Objects.requireNonNull(config, "config");
        Installed current = install(config);
        if (!current.config.equals(config)) {
            logger.warn("Sink already configured with {}, ignoring {}", current.config, config);
        }
        return current.sink;
    }

    /**
     * @return the sink, built from the default configuration if none exists yet
     * @throws UncheckedSinkException if the default configuration cannot be built
     */
    public LogSink get() {
        Installed current = installed;
        if (current != null) {
            return current.sink;
        }
        try {
            return install(defaultConfig.get()).sink;
        } catch (SinkException e) {
            throw new UncheckedSinkException(e);
        }
    }

    public boolean isConfigured() {
        return installed != null;
    }

    /**
     * @return the configuration the sink was built from, empty before construction
     */
    public Optional<SinkConfig> getConfig() {
        Installed current = installed;
        return current == null ? Optional.empty() : Optional.of(current.config);
    }

    private Installed install(SinkConfig config) throws SinkException {
        Installed current = installed;
        if (current != null) {
            return current;
        }
        synchronized (constructionLock) {
            current = installed;
            if (current == null) {
                current = new Installed(factory.produce(config), config);
                installed = current;
                logger.debug("Process sink built from {}", config);
            }
            return current;
        }
    }

    private static final class Installed {
        private final LogSink sink;
        private final SinkConfig config;

        private Installed(LogSink sink, SinkConfig config) {
            this.sink = sink;
            this.config = config;
        }
    }

    private static final class GlobalHolder {
        private static final ProcessSink INSTANCE = new ProcessSink(SinkFactory.global(), ProcessSink::defaultConfig);
    }
}
