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

package io.nosqlbench.sinklog.sinks;

import io.nosqlbench.sinklog.LevelCutoff;
import io.nosqlbench.sinklog.LogLevel;
import io.nosqlbench.sinklog.LogSink;
import io.nosqlbench.sinklog.SinkConfig;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A sink that routes messages through Log4j 2, for applications whose output
 * is already managed by a Log4j configuration. Formatting, timestamps and
 * destinations are left to the Log4j appenders.
 *
 * <p>The target logger is named by the {@value SinkConfig#LOGGER_NAME} key,
 * {@value #DEFAULT_LOGGER_NAME} by default. The sink cutoff applies first;
 * the logger's own level applies after it.</p>
 *
 * <pre>{@code
 * LogSink sink = SinkFactory.global().produce(
 *     SinkConfig.of("type", "log4j", "logger_name", "app.audit"));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Thread-safe through Log4j 2, which handles concurrent access to loggers
 * and their appenders.</p>
 */
public class Log4jLogSink implements LogSink {

    public static final String DEFAULT_LOGGER_NAME = "sinklog";

    private final Logger logger;
    private final LevelCutoff cutoff;

    public Log4jLogSink(SinkConfig config) {
        this(LogManager.getLogger(config.get(SinkConfig.LOGGER_NAME).orElse(DEFAULT_LOGGER_NAME)),
            LevelCutoff.process());
    }

    public Log4jLogSink(Logger logger, LevelCutoff cutoff) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.cutoff = Objects.requireNonNull(cutoff, "cutoff");
    }

    public Logger getLogger() {
        return logger;
    }

    @Override
    public void emit(String message, LogLevel level) {
        if (!cutoff.admits(level)) {
            return;
        }
        Level target = toLog4jLevel(level);
        if (logger.isEnabled(target)) {
            logger.log(target, message);
        }
    }

    /**
     * Logs the raw text at INFO with its trailing line terminator removed,
     * since Log4j layouts add their own.
     */
    @Override
    public void writeRaw(String text) {
        logger.info(stripLineTerminator(text));
    }

    static Level toLog4jLevel(LogLevel level) {
        return switch (level) {
            case TRACE -> Level.TRACE;
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static String stripLineTerminator(String text) {
        int end = text.length();
        if (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > 0 && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(0, end);
    }
}
