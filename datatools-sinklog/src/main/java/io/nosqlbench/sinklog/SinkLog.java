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

/**
 * Static entry points for logging through the process-wide sink.
 *
 * <pre>{@code
 * public static void main(String[] args) throws SinkException {
 *     // optional; without it the colored console is used
 *     SinkLog.configure(SinkConfig.of("type", "file", "file_name", "app.log"));
 *     SinkLog.info("starting");
 *     SinkLog.writeRaw(Timestamps.now() + " [CUSTOM] hand formatted\n");
 * }
 * }</pre>
 *
 * <p>The level functions treat a failing sink as fatal to the call: a
 * {@link SinkResourceException} is rethrown as {@link UncheckedSinkException}.
 * Callers that want to handle write failures explicitly use {@link #sink()}.</p>
 *
 * @see ProcessSink
 */
public final class SinkLog {

    private SinkLog() {
    }

    /**
     * Configures the process-wide sink. Only the first configuration takes effect.
     *
     * @param config the sink configuration
     * @return the sink in effect
     * @throws SinkException if this call constructs the sink and construction fails
     */
    public static LogSink configure(SinkConfig config) throws SinkException {
        return ProcessSink.global().configure(config);
    }

    /**
     * @return the process-wide sink, built from the default configuration if needed
     */
    public static LogSink sink() {
        return ProcessSink.global().get();
    }

    public static void log(String message, LogLevel level) {
        try {
            sink().emit(message, level);
        } catch (SinkResourceException e) {
            throw new UncheckedSinkException(e);
        }
    }

    /**
     * Writes text verbatim, without timestamp, label or cutoff.
     *
     * @param text the text to write, normally ending with a line terminator
     */
    public static void writeRaw(String text) {
        try {
            sink().writeRaw(text);
        } catch (SinkResourceException e) {
            throw new UncheckedSinkException(e);
        }
    }

    public static void trace(String message) {
        log(message, LogLevel.TRACE);
    }

    public static void debug(String message) {
        log(message, LogLevel.DEBUG);
    }

    public static void info(String message) {
        log(message, LogLevel.INFO);
    }

    public static void warn(String message) {
        log(message, LogLevel.WARN);
    }

    public static void error(String message) {
        log(message, LogLevel.ERROR);
    }
}
