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
import io.nosqlbench.sinklog.SinkConfig;
import io.nosqlbench.sinklog.SinkResourceException;

import java.io.PrintStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A sink that writes records to standard output, or to any {@link PrintStream}.
 *
 * <p>Records include the process id so that output of several processes
 * sharing a terminal can be told apart:</p>
 * <pre>
 * 2024/05/17 14:32:15.123456 [4242] [WARN] disk almost full
 * </pre>
 *
 * <p>If the configuration contains the {@value SinkConfig#COLOR} key, with any
 * value, labels are wrapped in ANSI color escapes.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Each {@link #writeRaw(String)} performs exactly one print call on the
 * stream followed by a flush, under this sink's lock, so records from
 * concurrent callers never split mid-line.</p>
 *
 * <h2>Stream Errors</h2>
 * <p>Failures are detected through {@link PrintStream#checkError()}, whose
 * error state is sticky: once the stream has reported an error, every later
 * {@link #writeRaw(String)} on this sink throws {@link SinkResourceException},
 * even if the stream recovers. Build a new sink over a new stream to resume.</p>
 */
public class ConsoleLogSink extends AbstractLogSink {

    private final PrintStream output;
    private final Map<LogLevel, String> labels;

    /**
     * Creates a sink over {@link System#out} with the process-wide cutoff.
     *
     * @param config the sink configuration
     */
    public ConsoleLogSink(SinkConfig config) {
        this(config, System.out, LevelCutoff.process());
    }

    /**
     * @param config the sink configuration
     * @param output the stream to write to
     * @param cutoff the minimum level to emit
     */
    public ConsoleLogSink(SinkConfig config, PrintStream output, LevelCutoff cutoff) {
        super(cutoff);
        this.output = Objects.requireNonNull(output, "output");
        this.labels = labelTable(config.contains(SinkConfig.COLOR));
    }

    public boolean isColorized() {
        return !labels.get(LogLevel.ERROR).startsWith("[");
    }

    @Override
    protected String format(String message, LogLevel level) {
        return recordStart(message)
            .append(" [").append(PID).append("] ")
            .append(labels.get(level))
            .append(' ')
            .append(message)
            .append('\n')
            .toString();
    }

    @Override
    public void writeRaw(String text) throws SinkResourceException {
        lock.lock();
        try {
            output.print(text);
            output.flush();
            if (output.checkError()) {
                throw new SinkResourceException("Console output stream reported an error", null, null);
            }
        } finally {
            lock.unlock();
        }
    }

    private static Map<LogLevel, String> labelTable(boolean colorized) {
        Map<LogLevel, String> table = new EnumMap<>(LogLevel.class);
        for (LogLevel level : LogLevel.values()) {
            table.put(level, level.label(colorized));
        }
        return table;
    }
}
