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
import io.nosqlbench.sinklog.SinkResourceException;
import io.nosqlbench.sinklog.Timestamps;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base for sinks that format records as text. {@link #emit(String, LogLevel)}
 * checks the cutoff before any formatting, builds the record with
 * {@link #format(String, LogLevel)} and hands it to {@link #writeRaw(String)}.
 * Subclasses guard their resource with {@link #lock}.
 */
public abstract class AbstractLogSink implements LogSink {

    /** Process id, used as the process tag of records and as the file name prefix. */
    protected static final long PID = ProcessHandle.current().pid();

    protected final ReentrantLock lock = new ReentrantLock();
    private final LevelCutoff cutoff;

    protected AbstractLogSink(LevelCutoff cutoff) {
        this.cutoff = Objects.requireNonNull(cutoff, "cutoff");
    }

    public LevelCutoff getCutoff() {
        return cutoff;
    }

    @Override
    public void emit(String message, LogLevel level) throws SinkResourceException {
        if (!cutoff.admits(level)) {
            return;
        }
        writeRaw(format(message, level));
    }

    /**
     * Builds the complete record for a message, including the line terminator.
     *
     * @param message the message text
     * @param level the severity of the message
     * @return the record to write
     */
    protected abstract String format(String message, LogLevel level);

    /**
     * @return a builder holding the timestamp, sized for a record of {@code message}
     */
    protected static StringBuilder recordStart(String message) {
        StringBuilder record = new StringBuilder(message.length() + 64);
        record.append(Timestamps.now());
        return record;
    }
}
