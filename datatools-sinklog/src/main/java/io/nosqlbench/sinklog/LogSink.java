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
import io.nosqlbench.sinklog.sinks.Log4jLogSink;
import io.nosqlbench.sinklog.sinks.NullLogSink;

/**
 * A destination for log records. A sink decides whether a message passes its
 * level cutoff, formats it into a record and appends the record to whatever
 * resource it owns.
 *
 * <h2>Record Format</h2>
 * <p>Formatted records end with a line terminator and look like:</p>
 * <pre>
 * 2024/01/03 04:05:06.000001 [4242] [INFO] message    (console)
 * 2024/01/03 04:05:06.000001 [INFO] message           (file)
 * </pre>
 *
 * <h2>Built-in Implementations</h2>
 * <ul>
 *   <li>{@link NullLogSink} - discards everything, type {@code ""}</li>
 *   <li>{@link ConsoleLogSink} - standard output, type {@code "std_out"}</li>
 *   <li>{@link FileLogSink} - appends to a periodically reopened file, type {@code "file"}</li>
 *   <li>{@link Log4jLogSink} - forwards to a Log4j 2 logger, type {@code "log4j"}</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be safe for concurrent use. The bytes of two
 * {@link #writeRaw(String)} calls on one sink never interleave; no other
 * ordering between threads is promised, since every record carries its own
 * timestamp.</p>
 *
 * @see SinkFactory
 * @see ProcessSink
 */
public interface LogSink extends AutoCloseable {

    /**
     * Formats and writes a message, unless {@code level} is below this sink's
     * cutoff, in which case nothing is formatted or written.
     *
     * @param message the message text
     * @param level the severity of the message
     * @throws SinkResourceException if the backing resource fails
     */
    void emit(String message, LogLevel level) throws SinkResourceException;

    /**
     * Appends {@code text} verbatim, bypassing formatting and the cutoff. Use
     * this to write lines with custom tags.
     *
     * @param text the text to append, normally ending with a line terminator
     * @throws SinkResourceException if the backing resource fails
     */
    void writeRaw(String text) throws SinkResourceException;

    /**
     * Releases the backing resource. Sinks over shared resources leave them open.
     *
     * @throws SinkResourceException if releasing the resource fails
     */
    @Override
    default void close() throws SinkResourceException {
    }
}
