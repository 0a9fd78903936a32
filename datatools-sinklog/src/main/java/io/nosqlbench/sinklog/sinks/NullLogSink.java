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

import io.nosqlbench.sinklog.LogLevel;
import io.nosqlbench.sinklog.LogSink;
import io.nosqlbench.sinklog.SinkConfig;

/**
 * A sink that discards every message and raw write. Registered as the empty
 * type name, so {@code type=""} turns logging off without changing call sites.
 *
 * <p>This class implements the Null Object pattern. All instances behave
 * identically; use {@link #getInstance()} rather than creating new ones.</p>
 */
public final class NullLogSink implements LogSink {

    private static final NullLogSink INSTANCE = new NullLogSink();

    private NullLogSink() {
    }

    public static NullLogSink getInstance() {
        return INSTANCE;
    }

    /**
     * Constructor for the sink registry; the configuration is ignored.
     *
     * @param config ignored
     * @return the shared instance
     */
    public static NullLogSink create(SinkConfig config) {
        return INSTANCE;
    }

    @Override
    public void emit(String message, LogLevel level) {
    }

    @Override
    public void writeRaw(String text) {
    }
}
