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

import com.google.auto.service.AutoService;
import io.nosqlbench.sinklog.LogSink;
import io.nosqlbench.sinklog.SinkConfig;
import io.nosqlbench.sinklog.SinkProvider;

/// Registers {@link Log4jLogSink} under the type name {@code log4j}.
@AutoService(SinkProvider.class)
public class Log4jSinkProvider implements SinkProvider {

    public static final String TYPE = "log4j";

    @Override
    public String typeName() {
        return TYPE;
    }

    @Override
    public LogSink create(SinkConfig config) {
        return new Log4jLogSink(config);
    }
}
