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

/**
 * Implementations of {@link io.nosqlbench.sinklog.LogSink}.
 *
 * <ul>
 *   <li>{@link io.nosqlbench.sinklog.sinks.NullLogSink} - discards everything</li>
 *   <li>{@link io.nosqlbench.sinklog.sinks.ConsoleLogSink} - standard output, optionally colored</li>
 *   <li>{@link io.nosqlbench.sinklog.sinks.FileLogSink} - append-only file, reopened on an interval</li>
 *   <li>{@link io.nosqlbench.sinklog.sinks.Log4jLogSink} - forwards to Log4j 2</li>
 * </ul>
 */
package io.nosqlbench.sinklog.sinks;
