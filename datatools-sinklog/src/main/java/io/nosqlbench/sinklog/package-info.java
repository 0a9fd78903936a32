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
 * Leveled logging through pluggable sinks.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.sinklog.LogSink} - the sink contract: emit a leveled message, or write raw text</li>
 *   <li>{@link io.nosqlbench.sinklog.SinkFactory} - registry of sink types and factory producing sinks from a
 *       {@link io.nosqlbench.sinklog.SinkConfig}</li>
 *   <li>{@link io.nosqlbench.sinklog.ProcessSink} - the lazily built, first-call-wins process-wide sink</li>
 *   <li>{@link io.nosqlbench.sinklog.SinkLog} - static per-level functions over the process-wide sink</li>
 *   <li>{@link io.nosqlbench.sinklog.LevelCutoff} - the minimum level emitted, fixed per process by
 *       {@code -Dsinklog.level}</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <p>Producing a sink fails with {@link io.nosqlbench.sinklog.SinkConfigException} for bad
 * configuration and {@link io.nosqlbench.sinklog.SinkResourceException} when the sink's resource
 * cannot be acquired; no sink is returned in either case. Writing fails only with
 * {@link io.nosqlbench.sinklog.SinkResourceException}, which is never retried or redirected.</p>
 *
 * @see io.nosqlbench.sinklog.sinks
 */
package io.nosqlbench.sinklog;
