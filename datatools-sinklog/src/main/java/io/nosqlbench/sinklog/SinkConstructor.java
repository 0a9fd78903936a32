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
 * Builds a sink from a configuration. Stored in the {@link SinkFactory}
 * registry under a type name.
 */
@FunctionalInterface
public interface SinkConstructor {

    /**
     * @param config the configuration of the sink to build
     * @return a fully usable sink
     * @throws SinkException if the configuration is rejected or the sink's resource cannot be acquired
     */
    LogSink create(SinkConfig config) throws SinkException;
}
