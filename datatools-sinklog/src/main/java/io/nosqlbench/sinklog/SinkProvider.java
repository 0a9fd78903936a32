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

/// Service interface for contributing sink types without touching the
/// factory. Implementations are listed in
/// {@code META-INF/services/io.nosqlbench.sinklog.SinkProvider} and picked up
/// by {@link SinkFactory#registerProviders(ClassLoader)}.
///
/// Implementations need a public no-argument constructor.
public interface SinkProvider extends SinkConstructor {

    /// @return the type name selecting this provider's sinks
    String typeName();
}
