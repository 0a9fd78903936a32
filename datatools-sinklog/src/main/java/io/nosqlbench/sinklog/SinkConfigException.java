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

/// Thrown when a sink cannot be produced from a configuration: a required key
/// is missing, the requested type is not registered, or a value is malformed.
/// Only raised while producing a sink, never while writing to one.
public class SinkConfigException extends SinkException {

    /// The configuration key at fault
    private final String key;

    /// @param key the configuration key at fault
    /// @param message a description naming the offending key or value
    public SinkConfigException(String key, String message) {
        super(message);
        this.key = key;
    }

    /// @param key the configuration key at fault
    /// @param message a description naming the offending key or value
    /// @param cause the parsing failure behind this exception
    public SinkConfigException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /// @return the configuration key at fault
    public String getKey() {
        return key;
    }
}
