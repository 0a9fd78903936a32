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

import java.io.IOException;
import java.nio.file.Path;

/// Thrown when a sink's backing resource cannot be opened, reopened or written.
public class SinkResourceException extends SinkException {

    /// The file involved, or null for stream-backed sinks
    private final Path path;

    /// @param message the failure description
    /// @param path the file involved, may be null
    /// @param cause the underlying I/O failure, may be null
    public SinkResourceException(String message, Path path, IOException cause) {
        super(path == null ? message : message + ": " + path, cause);
        this.path = path;
    }

    /// @return the file involved, or null for stream-backed sinks
    public Path getPath() {
        return path;
    }
}
