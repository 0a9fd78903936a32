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
 * Base of the failures a sink can report. The two kinds are kept apart so
 * callers can tell a rejected configuration ({@link SinkConfigException}) from
 * an I/O failure on the sink's resource ({@link SinkResourceException}).
 */
public abstract class SinkException extends Exception {

    protected SinkException(String message) {
        super(message);
    }

    protected SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
