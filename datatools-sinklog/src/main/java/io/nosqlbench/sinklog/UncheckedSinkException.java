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
 * Carries a {@link SinkException} out of call sites that cannot declare it,
 * such as the static {@link SinkLog} functions.
 */
public class UncheckedSinkException extends RuntimeException {

    public UncheckedSinkException(SinkException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized SinkException getCause() {
        return (SinkException) super.getCause();
    }
}
