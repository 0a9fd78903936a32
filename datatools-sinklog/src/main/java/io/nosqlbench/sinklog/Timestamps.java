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

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/// Formats record timestamps as {@code uuuu/MM/dd HH:mm:ss.SSSSSS} in UTC.
///
/// Every field is zero padded, so the width is constant for four-digit years.
/// Fractional seconds are truncated to microseconds, never rounded.
public final class Timestamps {

    private static final DateTimeFormatter FORMATTER =
        DateTimeFormatter.ofPattern("uuuu/MM/dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private static final Clock UTC = Clock.systemUTC();

    private Timestamps() {
    }

    /// @param instant the instant to format
    /// @return the formatted timestamp
    public static String format(Instant instant) {
        return FORMATTER.format(instant);
    }

    /// @return the current time, formatted
    public static String now() {
        return format(UTC.instant());
    }
}
