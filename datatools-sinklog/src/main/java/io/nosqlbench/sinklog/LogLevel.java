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
 * Severity of a log message. The declaration order is the severity order, so
 * {@link #compareTo(Enum)} gives TRACE &lt; DEBUG &lt; INFO &lt; WARN &lt; ERROR.
 *
 * <p>Each level renders a bracketed label for output records, either plain
 * ({@code [WARN]}) or wrapped in the ANSI escape sequence of the level for
 * terminals that render color.</p>
 *
 * @see LevelCutoff
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    private static final String ANSI_RESET = "\u001b[0m";

    /**
     * @param other the level to compare against
     * @return true if this level is as severe as {@code other} or more
     */
    public boolean isAtLeast(LogLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Returns the bracketed label of this level.
     *
     * @param colorized whether to wrap the label in ANSI color escapes
     * @return e.g. {@code [ERROR]} or {@code ESC[31;1m[ERROR]ESC[0m}
     */
    public String label(boolean colorized) {
        String tag = "[" + name() + "]";
        return colorized ? ansiColor() + tag + ANSI_RESET : tag;
    }

    private String ansiColor() {
        return switch (this) {
            case ERROR -> "\u001b[31;1m";
            case WARN -> "\u001b[33;1m";
            case INFO -> "\u001b[32;1m";
            case DEBUG -> "\u001b[34;1m";
            case TRACE -> "\u001b[37;1m";
        };
    }
}
