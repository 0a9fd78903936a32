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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * The minimum severity a sink emits. {@link #NONE} suppresses every message.
 *
 * <p>The process-wide cutoff is resolved once, when this class is initialized,
 * from the {@code sinklog.level} system property, then the
 * {@code SINKLOG_LEVEL} environment variable, and defaults to {@link #INFO}.
 * It cannot be changed for the lifetime of the process.</p>
 *
 * <p>Supported values (case-insensitive):</p>
 * <ul>
 *   <li><strong>TRACE:</strong> "trace", "all"</li>
 *   <li><strong>DEBUG, INFO, WARN, ERROR:</strong> their names</li>
 *   <li><strong>NONE:</strong> "none", "off"</li>
 * </ul>
 */
public enum LevelCutoff {
    TRACE(LogLevel.TRACE),
    DEBUG(LogLevel.DEBUG),
    INFO(LogLevel.INFO),
    WARN(LogLevel.WARN),
    ERROR(LogLevel.ERROR),
    NONE(null);

    /** System property that selects the process-wide cutoff. */
    public static final String PROPERTY = "sinklog.level";
    /** Environment variable consulted when {@link #PROPERTY} is not set. */
    public static final String ENVIRONMENT = "SINKLOG_LEVEL";

    private static final Logger logger = LogManager.getLogger(LevelCutoff.class);
    private static final LevelCutoff PROCESS = resolve(System.getProperty(PROPERTY), System.getenv(ENVIRONMENT));

    private final LogLevel minimum;

    LevelCutoff(LogLevel minimum) {
        this.minimum = minimum;
    }

    /**
     * @return the cutoff fixed for this process
     */
    public static LevelCutoff process() {
        return PROCESS;
    }

    /**
     * @param level the level of a candidate message
     * @return true if a message at {@code level} passes this cutoff
     */
    public boolean admits(LogLevel level) {
        return minimum != null && level.isAtLeast(minimum);
    }

    /**
     * Parses a cutoff name or alias.
     *
     * @param value the value to parse
     * @return the matching cutoff
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static LevelCutoff fromString(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "all":
            case "trace":
                return TRACE;
            case "debug":
                return DEBUG;
            case "info":
                return INFO;
            case "warn":
                return WARN;
            case "error":
                return ERROR;
            case "none":
            case "off":
                return NONE;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized level cutoff '" + value + "'. Expected one of: trace, debug, info, warn, error, none.");
        }
    }

    static LevelCutoff resolve(String propertyValue, String environmentValue) {
        String value = propertyValue != null ? propertyValue : environmentValue;
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return fromString(value);
        } catch (IllegalArgumentException e) {
            logger.warn("{}, using info", e.getMessage());
            return INFO;
        }
    }
}
