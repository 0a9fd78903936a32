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

package io.nosqlbench.sinklog.sinks;

import io.nosqlbench.sinklog.LevelCutoff;
import io.nosqlbench.sinklog.LogLevel;
import io.nosqlbench.sinklog.SinkConfig;
import io.nosqlbench.sinklog.SinkConfigException;
import io.nosqlbench.sinklog.SinkResourceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * A sink that appends records to a file and periodically reopens it, so that
 * external rotation tools can rename the file away and have the sink recreate
 * it at the expected path.
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@value SinkConfig#FILE_NAME} (required) - the file to write. The last
 *       path element is prefixed with the process id, so {@code logs/app.log}
 *       becomes {@code logs/4242-app.log} and processes sharing a configuration
 *       do not clobber each other. Missing parent directories are created.</li>
 *   <li>{@value SinkConfig#REOPEN_INTERVAL} (optional) - positive number of
 *       seconds between reopens, 300 by default.</li>
 * </ul>
 *
 * <h2>Record Format</h2>
 * <p>Records carry no process tag and always use plain labels:</p>
 * <pre>
 * 2024/05/17 14:32:15.123456 [ERROR] connection refused
 * </pre>
 *
 * <h2>Reopen Policy</h2>
 * <p>Every {@link #writeRaw(String)} appends, flushes and then checks the
 * clock. Once more than the reopen interval has passed since the last open,
 * the file is closed and opened again in append mode, all under the sink lock.
 * The interval restarts when the reopen completes. A failed reopen is thrown
 * to the writer that triggered it; the following write tries to open the file
 * again before writing. A failed write drops its file handle the same way, so
 * the next write reattaches to the path.</p>
 */
public class FileLogSink extends AbstractLogSink {

    public static final Duration DEFAULT_REOPEN_INTERVAL = Duration.ofSeconds(300);

    private static final Logger logger = LogManager.getLogger(FileLogSink.class);

    private final Path path;
    private final Duration reopenInterval;
    private final Clock clock;

    // guarded by lock
    private BufferedWriter writer;
    private Instant lastOpen;
    private boolean closed;

    /**
     * Creates a file sink with the process-wide cutoff and the system clock.
     *
     * @param config the sink configuration
     * @throws SinkConfigException if the file name is missing or the reopen interval is malformed
     * @throws SinkResourceException if the file cannot be opened
     */
    public FileLogSink(SinkConfig config) throws SinkConfigException, SinkResourceException {
        this(config, LevelCutoff.process(), Clock.systemUTC());
    }

    /**
     * @param config the sink configuration
     * @param cutoff the minimum level to emit
     * @param clock the clock that drives the reopen policy
     * @throws SinkConfigException if the file name is missing or the reopen interval is malformed
     * @throws SinkResourceException if the file cannot be opened
     */
    public FileLogSink(SinkConfig config, LevelCutoff cutoff, Clock clock)
        throws SinkConfigException, SinkResourceException {
        super(cutoff);
        this.clock = clock;
        this.path = resolvePath(config.require(SinkConfig.FILE_NAME, "No output file provided to file sink"));
        this.reopenInterval = parseReopenInterval(config.get(SinkConfig.REOPEN_INTERVAL));
        open();
    }

    /**
     * @return the file written by this sink, including the process id prefix
     */
    public Path getPath() {
        return path;
    }

    public Duration getReopenInterval() {
        return reopenInterval;
    }

    @Override
    protected String format(String message, LogLevel level) {
        return recordStart(message)
            .append(' ')
            .append(level.label(false))
            .append(' ')
            .append(message)
            .append('\n')
            .toString();
    }

    @Override
    public void writeRaw(String text) throws SinkResourceException {
        lock.lock();
        try {
            if (closed) {
                throw new SinkResourceException("Log file sink is closed", path, null);
            }
            if (writer == null) {
                open();
            }
            try {
                writer.write(text);
                writer.flush();
            } catch (IOException e) {
                discardWriter();
                throw new SinkResourceException("Unable to write log file", path, e);
            }
            reopenIfDue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the file. Writes after this fail with {@link SinkResourceException}.
     */
    @Override
    public void close() throws SinkResourceException {
        lock.lock();
        try {
            closed = true;
            if (writer != null) {
                BufferedWriter closing = writer;
                writer = null;
                closing.close();
            }
        } catch (IOException e) {
            throw new SinkResourceException("Unable to close log file", path, e);
        } finally {
            lock.unlock();
        }
    }

    private void reopenIfDue() throws SinkResourceException {
        Duration sinceOpen = Duration.between(lastOpen, clock.instant());
        if (sinceOpen.compareTo(reopenInterval) <= 0) {
            return;
        }
        closeBeforeReopen();
        open();
        logger.debug("Reopened {} after {}", path, sinceOpen);
    }

    private void closeBeforeReopen() {
        BufferedWriter closing = writer;
        writer = null;
        try {
            closing.close();
        } catch (IOException e) {
            logger.warn("Failed to close {} before reopening it", path, e);
        }
    }

    private void discardWriter() {
        BufferedWriter failed = writer;
        writer = null;
        try {
            failed.close();
        } catch (IOException e) {
            logger.debug("Discarded the failed handle of {}: {}", path, e.getMessage());
        }
    }

    private void open() throws SinkResourceException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            lastOpen = clock.instant();
        } catch (IOException e) {
            writer = null;
            throw new SinkResourceException("Unable to open log file", path, e);
        }
    }

    private static Path resolvePath(String fileName) throws SinkConfigException {
        Path configured;
        try {
            configured = Path.of(fileName);
        } catch (InvalidPathException e) {
            throw new SinkConfigException(SinkConfig.FILE_NAME, fileName + " is not a valid file name", e);
        }
        Path name = configured.getFileName();
        if (name == null || fileName.isBlank()) {
            throw new SinkConfigException(SinkConfig.FILE_NAME, "'" + fileName + "' does not name a file");
        }
        return configured.resolveSibling(PID + "-" + name);
    }

    private static Duration parseReopenInterval(Optional<String> value) throws SinkConfigException {
        if (value.isEmpty()) {
            return DEFAULT_REOPEN_INTERVAL;
        }
        String text = value.get();
        long seconds;
        try {
            seconds = Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new SinkConfigException(SinkConfig.REOPEN_INTERVAL, text + " is not a valid reopen interval", e);
        }
        if (seconds <= 0) {
            throw new SinkConfigException(SinkConfig.REOPEN_INTERVAL,
                text + " is not a valid reopen interval, it must be a positive number of seconds");
        }
        return Duration.ofSeconds(seconds);
    }
}
