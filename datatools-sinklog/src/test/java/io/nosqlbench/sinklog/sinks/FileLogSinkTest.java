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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileLogSinkTest {

    private static final long PID = ProcessHandle.current().pid();
    private static final Pattern RECORD = Pattern.compile(
        "\\d{4}/\\d{2}/\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{6} \\[(TRACE|DEBUG|INFO|WARN|ERROR)] .*");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-03T04:05:06Z"));

    private SinkConfig config(String fileName, String... extra) {
        SinkConfig.Builder builder = SinkConfig.builder()
            .with("type", "file")
            .with("file_name", tempDir.resolve(fileName).toString());
        for (int i = 0; i < extra.length; i += 2) {
            builder.with(extra[i], extra[i + 1]);
        }
        return builder.build();
    }

    private static List<String> lines(Path path) throws Exception {
        return Files.readAllLines(path, StandardCharsets.UTF_8);
    }

    @Test
    void fileNameIsRequired() {
        SinkConfigException e = assertThrows(SinkConfigException.class,
            () -> new FileLogSink(SinkConfig.of("type", "file")));
        assertEquals("file_name", e.getKey());
    }

    @Test
    void reopenIntervalMustBeAPositiveNumber() {
        for (String bad : new String[]{"notanumber", "0", "-5", "1.5", ""}) {
            SinkConfigException e = assertThrows(SinkConfigException.class,
                () -> new FileLogSink(config("x.log", "reopen_interval", bad)), bad);
            assertEquals("reopen_interval", e.getKey());
        }
        assertFalse(Files.exists(tempDir.resolve(PID + "-x.log")));
    }

    @Test
    void pathIsPrefixedWithTheProcessId() throws Exception {
        try (FileLogSink sink = new FileLogSink(config("logs/app.log"), LevelCutoff.TRACE, clock)) {
            assertEquals(tempDir.resolve("logs").resolve(PID + "-app.log"), sink.getPath());
            assertTrue(Files.exists(sink.getPath()));
            assertEquals(FileLogSink.DEFAULT_REOPEN_INTERVAL, sink.getReopenInterval());
        }
    }

    @Test
    void recordsOmitPidAndColor() throws Exception {
        try (FileLogSink sink = new FileLogSink(config("plain.log", "color", ""), LevelCutoff.TRACE, clock)) {
            sink.emit("connection refused", LogLevel.ERROR);
            sink.emit("retrying", LogLevel.INFO);

            List<String> lines = lines(sink.getPath());
            assertEquals(2, lines.size());
            assertThat(lines.get(0)).matches(RECORD).endsWith(" [ERROR] connection refused")
                .doesNotContain("\u001b").doesNotContain("[" + PID + "]");
            assertThat(lines.get(1)).endsWith(" [INFO] retrying");
        }
    }

    @Test
    void appendsToExistingContent() throws Exception {
        Path expected = tempDir.resolve(PID + "-append.log");
        Files.writeString(expected, "earlier\n");
        try (FileLogSink sink = new FileLogSink(config("append.log"), LevelCutoff.TRACE, clock)) {
            sink.writeRaw("later\n");
        }
        assertEquals(List.of("earlier", "later"), lines(expected));
    }

    @Test
    void suppressedMessagesTouchNothing() throws Exception {
        try (FileLogSink sink = new FileLogSink(config("quiet.log"), LevelCutoff.WARN, clock)) {
            sink.emit("chatter", LogLevel.INFO);
            assertEquals(0, Files.size(sink.getPath()));
        }
    }

    @Test
    void reopensAfterTheIntervalSoRotatedFilesAreRecreated() throws Exception {
        try (FileLogSink sink = new FileLogSink(config("rotating.log", "reopen_interval", "1"), LevelCutoff.TRACE, clock)) {
            Path path = sink.getPath();
            Path rotated = tempDir.resolve("rotated.log");

            sink.emit("first", LogLevel.INFO);
            Files.move(path, rotated);

            clock.advance(Duration.ofMillis(1500));
            sink.emit("second", LogLevel.INFO);
            assertTrue(Files.exists(path), "file was not recreated after the reopen interval");

            sink.emit("third", LogLevel.INFO);

            List<String> old = lines(rotated);
            assertEquals(2, old.size());
            assertThat(old.get(0)).endsWith("[INFO] first");
            assertThat(old.get(1)).endsWith("[INFO] second");
            List<String> current = lines(path);
            assertEquals(1, current.size());
            assertThat(current.get(0)).endsWith("[INFO] third");
        }
    }

    @Test
    void doesNotReopenUntilTheIntervalIsExceeded() throws Exception {
        try (FileLogSink sink = new FileLogSink(config("steady.log", "reopen_interval", "1"), LevelCutoff.TRACE, clock)) {
            Path path = sink.getPath();
            Files.move(path, tempDir.resolve("moved.log"));

            clock.advance(Duration.ofSeconds(1));
            sink.writeRaw("at the boundary\n");

            assertFalse(Files.exists(path));
            assertEquals(List.of("at the boundary"), lines(tempDir.resolve("moved.log")));
        }
    }

    @Test
    void reopensOnTheSystemClock() throws Exception {
        try (FileLogSink sink = new FileLogSink(config("realtime.log", "reopen_interval", "1"),
            LevelCutoff.TRACE, Clock.systemUTC())) {
            Path path = sink.getPath();
            Path rotated = tempDir.resolve("realtime.rotated");

            sink.writeRaw("before\n");
            Files.move(path, rotated);
            Thread.sleep(1200);
            sink.writeRaw("after\n");
            sink.writeRaw("recreated\n");

            assertEquals(List.of("before", "after"), lines(rotated));
            assertEquals(List.of("recreated"), lines(path));
        }
    }

    @Test
    void unopenableFileFailsConstruction() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        SinkResourceException e = assertThrows(SinkResourceException.class,
            () -> new FileLogSink(config("blocker/x.log"), LevelCutoff.TRACE, clock));
        assertEquals(blocker.resolve(PID + "-x.log"), e.getPath());
        assertNotNull(e.getCause());
    }

    @Test
    void failedReopenPropagatesAndRecovers() throws Exception {
        try (FileLogSink sink = new FileLogSink(config("sub/x.log", "reopen_interval", "1"), LevelCutoff.TRACE, clock)) {
            Path path = sink.getPath();
            Path directory = path.getParent();
            sink.writeRaw("kept\n");

            Files.delete(path);
            Files.delete(directory);
            Files.writeString(directory, "blocks the log directory");
            clock.advance(Duration.ofSeconds(2));

            SinkResourceException reopen = assertThrows(SinkResourceException.class,
                () -> sink.writeRaw("triggers reopen\n"));
            assertEquals(path, reopen.getPath());
            assertThrows(SinkResourceException.class, () -> sink.writeRaw("still blocked\n"));

            Files.delete(directory);
            sink.writeRaw("recovered\n");
            assertEquals(List.of("recovered"), lines(path));
        }
    }

    @Test
    void failedWriteReattachesToThePath() throws Exception {
        Path full = Path.of("/dev/full");
        assumeTrue(Files.isWritable(full), "needs a device that fails every write");
        Path path = tempDir.resolve(PID + "-full.log");
        Files.createSymbolicLink(path, full);

        try (FileLogSink sink = new FileLogSink(config("full.log", "reopen_interval", "1"), LevelCutoff.TRACE, clock)) {
            SinkResourceException e = assertThrows(SinkResourceException.class, () -> sink.writeRaw("lost\n"));
            assertEquals(path, e.getPath());

            Files.delete(path);
            clock.advance(Duration.ofSeconds(5));
            sink.writeRaw("kept\n");

            assertFalse(Files.isSymbolicLink(path));
            assertEquals(List.of("kept"), lines(path));
        }
    }

    @Test
    void writesAfterCloseFail() throws Exception {
        FileLogSink sink = new FileLogSink(config("closed.log"), LevelCutoff.TRACE, clock);
        sink.writeRaw("before\n");
        sink.close();
        Files.delete(sink.getPath());

        SinkResourceException e = assertThrows(SinkResourceException.class, () -> sink.writeRaw("after\n"));
        assertEquals(sink.getPath(), e.getPath());
        assertFalse(Files.exists(sink.getPath()));
        sink.close();
    }

    @Test
    void concurrentWritesStayWhole() throws Exception {
        int threads = 4;
        int perThread = 500;
        try (FileLogSink sink = new FileLogSink(config("busy.log", "reopen_interval", "1"), LevelCutoff.TRACE, clock)) {
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            for (int t = 0; t < threads; t++) {
                int worker = t;
                executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        sink.emit("worker " + worker + " line " + i, LogLevel.WARN);
                        if (i % 100 == 0) {
                            clock.advance(Duration.ofSeconds(2));
                        }
                    }
                    return null;
                });
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

            List<String> lines = lines(sink.getPath());
            assertEquals(threads * perThread, lines.size());
            assertThat(lines).allMatch(line -> RECORD.matcher(line).matches());
            assertThat(lines).doesNotHaveDuplicates();
        }
    }
}
