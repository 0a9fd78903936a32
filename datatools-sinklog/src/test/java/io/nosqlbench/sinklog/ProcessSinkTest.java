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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import static org.junit.jupiter.api.Assertions.*;

class ProcessSinkTest {

    private static final SinkConfig FIRST = SinkConfig.of("type", "recording", "name", "first");
    private static final SinkConfig SECOND = SinkConfig.of("type", "recording", "name", "second");

    private final AtomicInteger constructions = new AtomicInteger();

    private SinkFactory countingFactory() {
        return new SinkFactory().register("recording", config -> {
            constructions.incrementAndGet();
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(20));
            return new RecordingSink(config);
        });
    }

    @Test
    void firstConfigurationWins() throws SinkException {
        ProcessSink processSink = new ProcessSink(countingFactory(), () -> SECOND);

        LogSink first = processSink.configure(FIRST);
        LogSink second = processSink.configure(SECOND);

        assertSame(first, second);
        assertSame(first, processSink.get());
        assertEquals(FIRST, ((RecordingSink) processSink.get()).config);
        assertEquals(FIRST, processSink.getConfig().orElseThrow());
        assertEquals(1, constructions.get());
    }

    @Test
    void getBuildsFromTheDefaultAndConfigureCannotReplaceIt() throws SinkException {
        ProcessSink processSink = new ProcessSink(countingFactory(), () -> SECOND);
        assertFalse(processSink.isConfigured());
        assertTrue(processSink.getConfig().isEmpty());

        LogSink sink = processSink.get();

        assertTrue(processSink.isConfigured());
        assertEquals(SECOND, ((RecordingSink) sink).config);
        assertSame(sink, processSink.configure(FIRST));
        assertEquals(1, constructions.get());
    }

    @Test
    void failedConstructionPublishesNothing() throws SinkException {
        ProcessSink processSink = new ProcessSink(countingFactory(), () -> FIRST);

        assertThrows(SinkConfigException.class, () -> processSink.configure(SinkConfig.of("type", "file")));
        assertFalse(processSink.isConfigured());

        assertEquals(SECOND, ((RecordingSink) processSink.configure(SECOND)).config);
    }

    @Test
    void failingDefaultSurfacesAsUnchecked() {
        ProcessSink processSink = new ProcessSink(new SinkFactory(), () -> SinkConfig.of("type", "bogus"));

        UncheckedSinkException e = assertThrows(UncheckedSinkException.class, processSink::get);
        assertInstanceOf(SinkConfigException.class, e.getCause());
        assertFalse(processSink.isConfigured());
    }

    @Test
    void concurrentFirstAccessBuildsOneSink() throws Exception {
        ProcessSink processSink = new ProcessSink(countingFactory(), () -> FIRST);
        List<LogSink> observed = race(16, processSink::get);

        assertEquals(1, constructions.get());
        assertEquals(1, identities(observed).size());
    }

    @Test
    void concurrentConfigureBuildsOneSink() throws Exception {
        ProcessSink processSink = new ProcessSink(countingFactory(), () -> FIRST);
        AtomicInteger turn = new AtomicInteger();
        List<LogSink> observed = race(16, () -> processSink.configure(
            turn.getAndIncrement() % 2 == 0 ? FIRST : SECOND));

        assertEquals(1, constructions.get());
        assertEquals(1, identities(observed).size());
        assertEquals(processSink.getConfig().orElseThrow(), ((RecordingSink) observed.get(0)).config);
    }

    private static List<LogSink> race(int threads, Callable<LogSink> access) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LogSink>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    start.await();
                    return access.call();
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            start.countDown();
            List<LogSink> results = new ArrayList<>();
            for (Future<LogSink> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Set<LogSink> identities(List<LogSink> sinks) {
        Set<LogSink> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(sinks);
        return distinct;
    }
}
