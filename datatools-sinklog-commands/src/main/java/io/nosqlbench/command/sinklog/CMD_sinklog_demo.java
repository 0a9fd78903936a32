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

package io.nosqlbench.command.sinklog;

import io.nosqlbench.sinklog.LogLevel;
import io.nosqlbench.sinklog.LogSink;
import io.nosqlbench.sinklog.ProcessSink;
import io.nosqlbench.sinklog.SinkConfig;
import io.nosqlbench.sinklog.SinkException;
import io.nosqlbench.sinklog.SinkFactory;
import io.nosqlbench.sinklog.SinkResourceException;
import io.nosqlbench.sinklog.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

/// Drive a sink from several threads at once, writing one message per level and a
/// hand-formatted raw line per iteration. The exit code is the number of workers that failed,
/// or {@value #CONFIG_ERROR} when the sink could not be configured.
@Command(name = "sinklog-demo",
    description = "write leveled messages from concurrent workers to a configured sink",
    subcommands = {CommandLine.HelpCommand.class})
public class CMD_sinklog_demo implements Callable<Integer> {

  static final int CONFIG_ERROR = 2;

  private static final Logger logger = LogManager.getLogger(CMD_sinklog_demo.class);

  private static final LogLevel[] DEMO_LEVELS =
      {LogLevel.ERROR, LogLevel.WARN, LogLevel.INFO, LogLevel.DEBUG, LogLevel.TRACE};

  private static final String CUSTOM_LABEL = "[CUSTOM]";
  private static final String CUSTOM_COLOR = "\u001b[35;1m";
  private static final String RESET = "\u001b[0m";

  @Option(names = {"-t", "--type"},
      defaultValue = SinkFactory.STD_OUT_TYPE,
      description = "The sink type to produce, e.g. std_out, file, log4j, or an empty string for no output")
  private String type;

  @Option(names = {"-f", "--file-name"}, description = "Output file for the file sink")
  private String fileName;

  @Option(names = {"-r", "--reopen-interval"}, description = "Seconds between reopens of the output file")
  private String reopenInterval;

  @Option(names = {"-c", "--color"},
      arity = "0..1",
      fallbackValue = "",
      description = "Use colored labels on the console sink")
  private String color;

  @Option(names = {"--threads"}, defaultValue = "4")
  private int threads;

  @Option(names = {"--iterations"}, defaultValue = "2")
  private int iterations;

  @Option(names = {"--pause-ms"}, defaultValue = "10", description = "Pause after each message in milliseconds")
  private long pauseMillis;

  private final SinkFactory factory;

  /// Create the command against the global sink factory
  public CMD_sinklog_demo() {
    this(SinkFactory.global());
  }

  CMD_sinklog_demo(SinkFactory factory) {
    this.factory = factory;
  }

  /// run the sinklog demo
  /// @param args command line args
  public static void main(String[] args) {
    CMD_sinklog_demo command = new CMD_sinklog_demo();
    CommandLine commandLine = new CommandLine(command).setOptionsCaseInsensitive(true);
    int exitCode = commandLine.execute(args);
    System.exit(exitCode);
  }

  SinkConfig sinkConfig() {
    SinkConfig.Builder builder = SinkConfig.builder().with(SinkConfig.TYPE, type);
    if (fileName != null) {
      builder.with(SinkConfig.FILE_NAME, fileName);
    }
    if (reopenInterval != null) {
      builder.with(SinkConfig.REOPEN_INTERVAL, reopenInterval);
    }
    if (color != null) {
      builder.with(SinkConfig.COLOR, color);
    }
    return builder.build();
  }

  @Override
  public Integer call() throws Exception {
    SinkConfig config = sinkConfig();
    ProcessSink processSink = new ProcessSink(factory, () -> config);
    LogSink sink;
    try {
      sink = processSink.configure(config);
    } catch (SinkException e) {
      logger.error("Unable to configure sink from {}: {}", config, e.getMessage());
      return CONFIG_ERROR;
    }
    logger.debug("Running {} workers for {} iterations on {}", threads, iterations, config);

    int failures = 0;
    ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
    try {
      List<Future<Boolean>> workers = new ArrayList<>();
      for (int worker = 0; worker < threads; worker++) {
        int id = worker;
        workers.add(executor.submit(() -> runWorker(sink, id)));
      }
      for (Future<Boolean> worker : workers) {
        try {
          if (!worker.get()) {
            failures++;
          }
        } catch (ExecutionException e) {
          logger.error("Worker failed", e.getCause());
          failures++;
        }
      }
    } finally {
      executor.shutdown();
    }

    try {
      sink.close();
    } catch (SinkResourceException e) {
      logger.error("Unable to close sink: {}", e.getMessage());
      failures++;
    }
    return failures;
  }

  private boolean runWorker(LogSink sink, int id) throws InterruptedException {
    try {
      for (int iteration = 0; iteration < iterations; iteration++) {
        for (LogLevel level : DEMO_LEVELS) {
          sink.emit("worker " + id + " iteration " + iteration + ": "
              + level.name().toLowerCase(Locale.ROOT) + " message", level);
          pause();
        }
        sink.writeRaw(customLine(id, iteration));
        pause();
      }
      return true;
    } catch (SinkResourceException e) {
      logger.error("Worker {} could not write: {}", id, e.getMessage());
      return false;
    }
  }

  private String customLine(int id, int iteration) {
    String label = color != null ? CUSTOM_COLOR + CUSTOM_LABEL + RESET : CUSTOM_LABEL;
    return Timestamps.now() + " " + label + " worker " + id + " iteration " + iteration
        + ": hand formatted line\n";
  }

  private void pause() throws InterruptedException {
    if (pauseMillis > 0) {
      Thread.sleep(pauseMillis);
    }
  }
}
