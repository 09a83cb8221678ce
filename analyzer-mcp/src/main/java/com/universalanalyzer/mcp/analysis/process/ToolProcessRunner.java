package com.universalanalyzer.mcp.analysis.process;

import com.universalanalyzer.mcp.config.AnalyzerProperties;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Runs one external tool as a child process, capturing both streams. Output is kept byte for
 * byte (carriage returns included) up to {@code maxOutputBytes} per stream and decoded as UTF-8.
 * The process is always reaped (or forcibly destroyed) before this returns or throws.
 */
@Component
public class ToolProcessRunner {

  private static final Logger log = LoggerFactory.getLogger(ToolProcessRunner.class);
  private static final long READER_JOIN_MILLIS = TimeUnit.SECONDS.toMillis(2);
  private static final int CHUNK_SIZE = 8192;

  private final long maxOutputBytes;

  @Autowired
  public ToolProcessRunner(AnalyzerProperties properties) {
    this(Objects.requireNonNull(properties, "properties").getMaxOutputBytes());
  }

  public ToolProcessRunner(long maxOutputBytes) {
    this.maxOutputBytes = maxOutputBytes > 0 ? maxOutputBytes : Long.MAX_VALUE;
  }

  public ProcessResult run(List<String> command, @Nullable Path workingDirectory, Duration timeout) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(timeout, "timeout");
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDirectory != null) {
      builder.directory(workingDirectory.toFile());
    }
    builder.redirectErrorStream(false);

    Instant startedAt = Instant.now();
    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new ToolNotFoundException("Failed to start " + command.get(0), ex);
    }

    OutputCollector stdout = new OutputCollector(maxOutputBytes);
    OutputCollector stderr = new OutputCollector(maxOutputBytes);
    Thread stdoutReader = reader(process.getInputStream(), stdout, "tool-runner-stdout");
    Thread stderrReader = reader(process.getErrorStream(), stderr, "tool-runner-stderr");

    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        process.waitFor(READER_JOIN_MILLIS, TimeUnit.MILLISECONDS);
        stdoutReader.join(READER_JOIN_MILLIS);
        stderrReader.join(READER_JOIN_MILLIS);
        throw new ToolTimeoutException(
            command.get(0) + " timed out after " + timeout.toSeconds() + " seconds", timeout);
      }
      stdoutReader.join(READER_JOIN_MILLIS);
      stderrReader.join(READER_JOIN_MILLIS);
    } catch (InterruptedException ex) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ToolExecutionException(command.get(0) + " interrupted", ex);
    }
    return new ProcessResult(
        process.exitValue(),
        stdout.content(),
        stderr.content(),
        Duration.between(startedAt, Instant.now()));
  }

  private Thread reader(InputStream stream, OutputCollector collector, String name) {
    Thread thread = new Thread(() -> consumeStream(stream, collector), name);
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  private void consumeStream(InputStream stream, OutputCollector collector) {
    byte[] chunk = new byte[CHUNK_SIZE];
    try (stream) {
      int read;
      while ((read = stream.read(chunk)) != -1) {
        collector.append(chunk, read);
      }
    } catch (IOException ex) {
      log.debug("Failed to read process stream: {}", ex.getMessage());
    }
  }

  /** Keeps the first {@code maxBytes} bytes of a stream and drains the rest. */
  private static class OutputCollector {
    private final long maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    OutputCollector(long maxBytes) {
      this.maxBytes = maxBytes;
    }

    synchronized void append(byte[] data, int length) {
      long allowed = Math.max(0, maxBytes - buffer.size());
      buffer.write(data, 0, (int) Math.min(length, allowed));
    }

    synchronized String content() {
      return buffer.toString(StandardCharsets.UTF_8);
    }
  }
}
