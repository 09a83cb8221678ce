package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import com.universalanalyzer.mcp.analysis.process.ProcessResult;
import com.universalanalyzer.mcp.analysis.process.ToolExecutionException;
import com.universalanalyzer.mcp.analysis.process.ToolNotFoundException;
import com.universalanalyzer.mcp.analysis.process.ToolProcessRunner;
import com.universalanalyzer.mcp.analysis.process.ToolTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/** Runs the command of a {@link ToolDefinition} and parses the declared output channel. */
public class CommandLineToolAdapter implements ToolAdapter {

  private static final Logger log = LoggerFactory.getLogger(CommandLineToolAdapter.class);

  private final ToolDefinition definition;
  private final ToolProcessRunner runner;
  private final ObjectMapper objectMapper;
  private final OutputParser parser;
  private final MeterRegistry meterRegistry;

  public CommandLineToolAdapter(
      ToolDefinition definition,
      ToolProcessRunner runner,
      ObjectMapper objectMapper,
      @Nullable MeterRegistry meterRegistry) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.parser =
        definition.role() == ToolRole.DIAGNOSTICS
            ? OutputParser.forDefinition(definition, objectMapper)
            : null;
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  @Override
  public String name() {
    return definition.name();
  }

  @Override
  public ToolRole role() {
    return definition.role();
  }

  @Override
  public ToolOutcome invoke(Path target) {
    Objects.requireNonNull(target, "target");
    List<String> command = definition.commandFor(target);
    Path workingDirectory = definition.workingDirectory().resolve(target);
    if (log.isDebugEnabled()) {
      log.debug(
          "analyzer.tool invoking tool={} cwd={} command={}",
          definition.name(),
          workingDirectory,
          String.join(" ", command));
    }
    Instant startedAt = Instant.now();
    ToolOutcome outcome;
    try {
      ProcessResult result = runner.run(command, workingDirectory, definition.timeout());
      outcome = interpret(result);
    } catch (ToolNotFoundException ex) {
      log.debug("analyzer.tool not available tool={} reason={}", definition.name(), ex.getMessage());
      outcome = failure(ToolStatus.NOT_FOUND, startedAt, ex.getMessage());
    } catch (ToolTimeoutException ex) {
      log.warn(
          "analyzer.tool timed out tool={} timeoutSeconds={} target={}",
          definition.name(),
          ex.getTimeout().toSeconds(),
          target);
      outcome = failure(ToolStatus.TIMED_OUT, startedAt, ex.getMessage());
    } catch (ToolExecutionException ex) {
      log.warn("analyzer.tool aborted tool={} reason={}", definition.name(), ex.getMessage());
      outcome = failure(ToolStatus.ABORTED, startedAt, ex.getMessage());
    } catch (MalformedToolOutputException ex) {
      log.warn("analyzer.tool unreadable output tool={} reason={}", definition.name(), ex.getMessage());
      outcome = failure(ToolStatus.PARSE_FAILED, startedAt, ex.getMessage());
    }
    record(outcome);
    return outcome;
  }

  private ToolOutcome interpret(ProcessResult result) {
    String output = definition.channel().select(result);
    if (definition.role() == ToolRole.METRICS) {
      return ToolOutcome.ran(
          definition.name(), definition.role(), List.of(), readMetrics(output), result.duration());
    }
    List<Diagnostic> diagnostics = parser.parse(output);
    log.debug(
        "analyzer.tool completed tool={} exitCode={} diagnostics={}",
        definition.name(),
        result.exitCode(),
        diagnostics.size());
    return ToolOutcome.ran(
        definition.name(), definition.role(), diagnostics, null, result.duration());
  }

  @Nullable
  private JsonNode readMetrics(String output) {
    if (output == null || output.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(TerminalOutput.clean(output));
    } catch (JsonProcessingException ex) {
      throw new MalformedToolOutputException(
          definition.name() + " produced invalid JSON metrics: " + ex.getOriginalMessage(), ex);
    }
  }

  private ToolOutcome failure(ToolStatus status, Instant startedAt, String detail) {
    return ToolOutcome.failed(
        definition.name(),
        definition.role(),
        status,
        Duration.between(startedAt, Instant.now()),
        detail);
  }

  private void record(ToolOutcome outcome) {
    meterRegistry
        .counter("analyzer_tool_runs_total", "tool", outcome.tool(), "status", outcome.status().id())
        .increment();
    meterRegistry
        .timer("analyzer_tool_duration", "tool", outcome.tool())
        .record(outcome.duration().toMillis(), TimeUnit.MILLISECONDS);
  }
}
