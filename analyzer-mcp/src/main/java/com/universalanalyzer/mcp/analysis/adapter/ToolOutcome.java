package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Everything one adapter invocation produced. Failed invocations carry no diagnostics and no
 * metrics; {@link #detail()} keeps the reason for logs and status reporting.
 */
public record ToolOutcome(
    String tool,
    ToolRole role,
    ToolStatus status,
    List<Diagnostic> diagnostics,
    @Nullable JsonNode metrics,
    Duration duration,
    @Nullable String detail) {

  public ToolOutcome {
    Objects.requireNonNull(tool, "tool");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(status, "status");
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    duration = duration == null ? Duration.ZERO : duration;
  }

  static ToolOutcome ran(
      String tool, ToolRole role, List<Diagnostic> diagnostics, JsonNode metrics, Duration duration) {
    return new ToolOutcome(tool, role, ToolStatus.RAN, diagnostics, metrics, duration, null);
  }

  static ToolOutcome failed(
      String tool, ToolRole role, ToolStatus status, Duration duration, String detail) {
    return new ToolOutcome(tool, role, status, List.of(), null, duration, detail);
  }

  public ToolRun toRun() {
    return new ToolRun(tool, status, diagnostics.size(), duration.toMillis(), detail);
  }
}
