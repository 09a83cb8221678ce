package com.universalanalyzer.mcp.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.universalanalyzer.mcp.analysis.adapter.ToolRun;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of analysing one path. {@code summary} always holds a count for every severity and
 * {@code filesAnalyzed} counts the distinct files that received at least one diagnostic.
 */
public record AnalysisResult(
    String language,
    int filesAnalyzed,
    List<Diagnostic> diagnostics,
    Map<String, JsonNode> metrics,
    Map<String, Integer> summary,
    List<ToolRun> toolRuns) {

  public static final String UNKNOWN_LANGUAGE = "unknown";

  public AnalysisResult {
    Objects.requireNonNull(language, "language");
    diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    metrics =
        metrics == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    summary =
        summary == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(summary));
    toolRuns = toolRuns == null ? List.of() : List.copyOf(toolRuns);
  }

  public int count(Severity severity) {
    return summary.getOrDefault(severity.id(), 0);
  }

  public AnalysisResult withoutMetrics() {
    return new AnalysisResult(language, filesAnalyzed, diagnostics, Map.of(), summary, toolRuns);
  }
}
