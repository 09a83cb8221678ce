package com.universalanalyzer.mcp.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.universalanalyzer.mcp.analysis.adapter.ToolRun;
import java.util.List;
import java.util.Map;

public final class UniversalAnalyzerModels {

  private UniversalAnalyzerModels() {}

  public record AnalyzeCodebaseRequest(
      @JsonProperty("path") String path,
      @JsonProperty("language") String language,
      @JsonProperty("include_metrics") Boolean includeMetrics,
      @JsonProperty("include_tool_status") Boolean includeToolStatus) {}

  public record GetErrorListRequest(
      @JsonProperty("path") String path,
      @JsonProperty("min_severity") String minSeverity,
      @JsonProperty("max_results") Integer maxResults) {}

  public record DetectLanguagesRequest(@JsonProperty("directory") String directory) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record AnalyzeCodebaseResponse(
      @JsonProperty("language") String language,
      @JsonProperty("files_analyzed") int filesAnalyzed,
      @JsonProperty("summary") Map<String, Integer> summary,
      @JsonProperty("diagnostics") List<DiagnosticView> diagnostics,
      @JsonProperty("metrics") Map<String, JsonNode> metrics,
      @JsonProperty("tool_runs") List<ToolRunView> toolRuns) {}

  public record DiagnosticView(
      @JsonProperty("message") String message,
      @JsonProperty("severity") String severity,
      @JsonProperty("location") LocationView location,
      @JsonProperty("code") String code,
      @JsonProperty("source") String source,
      @JsonProperty("suggestion") String suggestion) {

    static DiagnosticView from(Diagnostic diagnostic) {
      return new DiagnosticView(
          diagnostic.message(),
          diagnostic.severity().id(),
          LocationView.from(diagnostic.location()),
          diagnostic.code(),
          diagnostic.source(),
          diagnostic.suggestion());
    }
  }

  public record LocationView(
      @JsonProperty("file") String file,
      @JsonProperty("line") int line,
      @JsonProperty("column") int column,
      @JsonProperty("end_line") Integer endLine,
      @JsonProperty("end_column") Integer endColumn) {

    static LocationView from(CodeLocation location) {
      return new LocationView(
          location.file(),
          location.line(),
          location.column(),
          location.endLine(),
          location.endColumn());
    }
  }

  public record ToolRunView(
      @JsonProperty("tool") String tool,
      @JsonProperty("status") String status,
      @JsonProperty("diagnostics") int diagnostics,
      @JsonProperty("duration_ms") long durationMs,
      @JsonProperty("detail") String detail) {

    static ToolRunView from(ToolRun run) {
      return new ToolRunView(
          run.tool(), run.status().id(), run.diagnostics(), run.durationMs(), run.detail());
    }
  }

  public record ErrorListResponse(
      @JsonProperty("total_diagnostics") int totalDiagnostics,
      @JsonProperty("filtered_count") int filteredCount,
      @JsonProperty("diagnostics") List<ErrorEntry> diagnostics) {}

  /** Flattened diagnostic with the location rendered as {@code file:line:col}. */
  public record ErrorEntry(
      @JsonProperty("message") String message,
      @JsonProperty("severity") String severity,
      @JsonProperty("location") String location,
      @JsonProperty("code") String code,
      @JsonProperty("source") String source,
      @JsonProperty("suggestion") String suggestion) {

    static ErrorEntry from(Diagnostic diagnostic) {
      return new ErrorEntry(
          diagnostic.message(),
          diagnostic.severity().id(),
          diagnostic.location().shortForm(),
          diagnostic.code(),
          diagnostic.source(),
          diagnostic.suggestion());
    }
  }

  public record DetectLanguagesResponse(
      @JsonProperty("languages") Map<String, Integer> languages,
      @JsonProperty("primary_language") String primaryLanguage,
      @JsonProperty("total_files") int totalFiles) {}
}
