package com.universalanalyzer.mcp.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.universalanalyzer.mcp.analysis.adapter.ToolRun;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Derives the summary counts and distinct-file count from a flat diagnostic list. */
@Component
public class ResultSynthesizer {

  public AnalysisResult synthesize(
      String language,
      List<Diagnostic> diagnostics,
      Map<String, JsonNode> metrics,
      List<ToolRun> toolRuns) {
    List<Diagnostic> safe = diagnostics == null ? List.of() : diagnostics;
    Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
    Set<String> files = new HashSet<>();
    for (Diagnostic diagnostic : safe) {
      counts.merge(diagnostic.severity(), 1, Integer::sum);
      files.add(diagnostic.location().file());
    }
    return new AnalysisResult(language, files.size(), safe, metrics, summary(counts), toolRuns);
  }

  public AnalysisResult empty(String language) {
    return synthesize(language, List.of(), Map.of(), List.of());
  }

  /** Highest severity first, every severity present. */
  private static Map<String, Integer> summary(Map<Severity, Integer> counts) {
    Map<String, Integer> summary = new LinkedHashMap<>();
    for (Severity severity : List.of(Severity.ERROR, Severity.WARNING, Severity.INFO, Severity.HINT)) {
      summary.put(severity.id(), counts.getOrDefault(severity, 0));
    }
    return summary;
  }
}
