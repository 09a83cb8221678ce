package com.universalanalyzer.mcp.analysis;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Reporting-side view of a result: keeps diagnostics at or above a minimum severity, orders them
 * most severe first (stable, so equal severities keep tool order) and truncates.
 */
@Component
public class DiagnosticRanking {

  public static final Severity DEFAULT_MIN_SEVERITY = Severity.WARNING;
  public static final int DEFAULT_MAX_RESULTS = 50;

  public List<Diagnostic> filterAndRank(AnalysisResult result, Severity minSeverity, int maxResults) {
    Objects.requireNonNull(result, "result");
    Severity threshold = minSeverity != null ? minSeverity : DEFAULT_MIN_SEVERITY;
    int limit = Math.max(0, maxResults);
    return result.diagnostics().stream()
        .filter(diagnostic -> diagnostic.severity().isAtLeast(threshold))
        .sorted(Comparator.comparingInt((Diagnostic d) -> d.severity().rank()).reversed())
        .limit(limit)
        .toList();
  }
}
