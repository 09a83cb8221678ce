package com.universalanalyzer.mcp.analysis;

import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.AnalyzeCodebaseRequest;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.AnalyzeCodebaseResponse;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.DetectLanguagesRequest;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.DetectLanguagesResponse;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.DiagnosticView;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.ErrorEntry;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.ErrorListResponse;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.GetErrorListRequest;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.ToolRunView;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class UniversalAnalyzerService {

  private final AnalysisDispatcher dispatcher;
  private final DiagnosticRanking ranking;
  private final LanguageDetector detector;

  public UniversalAnalyzerService(
      AnalysisDispatcher dispatcher, DiagnosticRanking ranking, LanguageDetector detector) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.ranking = Objects.requireNonNull(ranking, "ranking");
    this.detector = Objects.requireNonNull(detector, "detector");
  }

  public AnalyzeCodebaseResponse analyzeCodebase(AnalyzeCodebaseRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null");
    }
    boolean includeMetrics = request.includeMetrics() == null || request.includeMetrics();
    boolean includeToolStatus = Boolean.TRUE.equals(request.includeToolStatus());
    AnalysisResult result =
        dispatcher.analyze(requirePath(request.path(), "path"), request.language(), includeMetrics);
    if (!includeMetrics) {
      result = result.withoutMetrics();
    }
    return new AnalyzeCodebaseResponse(
        result.language(),
        result.filesAnalyzed(),
        result.summary(),
        result.diagnostics().stream().map(DiagnosticView::from).toList(),
        includeMetrics ? result.metrics() : null,
        includeToolStatus ? result.toolRuns().stream().map(ToolRunView::from).toList() : null);
  }

  public ErrorListResponse getErrorList(GetErrorListRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null");
    }
    AnalysisResult result = dispatcher.analyze(requirePath(request.path(), "path"), null, true);
    Severity minSeverity =
        Severity.fromString(request.minSeverity(), DiagnosticRanking.DEFAULT_MIN_SEVERITY);
    int maxResults =
        request.maxResults() != null && request.maxResults() > 0
            ? request.maxResults()
            : DiagnosticRanking.DEFAULT_MAX_RESULTS;
    List<Diagnostic> ranked = ranking.filterAndRank(result, minSeverity, maxResults);
    return new ErrorListResponse(
        result.diagnostics().size(),
        ranked.size(),
        ranked.stream().map(ErrorEntry::from).toList());
  }

  public DetectLanguagesResponse detectLanguages(DetectLanguagesRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null");
    }
    Map<String, Integer> counts =
        detector.detectDirectoryLanguages(requirePath(request.directory(), "directory"));
    int total = counts.values().stream().mapToInt(Integer::intValue).sum();
    return new DetectLanguagesResponse(
        counts, detector.primaryLanguage(counts).orElse(null), total);
  }

  private static Path requirePath(String value, String field) {
    if (!StringUtils.hasText(value)) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return Path.of(value.trim()).toAbsolutePath().normalize();
  }
}
