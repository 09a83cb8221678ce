package com.universalanalyzer.mcp.analysis;

import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.AnalyzeCodebaseRequest;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.AnalyzeCodebaseResponse;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.DetectLanguagesRequest;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.DetectLanguagesResponse;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.ErrorListResponse;
import com.universalanalyzer.mcp.analysis.UniversalAnalyzerModels.GetErrorListRequest;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

@Component
public class UniversalAnalyzerTools {

  private final UniversalAnalyzerService service;

  UniversalAnalyzerTools(UniversalAnalyzerService service) {
    this.service = service;
  }

  @Tool(
      name = "analyze_codebase",
      description =
          "Runs the static-analysis tools registered for the language of a file or directory and "
              + "returns their findings in one schema: language, files_analyzed, summary counts per "
              + "severity, diagnostics and optional per-tool metrics. language overrides detection; "
              + "include_metrics=false skips metrics; include_tool_status=true adds tool_runs.")
  AnalyzeCodebaseResponse analyzeCodebase(AnalyzeCodebaseRequest request) {
    return service.analyzeCodebase(request);
  }

  @Tool(
      name = "get_error_list",
      description =
          "Analyzes a path and returns diagnostics at or above min_severity "
              + "(error|warning|info|hint, default warning), most severe first, at most "
              + "max_results (default 50). Locations are rendered as file:line:col.")
  ErrorListResponse getErrorList(GetErrorListRequest request) {
    return service.getErrorList(request);
  }

  @Tool(
      name = "detect_languages",
      description =
          "Counts source files per language below a directory by file extension and reports the "
              + "primary language (most files, ties broken alphabetically).")
  DetectLanguagesResponse detectLanguages(DetectLanguagesRequest request) {
    return service.detectLanguages(request);
  }
}
