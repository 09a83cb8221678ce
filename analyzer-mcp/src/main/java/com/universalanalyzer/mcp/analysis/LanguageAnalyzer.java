package com.universalanalyzer.mcp.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.universalanalyzer.mcp.analysis.adapter.ToolAdapter;
import com.universalanalyzer.mcp.analysis.adapter.ToolOutcome;
import com.universalanalyzer.mcp.analysis.adapter.ToolRole;
import com.universalanalyzer.mcp.analysis.adapter.ToolRun;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.lang.Nullable;

/**
 * The tools configured for one language. Adapters run concurrently when an executor is given,
 * otherwise one after another; either way their diagnostics are concatenated in configured order.
 */
public class LanguageAnalyzer {

  private final String language;
  private final List<ToolAdapter> adapters;
  private final ResultSynthesizer synthesizer;
  @Nullable private final Executor executor;

  public LanguageAnalyzer(
      String language,
      List<ToolAdapter> adapters,
      ResultSynthesizer synthesizer,
      @Nullable Executor executor) {
    this.language = Objects.requireNonNull(language, "language");
    this.adapters = List.copyOf(adapters);
    this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    this.executor = executor;
  }

  public String language() {
    return language;
  }

  public List<ToolAdapter> adapters() {
    return adapters;
  }

  public AnalysisResult run(Path path, boolean includeMetrics) {
    Objects.requireNonNull(path, "path");
    List<ToolAdapter> selected =
        adapters.stream()
            .filter(adapter -> includeMetrics || adapter.role() != ToolRole.METRICS)
            .toList();

    List<ToolOutcome> outcomes = invokeAll(selected, path);

    List<Diagnostic> diagnostics = new ArrayList<>();
    Map<String, JsonNode> metrics = new LinkedHashMap<>();
    List<ToolRun> runs = new ArrayList<>(outcomes.size());
    for (ToolOutcome outcome : outcomes) {
      diagnostics.addAll(outcome.diagnostics());
      if (outcome.role() == ToolRole.METRICS && outcome.metrics() != null) {
        metrics.put(outcome.tool(), outcome.metrics());
      }
      runs.add(outcome.toRun());
    }
    return synthesizer.synthesize(language, diagnostics, metrics, runs);
  }

  private List<ToolOutcome> invokeAll(List<ToolAdapter> selected, Path path) {
    if (executor == null || selected.size() < 2) {
      return selected.stream().map(adapter -> adapter.invoke(path)).toList();
    }
    List<CompletableFuture<ToolOutcome>> futures =
        selected.stream()
            .map(adapter -> CompletableFuture.supplyAsync(() -> adapter.invoke(path), executor))
            .toList();
    return futures.stream().map(CompletableFuture::join).toList();
  }
}
