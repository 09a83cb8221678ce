package com.universalanalyzer.mcp.analysis;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the language of a path and routes it to the matching {@link LanguageAnalyzer}. A path
 * whose language cannot be resolved, or has no analyzer, yields an empty result rather than an
 * error.
 */
@Component
public class AnalysisDispatcher {

  private static final Logger log = LoggerFactory.getLogger(AnalysisDispatcher.class);

  private final LanguageDetector detector;
  private final AnalyzerRegistry registry;
  private final ResultSynthesizer synthesizer;

  public AnalysisDispatcher(
      LanguageDetector detector, AnalyzerRegistry registry, ResultSynthesizer synthesizer) {
    this.detector = Objects.requireNonNull(detector, "detector");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
  }

  public AnalysisResult analyze(Path path, @Nullable String languageHint, boolean includeMetrics) {
    Objects.requireNonNull(path, "path");
    Optional<String> language =
        StringUtils.hasText(languageHint)
            ? Optional.of(languageHint.trim().toLowerCase(Locale.ROOT))
            : detector.detect(path);
    if (language.isEmpty()) {
      log.info("analyzer.dispatch unresolved language path={}", path);
      return synthesizer.empty(AnalysisResult.UNKNOWN_LANGUAGE);
    }
    Optional<LanguageAnalyzer> analyzer = registry.find(language.get());
    if (analyzer.isEmpty()) {
      log.info("analyzer.dispatch no analyzer registered language={} path={}", language.get(), path);
      return synthesizer.empty(language.get());
    }

    LanguageAnalyzer selected = analyzer.get();
    Instant startedAt = Instant.now();
    AnalysisResult result = selected.run(path, includeMetrics);
    log.info(
        "analyzer.dispatch completed language={} tools={} diagnostics={} durationMs={}",
        result.language(),
        result.toolRuns().size(),
        result.diagnostics().size(),
        Duration.between(startedAt, Instant.now()).toMillis());
    return result;
  }
}
