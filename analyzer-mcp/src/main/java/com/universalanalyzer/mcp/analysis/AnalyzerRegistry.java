package com.universalanalyzer.mcp.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalanalyzer.mcp.analysis.adapter.CommandLineToolAdapter;
import com.universalanalyzer.mcp.analysis.adapter.ToolAdapter;
import com.universalanalyzer.mcp.analysis.adapter.ToolDefinition;
import com.universalanalyzer.mcp.analysis.process.ToolProcessRunner;
import com.universalanalyzer.mcp.config.AnalyzerProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.LanguageProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.ToolProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/** Builds one {@link LanguageAnalyzer} per configured language and resolves ids and aliases. */
@Component
public class AnalyzerRegistry implements DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

  private final Map<String, LanguageAnalyzer> analyzers;
  private final Map<String, LanguageAnalyzer> byId;
  @Nullable private final ExecutorService executor;

  public AnalyzerRegistry(
      AnalyzerProperties properties,
      ToolProcessRunner runner,
      ResultSynthesizer synthesizer,
      ObjectMapper objectMapper,
      @Nullable MeterRegistry meterRegistry) {
    Objects.requireNonNull(properties, "properties");
    this.executor = properties.isParallelTools() ? newToolExecutor() : null;

    Map<String, LanguageAnalyzer> built = new LinkedHashMap<>();
    Map<String, LanguageAnalyzer> index = new LinkedHashMap<>();
    for (Map.Entry<String, LanguageProperties> entry : properties.getLanguages().entrySet()) {
      String language = normalize(entry.getKey());
      LanguageProperties languageProps =
          entry.getValue() != null ? entry.getValue() : new LanguageProperties();
      List<ToolAdapter> adapters = new ArrayList<>();
      for (ToolProperties toolProps : languageProps.getTools()) {
        ToolDefinition definition = ToolDefinition.from(toolProps, properties.getDefaultTimeout());
        adapters.add(new CommandLineToolAdapter(definition, runner, objectMapper, meterRegistry));
      }
      LanguageAnalyzer analyzer = new LanguageAnalyzer(language, adapters, synthesizer, executor);
      built.put(language, analyzer);
      index.put(language, analyzer);
      for (String alias : languageProps.getAliases()) {
        index.put(normalize(alias), analyzer);
      }
      log.info(
          "Registered analyzer language={} aliases={} tools={}",
          language,
          languageProps.getAliases(),
          adapters.stream().map(ToolAdapter::name).toList());
    }
    this.analyzers = Collections.unmodifiableMap(built);
    this.byId = Collections.unmodifiableMap(index);
  }

  public Optional<LanguageAnalyzer> find(String languageId) {
    if (languageId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byId.get(normalize(languageId)));
  }

  /** Canonical language ids, in configuration order. */
  public Set<String> languages() {
    return analyzers.keySet();
  }

  @Override
  public void destroy() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  private static ExecutorService newToolExecutor() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(
        r -> {
          Thread thread = new Thread(r, "analyzer-tool-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  static String normalize(String languageId) {
    return languageId.trim().toLowerCase(Locale.ROOT);
  }
}
