package com.universalanalyzer.mcp.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.universalanalyzer.mcp.analysis.adapter.ToolAdapter;
import com.universalanalyzer.mcp.analysis.adapter.ToolOutcome;
import com.universalanalyzer.mcp.analysis.adapter.ToolRole;
import com.universalanalyzer.mcp.analysis.adapter.ToolRun;
import com.universalanalyzer.mcp.analysis.adapter.ToolStatus;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LanguageAnalyzerTest {

  private static final Path TARGET = Path.of("/repo");

  private final ResultSynthesizer synthesizer = new ResultSynthesizer();
  private final ExecutorService executor = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void concatenatesDiagnosticsInConfiguredOrder() {
    LanguageAnalyzer analyzer =
        new LanguageAnalyzer(
            "python",
            List.of(
                new StubAdapter("ruff", ToolRole.DIAGNOSTICS, 30, "r1", "r2"),
                new StubAdapter("mypy", ToolRole.DIAGNOSTICS, 0, "m1"),
                StubAdapter.failing("bandit", ToolStatus.NOT_FOUND)),
            synthesizer,
            executor);

    AnalysisResult result = analyzer.run(TARGET, true);

    assertThat(result.diagnostics())
        .extracting(Diagnostic::message)
        .containsExactly("r1", "r2", "m1");
    assertThat(result.toolRuns())
        .extracting(ToolRun::tool, ToolRun::status)
        .containsExactly(
            tuple("ruff", ToolStatus.RAN),
            tuple("mypy", ToolStatus.RAN),
            tuple("bandit", ToolStatus.NOT_FOUND));
    assertThat(result.count(Severity.ERROR)).isEqualTo(3);
  }

  @Test
  void siblingAdaptersRunConcurrently() {
    CountDownLatch bothStarted = new CountDownLatch(2);
    ToolAdapter first = new LatchAdapter("first", bothStarted);
    ToolAdapter second = new LatchAdapter("second", bothStarted);
    LanguageAnalyzer analyzer =
        new LanguageAnalyzer("go", List.of(first, second), synthesizer, executor);

    AnalysisResult result = analyzer.run(TARGET, true);

    assertThat(result.diagnostics()).extracting(Diagnostic::message).containsExactly("first", "second");
  }

  @Test
  void metricsAreAttachedUnderToolNameAndSkippedOnRequest() {
    StubAdapter radon = new StubAdapter("radon", ToolRole.METRICS, 0);
    LanguageAnalyzer analyzer =
        new LanguageAnalyzer(
            "python",
            List.of(new StubAdapter("ruff", ToolRole.DIAGNOSTICS, 0, "r1"), radon),
            synthesizer,
            null);

    AnalysisResult withMetrics = analyzer.run(TARGET, true);
    AnalysisResult withoutMetrics = analyzer.run(TARGET, false);

    assertThat(withMetrics.metrics()).containsOnlyKeys("radon");
    assertThat(withoutMetrics.metrics()).isEmpty();
    assertThat(withoutMetrics.toolRuns()).extracting(ToolRun::tool).containsExactly("ruff");
    assertThat(radon.calls.get()).isEqualTo(1);
  }

  @Test
  void allToolsFailingStillProducesAResult() {
    LanguageAnalyzer analyzer =
        new LanguageAnalyzer(
            "rust",
            List.of(
                StubAdapter.failing("cargo check", ToolStatus.TIMED_OUT),
                StubAdapter.failing("clippy", ToolStatus.PARSE_FAILED)),
            synthesizer,
            executor);

    AnalysisResult result = analyzer.run(TARGET, true);

    assertThat(result.language()).isEqualTo("rust");
    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.filesAnalyzed()).isZero();
    assertThat(result.summary().values()).containsOnly(0);
  }

  private static final class StubAdapter implements ToolAdapter {
    private final String name;
    private final ToolRole role;
    private final long delayMillis;
    private final List<String> messages;
    private final ToolStatus status;
    private final AtomicInteger calls = new AtomicInteger();

    StubAdapter(String name, ToolRole role, long delayMillis, String... messages) {
      this(name, role, delayMillis, ToolStatus.RAN, messages);
    }

    private StubAdapter(
        String name, ToolRole role, long delayMillis, ToolStatus status, String... messages) {
      this.name = name;
      this.role = role;
      this.delayMillis = delayMillis;
      this.status = status;
      this.messages = List.of(messages);
    }

    static StubAdapter failing(String name, ToolStatus status) {
      return new StubAdapter(name, ToolRole.DIAGNOSTICS, 0, status);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public ToolRole role() {
      return role;
    }

    @Override
    public ToolOutcome invoke(Path target) {
      calls.incrementAndGet();
      if (delayMillis > 0) {
        try {
          Thread.sleep(delayMillis);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
      if (status != ToolStatus.RAN) {
        return new ToolOutcome(name, role, status, List.of(), null, Duration.ZERO, "stubbed");
      }
      List<Diagnostic> diagnostics =
          messages.stream()
              .map(
                  message ->
                      Diagnostic.of(
                          message,
                          Severity.ERROR,
                          CodeLocation.of(target + "/" + name + ".src", 1, 1),
                          null,
                          name,
                          null))
              .toList();
      JsonNode metrics =
          role == ToolRole.METRICS ? JsonNodeFactory.instance.objectNode().put("score", 1) : null;
      return new ToolOutcome(name, role, status, diagnostics, metrics, Duration.ZERO, null);
    }
  }

  /** Finishes only once every sibling has started, so sequential execution would time out. */
  private static final class LatchAdapter implements ToolAdapter {
    private final String name;
    private final CountDownLatch started;

    LatchAdapter(String name, CountDownLatch started) {
      this.name = name;
      this.started = started;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public ToolRole role() {
      return ToolRole.DIAGNOSTICS;
    }

    @Override
    public ToolOutcome invoke(Path target) {
      started.countDown();
      boolean together;
      try {
        together = started.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        together = false;
      }
      List<Diagnostic> diagnostics =
          together
              ? List.of(
                  Diagnostic.of(
                      name, Severity.WARNING, CodeLocation.of("x.go", 1, 1), null, name, null))
              : List.of();
      return new ToolOutcome(
          name, ToolRole.DIAGNOSTICS, ToolStatus.RAN, diagnostics, null, Duration.ZERO, null);
    }
  }
}
