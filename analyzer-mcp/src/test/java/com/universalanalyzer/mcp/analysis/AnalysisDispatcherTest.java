package com.universalanalyzer.mcp.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalanalyzer.mcp.FakeTools;
import com.universalanalyzer.mcp.analysis.adapter.OutputFormat;
import com.universalanalyzer.mcp.analysis.adapter.ToolRun;
import com.universalanalyzer.mcp.analysis.adapter.ToolStatus;
import com.universalanalyzer.mcp.analysis.process.ToolProcessRunner;
import com.universalanalyzer.mcp.config.AnalyzerProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.LanguageProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.SeverityRuleProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.ToolProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalysisDispatcherTest {

  @TempDir Path tempDir;

  private AnalyzerRegistry registry;
  private AnalysisDispatcher dispatcher;
  private Path project;

  @BeforeEach
  void setUp() throws IOException {
    project = Files.createDirectories(tempDir.resolve("project"));
    Path checker =
        FakeTools.script(
            tempDir.resolve("bin"),
            "checker",
            """
            echo "$1/app.py:2:1: error: Name \\"undefined_name\\" is not defined"
            echo "$1/app.py:5:3: note: Revealed type is \\"builtins.int\\""
            """);
    Path missing = tempDir.resolve("bin/not-installed");

    AnalyzerProperties properties = new AnalyzerProperties();
    properties.setDefaultTimeout(Duration.ofSeconds(10));
    LanguageProperties python = new LanguageProperties();
    python.setAliases(List.of("py"));
    python.setTools(List.of(textTool("checker", checker), textTool("absent", missing)));
    properties.setLanguages(Map.of("python", python));
    properties.afterPropertiesSet();

    ResultSynthesizer synthesizer = new ResultSynthesizer();
    registry =
        new AnalyzerRegistry(
            properties,
            new ToolProcessRunner(properties),
            synthesizer,
            new ObjectMapper(),
            new SimpleMeterRegistry());
    dispatcher =
        new AnalysisDispatcher(new LanguageDetector(List.of()), registry, synthesizer);
  }

  @AfterEach
  void tearDown() {
    registry.destroy();
  }

  @Test
  void detectsLanguageAndRunsItsTools() throws IOException {
    Files.writeString(project.resolve("app.py"), "print(undefined_name)\n");

    AnalysisResult result = dispatcher.analyze(project, null, true);

    assertThat(result.language()).isEqualTo("python");
    assertThat(result.diagnostics()).hasSize(2);
    assertThat(result.count(Severity.ERROR)).isEqualTo(1);
    assertThat(result.count(Severity.WARNING)).isEqualTo(1);
    assertThat(result.filesAnalyzed()).isEqualTo(1);
    assertThat(result.toolRuns())
        .extracting(ToolRun::status)
        .containsExactly(ToolStatus.RAN, ToolStatus.NOT_FOUND);
  }

  @Test
  void hintOverridesDetectionAndAcceptsAliases() {
    AnalysisResult result = dispatcher.analyze(project, "PY", true);

    assertThat(result.language()).isEqualTo("python");
    assertThat(result.diagnostics()).isNotEmpty();
  }

  @Test
  void unresolvedLanguageYieldsUnknownResult() {
    AnalysisResult result = dispatcher.analyze(project, null, true);

    assertThat(result.language()).isEqualTo(AnalysisResult.UNKNOWN_LANGUAGE);
    assertThat(result.filesAnalyzed()).isZero();
    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.summary()).containsOnlyKeys("error", "warning", "info", "hint");
    assertThat(result.summary().values()).containsOnly(0);
  }

  @Test
  void nonexistentPathYieldsUnknownResult() {
    AnalysisResult result = dispatcher.analyze(tempDir.resolve("nowhere"), null, true);

    assertThat(result.language()).isEqualTo(AnalysisResult.UNKNOWN_LANGUAGE);
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  void detectedButUnregisteredLanguageKeepsItsName() throws IOException {
    Files.writeString(project.resolve("app.rb"), "puts 1\n");

    AnalysisResult result = dispatcher.analyze(project, null, true);

    assertThat(result.language()).isEqualTo("ruby");
    assertThat(result.diagnostics()).isEmpty();
    assertThat(result.toolRuns()).isEmpty();
  }

  private static ToolProperties textTool(String name, Path binary) {
    ToolProperties tool = new ToolProperties();
    tool.setName(name);
    tool.setCommand(List.of(binary.toString(), "{path}"));
    tool.setFormat(OutputFormat.TEXT_PATTERN);
    tool.setPattern(
        "^(?<file>.+?):(?<line>\\d+):(?<column>\\d+): (?<severity>\\w+): (?<message>.+)$");
    tool.getSeverity().setField("severity");
    SeverityRuleProperties rule = new SeverityRuleProperties();
    rule.setValue("error");
    rule.setSeverity(Severity.ERROR);
    tool.getSeverity().setRules(List.of(rule));
    return tool;
  }
}
