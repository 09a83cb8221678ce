package com.universalanalyzer.mcp.analysis.adapter;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import com.universalanalyzer.mcp.analysis.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonLinesParserTest {

  private static final String CARGO_OUTPUT =
      """
      {"reason":"compiler-artifact","package_id":"demo 0.1.0","target":{"name":"demo"}}
      {"reason":"compiler-message","message":{"message":"mismatched types","level":"error","code":{"code":"E0308","explanation":"..."},"spans":[{"file_name":"src/main.rs","line_start":4,"line_end":4,"column_start":18,"column_end":25,"is_primary":true},{"file_name":"src/main.rs","line_start":4,"line_end":4,"column_start":12,"column_end":15,"is_primary":false}]}}
      {"reason":"compiler-message","message":{"message":"unused variable: `x`","level":"warning","code":{"code":"unused_variables"},"spans":[{"file_name":"src/lib.rs","line_start":2,"line_end":2,"column_start":9,"column_end":10,"is_primary":true}]}}
      {"reason":"compiler-message","message":{"message":"this `if` has identical blocks","level":"warning","code":{"code":"clippy::if_same_then_else"},"spans":[{"file_name":"src/lib.rs","line_start":8,"line_end":10,"column_start":5,"column_end":6,"is_primary":true}]}}
      {"reason":"compiler-message","message":{"message":"aborting due to previous error","level":"error","code":null,"spans":[]}}
      not json at all
      {"reason":"build-finished","success":false}
      """;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void cargoCheckEmitsOneDiagnosticPerPrimarySpan() {
    List<Diagnostic> diagnostics = parser("cargo check").parse(CARGO_OUTPUT);

    assertThat(diagnostics).hasSize(3);
    Diagnostic mismatch = diagnostics.get(0);
    assertThat(mismatch.message()).isEqualTo("mismatched types");
    assertThat(mismatch.severity()).isEqualTo(Severity.ERROR);
    assertThat(mismatch.code()).isEqualTo("E0308");
    assertThat(mismatch.source()).isEqualTo("rustc");
    assertThat(mismatch.location().file()).isEqualTo("src/main.rs");
    assertThat(mismatch.location().column()).isEqualTo(18);
    assertThat(mismatch.location().endColumn()).isEqualTo(25);
    assertThat(diagnostics.get(1).severity()).isEqualTo(Severity.WARNING);
  }

  @Test
  void clippyKeepsOnlyClippyLints() {
    List<Diagnostic> diagnostics = parser("clippy").parse(CARGO_OUTPUT);

    assertThat(diagnostics).singleElement().satisfies(
        diagnostic -> {
          assertThat(diagnostic.code()).isEqualTo("clippy::if_same_then_else");
          assertThat(diagnostic.source()).isEqualTo("clippy");
          assertThat(diagnostic.location().endLine()).isEqualTo(10);
        });
  }

  @Test
  void compilerLevelsPassThrough() {
    String output =
        """
        {"reason":"compiler-message","message":{"message":"consider borrowing","level":"help","spans":[{"file_name":"a.rs","line_start":1,"line_end":1,"column_start":1,"column_end":2,"is_primary":true}]}}
        {"reason":"compiler-message","message":{"message":"value moved here","level":"note","spans":[{"file_name":"a.rs","line_start":2,"line_end":2,"column_start":1,"column_end":2,"is_primary":true}]}}
        {"reason":"compiler-message","message":{"message":"internal","level":"failure-note","spans":[{"file_name":"a.rs","line_start":3,"line_end":3,"column_start":1,"column_end":2,"is_primary":true}]}}
        """;

    List<Diagnostic> diagnostics = parser("cargo check").parse(output);

    assertThat(diagnostics)
        .extracting(Diagnostic::severity)
        .containsExactly(Severity.HINT, Severity.INFO, Severity.WARNING);
  }

  private OutputParser parser(String tool) {
    return OutputParser.forDefinition(ToolCatalog.definition("rust", tool), objectMapper);
  }
}
