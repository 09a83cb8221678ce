package com.universalanalyzer.mcp.analysis;

import java.util.List;
import java.util.Objects;
import org.springframework.lang.Nullable;

public record Diagnostic(
    String message,
    Severity severity,
    CodeLocation location,
    @Nullable String code,
    @Nullable String source,
    @Nullable String suggestion,
    List<CodeLocation> related) {

  public Diagnostic {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(location, "location");
    related = related == null ? List.of() : List.copyOf(related);
  }

  public static Diagnostic of(
      String message,
      Severity severity,
      CodeLocation location,
      @Nullable String code,
      @Nullable String source,
      @Nullable String suggestion) {
    return new Diagnostic(message, severity, location, code, source, suggestion, List.of());
  }
}
