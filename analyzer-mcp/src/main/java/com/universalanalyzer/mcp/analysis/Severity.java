package com.universalanalyzer.mcp.analysis;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.springframework.util.StringUtils;

/** Diagnostic severity, declared low to high so that {@link #rank()} orders them. */
public enum Severity {
  HINT("hint", 0),
  INFO("info", 1),
  WARNING("warning", 2),
  ERROR("error", 3);

  private final String id;
  private final int rank;

  Severity(String id, int rank) {
    this.id = id;
    this.rank = rank;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public int rank() {
    return rank;
  }

  public boolean isAtLeast(Severity other) {
    return rank >= other.rank;
  }

  /**
   * Resolves a severity by id or enum name. Blank and unknown values resolve to {@code
   * fallback}.
   */
  public static Severity fromString(String value, Severity fallback) {
    if (!StringUtils.hasText(value)) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Severity severity : values()) {
      if (severity.id.equals(normalized)) {
        return severity;
      }
    }
    return fallback;
  }
}
