package com.universalanalyzer.mcp.analysis.adapter;

import com.universalanalyzer.mcp.analysis.Severity;
import java.util.List;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Maps a tool's native severity signal to a {@link Severity}. Rules are checked in order against
 * the trimmed value and must match it exactly, so {@code HIGH} and {@code high} differ. A present
 * value that no rule names maps to {@code present}, an absent one (or a present one when {@code
 * present} is unset) to {@code otherwise}.
 */
public record SeverityPolicy(
    @Nullable String field, List<Rule> rules, @Nullable Severity present, Severity otherwise) {

  public SeverityPolicy {
    rules = rules == null ? List.of() : List.copyOf(rules);
    Objects.requireNonNull(otherwise, "otherwise");
  }

  public Severity resolve(@Nullable String value) {
    if (value == null) {
      return otherwise;
    }
    String trimmed = value.trim();
    for (Rule rule : rules) {
      if (rule.value().equals(trimmed)) {
        return rule.severity();
      }
    }
    return present != null ? present : otherwise;
  }

  public record Rule(String value, Severity severity) {

    public Rule {
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(severity, "severity");
    }
  }
}
