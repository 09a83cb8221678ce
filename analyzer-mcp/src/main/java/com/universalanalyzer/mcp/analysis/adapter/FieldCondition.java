package com.universalanalyzer.mcp.analysis.adapter;

import java.util.regex.Pattern;
import org.springframework.lang.Nullable;

/** Keeps a JSON record only when the value at {@code field} equals or matches the expectation. */
public record FieldCondition(String field, @Nullable String equals, @Nullable Pattern pattern) {

  boolean test(@Nullable String value) {
    if (value == null) {
      return false;
    }
    if (equals != null && !equals.equals(value)) {
      return false;
    }
    return pattern == null || pattern.matcher(value).matches();
  }
}
