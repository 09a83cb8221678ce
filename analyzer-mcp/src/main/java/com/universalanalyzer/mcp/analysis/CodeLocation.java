package com.universalanalyzer.mcp.analysis;

import org.springframework.lang.Nullable;

/**
 * Position of a finding as reported by the producing tool. Line and column conventions are the
 * tool's own (some report 0-based columns); they are not renormalized.
 */
public record CodeLocation(
    String file,
    int line,
    int column,
    @Nullable Integer endLine,
    @Nullable Integer endColumn) {

  public static CodeLocation of(String file, int line, int column) {
    return new CodeLocation(file, line, column, null, null);
  }

  /** {@code file:line:col}, the compact form used by error lists. */
  public String shortForm() {
    return file + ":" + line + ":" + column;
  }
}
