package com.universalanalyzer.mcp.analysis.adapter;

import com.universalanalyzer.mcp.analysis.CodeLocation;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import com.universalanalyzer.mcp.analysis.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.lang.Nullable;

/**
 * Line-oriented output such as {@code file:line:col: severity: message}. Each line that matches
 * the whole pattern becomes one diagnostic; every other line is ignored.
 *
 * <p>Recognised named groups: {@code file}, {@code message} (required), {@code line}, {@code
 * column}, {@code endLine}, {@code endColumn}, {@code code} and whatever group the severity policy
 * names.
 */
class TextPatternParser implements OutputParser {

  private final ToolDefinition definition;
  private final Pattern pattern;
  private final String severityGroup;
  private final boolean hasLine;
  private final boolean hasColumn;
  private final boolean hasEndLine;
  private final boolean hasEndColumn;
  private final boolean hasCode;

  TextPatternParser(ToolDefinition definition) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.pattern = Objects.requireNonNull(definition.pattern(), "pattern");
    String regex = pattern.pattern();
    if (!declares(regex, "file") || !declares(regex, "message")) {
      throw new IllegalArgumentException(
          "Pattern of " + definition.name() + " must declare groups 'file' and 'message'");
    }
    String field = definition.severity().field();
    this.severityGroup = field != null && declares(regex, field) ? field : null;
    this.hasLine = declares(regex, "line");
    this.hasColumn = declares(regex, "column");
    this.hasEndLine = declares(regex, "endLine");
    this.hasEndColumn = declares(regex, "endColumn");
    this.hasCode = declares(regex, "code");
  }

  @Override
  public List<Diagnostic> parse(String output) {
    if (output == null || output.isBlank()) {
      return List.of();
    }
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (String line : TerminalOutput.clean(output).split("\\R")) {
      Matcher matcher = pattern.matcher(line);
      if (!matcher.matches()) {
        continue;
      }
      CodeLocation location =
          new CodeLocation(
              matcher.group("file"),
              hasLine ? number(matcher.group("line"), 0) : 0,
              hasColumn ? number(matcher.group("column"), 0) : 0,
              hasEndLine ? optionalNumber(matcher.group("endLine")) : null,
              hasEndColumn ? optionalNumber(matcher.group("endColumn")) : null);
      Severity severity =
          definition.severity().resolve(severityGroup != null ? matcher.group(severityGroup) : null);
      diagnostics.add(
          Diagnostic.of(
              matcher.group("message"),
              severity,
              location,
              hasCode ? matcher.group("code") : null,
              definition.source(),
              null));
    }
    return diagnostics;
  }

  private static boolean declares(String regex, String group) {
    return regex.contains("(?<" + group + ">");
  }

  private static int number(@Nullable String value, int fallback) {
    Integer parsed = optionalNumber(value);
    return parsed != null ? parsed : fallback;
  }

  @Nullable
  private static Integer optionalNumber(@Nullable String value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}
