package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.core.JsonPointer;
import com.universalanalyzer.mcp.config.AnalyzerProperties.ConditionProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.FieldProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.SeverityProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.SeverityRuleProperties;
import com.universalanalyzer.mcp.config.AnalyzerProperties.ToolProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Declarative description of one external analysis tool: how to start it, where its output goes
 * and how that output turns into diagnostics. Adding a tool means adding one of these.
 */
public record ToolDefinition(
    String name,
    String source,
    ToolRole role,
    List<String> command,
    WorkingDirectory workingDirectory,
    OutputChannel channel,
    OutputFormat format,
    Duration timeout,
    String records,
    List<FieldCondition> filters,
    @Nullable String expand,
    List<FieldCondition> expandFilters,
    @Nullable JsonFields fields,
    @Nullable Pattern pattern,
    SeverityPolicy severity) {

  public static final String PATH_PLACEHOLDER = "{path}";

  /** Prefix of a pointer that reads from the enclosing record of an expanded array. */
  public static final String PARENT_PREFIX = "^";

  public ToolDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(workingDirectory, "workingDirectory");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(severity, "severity");
    source = StringUtils.hasText(source) ? source : name;
    command = List.copyOf(command);
    if (command.isEmpty()) {
      throw new IllegalArgumentException("Tool " + name + " has no command");
    }
    records = records == null ? "" : records;
    filters = filters == null ? List.of() : List.copyOf(filters);
    expandFilters = expandFilters == null ? List.of() : List.copyOf(expandFilters);
    if (role == ToolRole.DIAGNOSTICS) {
      if (format == OutputFormat.TEXT_PATTERN && pattern == null) {
        throw new IllegalArgumentException("Tool " + name + " needs a pattern for text output");
      }
      if (format != OutputFormat.TEXT_PATTERN && fields == null) {
        throw new IllegalArgumentException("Tool " + name + " needs field pointers for JSON output");
      }
    }
  }

  /** The command line for one invocation, with every {@value #PATH_PLACEHOLDER} substituted. */
  public List<String> commandFor(Path target) {
    String path = target.toString();
    List<String> resolved = new ArrayList<>(command.size());
    for (String argument : command) {
      resolved.add(argument.replace(PATH_PLACEHOLDER, path));
    }
    return resolved;
  }

  public static ToolDefinition from(ToolProperties props, Duration defaultTimeout) {
    Objects.requireNonNull(props, "props");
    String name = Objects.requireNonNull(props.getName(), "name").trim();
    Duration timeout =
        props.getTimeout() != null && !props.getTimeout().isZero() && !props.getTimeout().isNegative()
            ? props.getTimeout()
            : defaultTimeout;
    boolean json = props.getFormat() != OutputFormat.TEXT_PATTERN;
    return new ToolDefinition(
        name,
        props.getSource(),
        props.getRole(),
        props.getCommand(),
        props.getWorkingDirectory(),
        props.getChannel(),
        props.getFormat(),
        timeout,
        json ? documentPointer(name, props.getRecords()) : props.getRecords(),
        conditions(name, props.getFilters(), json),
        json ? documentPointer(name, props.getExpand()) : null,
        conditions(name, props.getExpandFilters(), json),
        json ? fields(name, props.getFields()) : null,
        StringUtils.hasText(props.getPattern()) ? compile(name, props.getPattern()) : null,
        severity(name, props.getSeverity(), json));
  }

  @Nullable
  private static JsonFields fields(String tool, FieldProperties props) {
    if (!StringUtils.hasText(props.getFile()) || !StringUtils.hasText(props.getMessage())) {
      return null;
    }
    return new JsonFields(
        pointer(tool, props.getMessage()),
        pointer(tool, props.getFile()),
        pointer(tool, props.getLine()),
        pointer(tool, props.getColumn()),
        pointer(tool, props.getEndLine()),
        pointer(tool, props.getEndColumn()),
        pointer(tool, props.getCode()),
        pointer(tool, props.getSuggestion()));
  }

  private static List<FieldCondition> conditions(
      String tool, List<ConditionProperties> props, boolean json) {
    List<FieldCondition> conditions = new ArrayList<>();
    for (ConditionProperties condition : props) {
      if (!StringUtils.hasText(condition.getField())) {
        throw new IllegalArgumentException("Filter without a field on tool " + tool);
      }
      conditions.add(
          new FieldCondition(
              json ? pointer(tool, condition.getField()) : condition.getField().trim(),
              condition.getEquals(),
              StringUtils.hasText(condition.getPattern())
                  ? compile(tool, condition.getPattern())
                  : null));
    }
    return conditions;
  }

  private static SeverityPolicy severity(String tool, SeverityProperties props, boolean json) {
    List<SeverityPolicy.Rule> rules = new ArrayList<>();
    for (SeverityRuleProperties rule : props.getRules()) {
      rules.add(new SeverityPolicy.Rule(rule.getValue(), rule.getSeverity()));
    }
    return new SeverityPolicy(
        json ? pointer(tool, props.getField()) : trimmed(props.getField()),
        rules,
        props.getPresent(),
        props.getOtherwise());
  }

  /**
   * Checks a configured JSON Pointer, optionally {@value #PARENT_PREFIX}-prefixed, so a malformed
   * entry fails at startup instead of on every invocation. Blank pointers mean "not configured".
   */
  @Nullable
  private static String pointer(String tool, @Nullable String value) {
    String pointer = trimmed(value);
    if (pointer == null) {
      return null;
    }
    String path =
        pointer.startsWith(PARENT_PREFIX) ? pointer.substring(PARENT_PREFIX.length()) : pointer;
    try {
      JsonPointer.compile(path);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid JSON pointer on tool " + tool + ": " + value, ex);
    }
    return pointer;
  }

  /** Like {@link #pointer} for pointers applied to a whole record, which have no parent. */
  @Nullable
  private static String documentPointer(String tool, @Nullable String value) {
    String pointer = pointer(tool, value);
    if (pointer != null && pointer.startsWith(PARENT_PREFIX)) {
      throw new IllegalArgumentException(
          "Parent pointer not allowed for records or expand on tool " + tool + ": " + value);
    }
    return pointer;
  }

  @Nullable
  private static String trimmed(@Nullable String value) {
    return StringUtils.hasText(value) ? value.trim() : null;
  }

  private static Pattern compile(String tool, String regex) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("Invalid pattern on tool " + tool + ": " + regex, ex);
    }
  }
}
