package com.universalanalyzer.mcp.config;

import com.universalanalyzer.mcp.analysis.Severity;
import com.universalanalyzer.mcp.analysis.adapter.OutputChannel;
import com.universalanalyzer.mcp.analysis.adapter.OutputFormat;
import com.universalanalyzer.mcp.analysis.adapter.ToolRole;
import com.universalanalyzer.mcp.analysis.adapter.WorkingDirectory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties implements InitializingBean {

  private boolean parallelTools = true;
  private long maxOutputBytes = 4L * 1024 * 1024;
  private Duration defaultTimeout = Duration.ofSeconds(30);
  private final Detection detection = new Detection();
  private Map<String, LanguageProperties> languages = new LinkedHashMap<>();

  @Override
  public void afterPropertiesSet() {
    validateLanguages();
  }

  public boolean isParallelTools() {
    return parallelTools;
  }

  public void setParallelTools(boolean parallelTools) {
    this.parallelTools = parallelTools;
  }

  public long getMaxOutputBytes() {
    return maxOutputBytes;
  }

  public void setMaxOutputBytes(long maxOutputBytes) {
    this.maxOutputBytes = maxOutputBytes;
  }

  public Duration getDefaultTimeout() {
    return defaultTimeout;
  }

  public void setDefaultTimeout(Duration defaultTimeout) {
    this.defaultTimeout = defaultTimeout;
  }

  public Detection getDetection() {
    return detection;
  }

  public Map<String, LanguageProperties> getLanguages() {
    return languages;
  }

  public void setLanguages(Map<String, LanguageProperties> languages) {
    this.languages = languages != null ? new LinkedHashMap<>(languages) : new LinkedHashMap<>();
  }

  private void validateLanguages() {
    Map<String, String> owners = new HashMap<>();
    for (Map.Entry<String, LanguageProperties> entry : languages.entrySet()) {
      String language = normalize(entry.getKey());
      claim(owners, language, language);
      LanguageProperties props = entry.getValue();
      if (props == null) {
        continue;
      }
      for (String alias : props.getAliases()) {
        claim(owners, normalize(alias), language);
      }
      for (ToolProperties tool : props.getTools()) {
        if (!StringUtils.hasText(tool.getName())) {
          throw new IllegalStateException("Tool without a name configured for language " + language);
        }
        if (tool.getCommand().isEmpty()) {
          throw new IllegalStateException(
              "Tool %s (%s) has no command".formatted(tool.getName(), language));
        }
      }
    }
  }

  private static void claim(Map<String, String> owners, String id, String language) {
    String previous = owners.putIfAbsent(id, language);
    if (previous != null && !previous.equals(language)) {
      throw new IllegalStateException(
          "Language id %s is claimed by both %s and %s".formatted(id, previous, language));
    }
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
  }

  public static class Detection {
    private List<String> excludeDirectories = new ArrayList<>();

    public List<String> getExcludeDirectories() {
      return excludeDirectories;
    }

    public void setExcludeDirectories(List<String> excludeDirectories) {
      this.excludeDirectories =
          excludeDirectories != null ? new ArrayList<>(excludeDirectories) : new ArrayList<>();
    }
  }

  public static class LanguageProperties {
    private List<String> aliases = new ArrayList<>();
    private List<ToolProperties> tools = new ArrayList<>();

    public List<String> getAliases() {
      return aliases;
    }

    public void setAliases(List<String> aliases) {
      this.aliases = aliases != null ? new ArrayList<>(aliases) : new ArrayList<>();
    }

    public List<ToolProperties> getTools() {
      return tools;
    }

    public void setTools(List<ToolProperties> tools) {
      this.tools = tools != null ? new ArrayList<>(tools) : new ArrayList<>();
    }
  }

  public static class ToolProperties {
    private String name;
    private String source;
    private ToolRole role = ToolRole.DIAGNOSTICS;
    private List<String> command = new ArrayList<>();
    private WorkingDirectory workingDirectory = WorkingDirectory.INHERIT;
    private OutputChannel channel = OutputChannel.STDOUT;
    private OutputFormat format = OutputFormat.JSON_DOCUMENT;
    private Duration timeout;
    private String records = "";
    private List<ConditionProperties> filters = new ArrayList<>();
    private String expand;
    private List<ConditionProperties> expandFilters = new ArrayList<>();
    private final FieldProperties fields = new FieldProperties();
    private String pattern;
    private final SeverityProperties severity = new SeverityProperties();

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getSource() {
      return source;
    }

    public void setSource(String source) {
      this.source = source;
    }

    public ToolRole getRole() {
      return role;
    }

    public void setRole(ToolRole role) {
      this.role = role;
    }

    public List<String> getCommand() {
      return command;
    }

    public void setCommand(List<String> command) {
      this.command = command != null ? new ArrayList<>(command) : new ArrayList<>();
    }

    public WorkingDirectory getWorkingDirectory() {
      return workingDirectory;
    }

    public void setWorkingDirectory(WorkingDirectory workingDirectory) {
      this.workingDirectory = workingDirectory;
    }

    public OutputChannel getChannel() {
      return channel;
    }

    public void setChannel(OutputChannel channel) {
      this.channel = channel;
    }

    public OutputFormat getFormat() {
      return format;
    }

    public void setFormat(OutputFormat format) {
      this.format = format;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public String getRecords() {
      return records;
    }

    public void setRecords(String records) {
      this.records = records;
    }

    public List<ConditionProperties> getFilters() {
      return filters;
    }

    public void setFilters(List<ConditionProperties> filters) {
      this.filters = filters != null ? new ArrayList<>(filters) : new ArrayList<>();
    }

    public String getExpand() {
      return expand;
    }

    public void setExpand(String expand) {
      this.expand = expand;
    }

    public List<ConditionProperties> getExpandFilters() {
      return expandFilters;
    }

    public void setExpandFilters(List<ConditionProperties> expandFilters) {
      this.expandFilters = expandFilters != null ? new ArrayList<>(expandFilters) : new ArrayList<>();
    }

    public FieldProperties getFields() {
      return fields;
    }

    public String getPattern() {
      return pattern;
    }

    public void setPattern(String pattern) {
      this.pattern = pattern;
    }

    public SeverityProperties getSeverity() {
      return severity;
    }
  }

  /** A record-level condition: {@code field} must equal {@code equals} or match {@code pattern}. */
  public static class ConditionProperties {
    private String field;
    private String equals;
    private String pattern;

    public String getField() {
      return field;
    }

    public void setField(String field) {
      this.field = field;
    }

    public String getEquals() {
      return equals;
    }

    public void setEquals(String equals) {
      this.equals = equals;
    }

    public String getPattern() {
      return pattern;
    }

    public void setPattern(String pattern) {
      this.pattern = pattern;
    }
  }

  /** JSON Pointers into a record; a leading {@code ^} addresses the enclosing record. */
  public static class FieldProperties {
    private String message = "/message";
    private String file;
    private String line;
    private String column;
    private String endLine;
    private String endColumn;
    private String code;
    private String suggestion;

    public String getMessage() {
      return message;
    }

    public void setMessage(String message) {
      this.message = message;
    }

    public String getFile() {
      return file;
    }

    public void setFile(String file) {
      this.file = file;
    }

    public String getLine() {
      return line;
    }

    public void setLine(String line) {
      this.line = line;
    }

    public String getColumn() {
      return column;
    }

    public void setColumn(String column) {
      this.column = column;
    }

    public String getEndLine() {
      return endLine;
    }

    public void setEndLine(String endLine) {
      this.endLine = endLine;
    }

    public String getEndColumn() {
      return endColumn;
    }

    public void setEndColumn(String endColumn) {
      this.endColumn = endColumn;
    }

    public String getCode() {
      return code;
    }

    public void setCode(String code) {
      this.code = code;
    }

    public String getSuggestion() {
      return suggestion;
    }

    public void setSuggestion(String suggestion) {
      this.suggestion = suggestion;
    }
  }

  public static class SeverityProperties {
    private String field;
    private List<SeverityRuleProperties> rules = new ArrayList<>();
    private Severity present;
    private Severity otherwise = Severity.WARNING;

    public String getField() {
      return field;
    }

    public void setField(String field) {
      this.field = field;
    }

    public List<SeverityRuleProperties> getRules() {
      return rules;
    }

    public void setRules(List<SeverityRuleProperties> rules) {
      this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public Severity getPresent() {
      return present;
    }

    public void setPresent(Severity present) {
      this.present = present;
    }

    public Severity getOtherwise() {
      return otherwise;
    }

    public void setOtherwise(Severity otherwise) {
      this.otherwise = otherwise;
    }
  }

  public static class SeverityRuleProperties {
    private String value;
    private Severity severity;

    public String getValue() {
      return value;
    }

    public void setValue(String value) {
      this.value = value;
    }

    public Severity getSeverity() {
      return severity;
    }

    public void setSeverity(Severity severity) {
      this.severity = severity;
    }
  }
}
