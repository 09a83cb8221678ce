package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.universalanalyzer.mcp.analysis.CodeLocation;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import com.universalanalyzer.mcp.analysis.Severity;
import java.util.List;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Maps one JSON record of a tool's output to diagnostics using the pointers of a {@link
 * ToolDefinition}. With an {@code expand} pointer every element of the nested array becomes a
 * finding and pointers prefixed with {@code ^} read from the enclosing record.
 */
final class JsonRecordMapper {

  private final ToolDefinition definition;
  private final JsonFields fields;

  JsonRecordMapper(ToolDefinition definition) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.fields = Objects.requireNonNull(definition.fields(), "fields");
  }

  void collect(JsonNode record, List<Diagnostic> sink) {
    if (!record.isObject() || !accepts(definition.filters(), record, record)) {
      return;
    }
    if (definition.expand() == null) {
      sink.add(toDiagnostic(record, record));
      return;
    }
    JsonNode nested = record.at(definition.expand());
    if (!nested.isArray()) {
      return;
    }
    for (JsonNode item : nested) {
      if (accepts(definition.expandFilters(), item, record)) {
        sink.add(toDiagnostic(item, record));
      }
    }
  }

  private boolean accepts(List<FieldCondition> conditions, JsonNode item, JsonNode record) {
    for (FieldCondition condition : conditions) {
      if (!condition.test(text(condition.field(), item, record))) {
        return false;
      }
    }
    return true;
  }

  private Diagnostic toDiagnostic(JsonNode item, JsonNode record) {
    String message = text(fields.message(), item, record);
    String file = text(fields.file(), item, record);
    if (message == null || file == null) {
      throw new MalformedToolOutputException(
          definition.name() + " record lacks a message or file: " + abbreviate(item));
    }
    CodeLocation location =
        new CodeLocation(
            file,
            integer(fields.line(), item, record, 0),
            integer(fields.column(), item, record, 0),
            optionalInteger(fields.endLine(), item, record),
            optionalInteger(fields.endColumn(), item, record));
    SeverityPolicy policy = definition.severity();
    Severity severity =
        policy.resolve(policy.field() != null ? text(policy.field(), item, record) : null);
    return Diagnostic.of(
        message,
        severity,
        location,
        text(fields.code(), item, record),
        definition.source(),
        text(fields.suggestion(), item, record));
  }

  private static JsonNode resolve(@Nullable String pointer, JsonNode item, JsonNode record) {
    if (pointer == null || pointer.isBlank()) {
      return null;
    }
    JsonNode node =
        pointer.startsWith(ToolDefinition.PARENT_PREFIX)
            ? record.at(pointer.substring(ToolDefinition.PARENT_PREFIX.length()))
            : item.at(pointer);
    return node.isMissingNode() || node.isNull() ? null : node;
  }

  @Nullable
  static String text(@Nullable String pointer, JsonNode item, JsonNode record) {
    JsonNode node = resolve(pointer, item, record);
    if (node == null) {
      return null;
    }
    return node.isValueNode() ? node.asText() : node.toString();
  }

  private static int integer(@Nullable String pointer, JsonNode item, JsonNode record, int fallback) {
    Integer value = optionalInteger(pointer, item, record);
    return value != null ? value : fallback;
  }

  @Nullable
  private static Integer optionalInteger(@Nullable String pointer, JsonNode item, JsonNode record) {
    JsonNode node = resolve(pointer, item, record);
    if (node == null) {
      return null;
    }
    if (node.isNumber()) {
      return node.intValue();
    }
    if (node.isTextual()) {
      try {
        return Integer.parseInt(node.asText().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  private static String abbreviate(JsonNode node) {
    String text = node.toString();
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
