package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One JSON record per line. Lines that are not JSON objects are skipped individually. */
class JsonLinesParser implements OutputParser {

  private final ObjectMapper objectMapper;
  private final JsonRecordMapper mapper;

  JsonLinesParser(ToolDefinition definition, ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.mapper = new JsonRecordMapper(definition);
  }

  @Override
  public List<Diagnostic> parse(String output) {
    if (output == null || output.isBlank()) {
      return List.of();
    }
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (String line : TerminalOutput.clean(output).split("\\R")) {
      String trimmed = line.trim();
      if (!trimmed.startsWith("{")) {
        continue;
      }
      JsonNode record;
      try {
        record = objectMapper.readTree(trimmed);
      } catch (JsonProcessingException ex) {
        continue;
      }
      mapper.collect(record, diagnostics);
    }
    return diagnostics;
  }
}
