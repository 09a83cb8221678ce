package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Reads a whole JSON document and maps each element of its record array. */
class JsonDocumentParser implements OutputParser {

  private final ToolDefinition definition;
  private final ObjectMapper objectMapper;
  private final JsonRecordMapper mapper;

  JsonDocumentParser(ToolDefinition definition, ObjectMapper objectMapper) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.mapper = new JsonRecordMapper(definition);
  }

  @Override
  public List<Diagnostic> parse(String output) {
    if (output == null || output.isBlank()) {
      return List.of();
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(TerminalOutput.clean(output));
    } catch (JsonProcessingException ex) {
      throw new MalformedToolOutputException(
          definition.name() + " produced invalid JSON: " + ex.getOriginalMessage(), ex);
    }
    JsonNode records = root.at(definition.records());
    if (records.isMissingNode() || records.isNull()) {
      return List.of();
    }
    if (!records.isArray()) {
      throw new MalformedToolOutputException(
          definition.name() + " output has no record array at '" + definition.records() + "'");
    }
    List<Diagnostic> diagnostics = new ArrayList<>();
    for (JsonNode record : records) {
      mapper.collect(record, diagnostics);
    }
    return diagnostics;
  }
}
