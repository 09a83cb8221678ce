package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.universalanalyzer.mcp.analysis.Diagnostic;
import java.util.List;

/** Turns the captured output of one tool into diagnostics. */
public interface OutputParser {

  /**
   * @param output the captured channel, possibly empty
   * @throws MalformedToolOutputException when the output cannot be read in the declared format
   */
  List<Diagnostic> parse(String output);

  static OutputParser forDefinition(ToolDefinition definition, ObjectMapper objectMapper) {
    return switch (definition.format()) {
      case JSON_DOCUMENT -> new JsonDocumentParser(definition, objectMapper);
      case JSON_LINES -> new JsonLinesParser(definition, objectMapper);
      case TEXT_PATTERN -> new TextPatternParser(definition);
    };
  }
}
