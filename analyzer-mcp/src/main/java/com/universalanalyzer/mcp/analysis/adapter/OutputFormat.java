package com.universalanalyzer.mcp.analysis.adapter;

/** Native output shape of an external tool. */
public enum OutputFormat {
  /** A single JSON document holding an array of records. */
  JSON_DOCUMENT,
  /** One JSON record per line; lines that are not JSON are skipped. */
  JSON_LINES,
  /** Plain text, one finding per line matched by a regular expression. */
  TEXT_PATTERN
}
