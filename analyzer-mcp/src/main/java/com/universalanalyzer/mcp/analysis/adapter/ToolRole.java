package com.universalanalyzer.mcp.analysis.adapter;

public enum ToolRole {
  /** Produces findings. */
  DIAGNOSTICS,
  /** Produces an opaque metrics document attached to the result as-is. */
  METRICS
}
