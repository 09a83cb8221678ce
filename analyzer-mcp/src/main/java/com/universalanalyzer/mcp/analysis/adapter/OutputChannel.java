package com.universalanalyzer.mcp.analysis.adapter;

import com.universalanalyzer.mcp.analysis.process.ProcessResult;

public enum OutputChannel {
  STDOUT,
  STDERR;

  String select(ProcessResult result) {
    return this == STDERR ? result.stderr() : result.stdout();
  }
}
