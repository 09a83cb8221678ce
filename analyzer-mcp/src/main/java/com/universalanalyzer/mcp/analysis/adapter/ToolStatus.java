package com.universalanalyzer.mcp.analysis.adapter;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a single tool invocation ended. Only {@link #RAN} can carry findings. */
public enum ToolStatus {
  RAN("ran"),
  NOT_FOUND("not-found"),
  TIMED_OUT("timed-out"),
  PARSE_FAILED("parse-failed"),
  /** The run was cut short without a timeout, for example by an interrupt during shutdown. */
  ABORTED("aborted");

  private final String id;

  ToolStatus(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }
}
