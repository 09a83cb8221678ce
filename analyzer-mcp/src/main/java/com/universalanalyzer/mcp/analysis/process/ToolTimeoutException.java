package com.universalanalyzer.mcp.analysis.process;

import java.time.Duration;

public class ToolTimeoutException extends ToolExecutionException {

  private final Duration timeout;

  public ToolTimeoutException(String message, Duration timeout) {
    super(message);
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
