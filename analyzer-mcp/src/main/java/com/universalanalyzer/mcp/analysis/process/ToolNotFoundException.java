package com.universalanalyzer.mcp.analysis.process;

/** The executable could not be started, usually because it is not installed. */
public class ToolNotFoundException extends ToolExecutionException {

  public ToolNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
