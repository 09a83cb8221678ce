package com.universalanalyzer.mcp.analysis.adapter;

/** Tool output did not have the shape its definition promises. */
public class MalformedToolOutputException extends RuntimeException {

  public MalformedToolOutputException(String message) {
    super(message);
  }

  public MalformedToolOutputException(String message, Throwable cause) {
    super(message, cause);
  }
}
