package com.universalanalyzer.mcp.analysis.adapter;

import java.util.regex.Pattern;

/**
 * Normalizes captured tool output before parsing. Linters and build tools emit colour codes,
 * OSC 8 hyperlinks and carriage-return progress lines even when stdout is a pipe.
 */
final class TerminalOutput {

  private static final Pattern CSI = Pattern.compile("\u001B\\[[;?\\d]*[ -/]*[@-~]");
  private static final Pattern OSC = Pattern.compile("\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)");
  private static final Pattern OVERWRITTEN = Pattern.compile("(?m)^[^\r\n]*\r(?!\n)");

  private TerminalOutput() {}

  static String clean(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String stripped = OSC.matcher(text).replaceAll("");
    stripped = CSI.matcher(stripped).replaceAll("");
    // a bare CR means the terminal would have redrawn the line
    return OVERWRITTEN.matcher(stripped).replaceAll("");
  }
}
