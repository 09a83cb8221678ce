package com.universalanalyzer.mcp.analysis.adapter;

import java.nio.file.Path;

/**
 * One external analysis tool for one language. Implementations never throw from {@link
 * #invoke(Path)}: a missing binary, a timeout, an interrupt or unreadable output end as an outcome
 * without diagnostics.
 */
public interface ToolAdapter {

  String name();

  ToolRole role();

  ToolOutcome invoke(Path target);
}
