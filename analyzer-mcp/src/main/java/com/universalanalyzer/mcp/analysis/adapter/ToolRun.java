package com.universalanalyzer.mcp.analysis.adapter;

import org.springframework.lang.Nullable;

/** Per-adapter status line kept beside the diagnostics of an analysis. */
public record ToolRun(
    String tool, ToolStatus status, int diagnostics, long durationMs, @Nullable String detail) {}
