package com.universalanalyzer.mcp.analysis.adapter;

import org.springframework.lang.Nullable;

/** JSON Pointers locating the parts of one finding. */
public record JsonFields(
    String message,
    String file,
    @Nullable String line,
    @Nullable String column,
    @Nullable String endLine,
    @Nullable String endColumn,
    @Nullable String code,
    @Nullable String suggestion) {}
