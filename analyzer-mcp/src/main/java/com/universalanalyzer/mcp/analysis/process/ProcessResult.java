package com.universalanalyzer.mcp.analysis.process;

import java.time.Duration;

public record ProcessResult(int exitCode, String stdout, String stderr, Duration duration) {}
