package com.universalanalyzer.mcp.analysis.adapter;

import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.lang.Nullable;

/** Where a tool process is started relative to the analysed path. */
public enum WorkingDirectory {
  /** The server's own working directory. */
  INHERIT,
  /** The analysed directory, or the directory containing the analysed file. */
  TARGET_DIRECTORY;

  @Nullable
  Path resolve(Path target) {
    if (this == INHERIT) {
      return null;
    }
    Path absolute = target.toAbsolutePath();
    if (Files.isDirectory(absolute)) {
      return absolute;
    }
    return absolute.getParent();
  }
}
