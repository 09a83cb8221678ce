package com.universalanalyzer.mcp.analysis;

import com.universalanalyzer.mcp.config.AnalyzerProperties;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Classifies source files by extension only. Contents are never inspected, so a non-source file
 * with a matching extension is counted as source.
 */
@Component
public class LanguageDetector {

  private static final Logger log = LoggerFactory.getLogger(LanguageDetector.class);

  // first language listing an extension wins (".h" resolves to cpp)
  private static final Map<String, String> EXTENSIONS = buildExtensionTable();

  private final Set<String> excludedDirectories;

  @Autowired
  public LanguageDetector(AnalyzerProperties properties) {
    this(properties.getDetection().getExcludeDirectories());
  }

  LanguageDetector(List<String> excludedDirectories) {
    this.excludedDirectories =
        excludedDirectories.stream()
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
  }

  public Optional<String> detectFileLanguage(Path file) {
    if (file == null || file.getFileName() == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(EXTENSIONS.get(extension(file.getFileName().toString())));
  }

  /** Language id to file count for every recognised file below {@code directory}. */
  public Map<String, Integer> detectDirectoryLanguages(Path directory) {
    Map<String, Integer> counts = new TreeMap<>();
    if (directory == null || !Files.isDirectory(directory)) {
      return counts;
    }
    try {
      Files.walkFileTree(
          directory,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
              if (!dir.equals(directory) && isExcluded(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (attrs.isRegularFile()) {
                detectFileLanguage(file).ifPresent(language -> counts.merge(language, 1, Integer::sum));
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException ex) {
      log.warn("Language detection stopped early in {}: {}", directory, ex.getMessage());
    }
    return counts;
  }

  /**
   * The language with the most files. Ties go to the alphabetically first id so that the choice
   * does not depend on directory traversal order.
   */
  public Optional<String> primaryLanguage(Map<String, Integer> counts) {
    if (counts == null || counts.isEmpty()) {
      return Optional.empty();
    }
    return counts.entrySet().stream()
        .min(
            Comparator.comparing((Map.Entry<String, Integer> entry) -> entry.getValue())
                .reversed()
                .thenComparing(Map.Entry::getKey))
        .map(Map.Entry::getKey);
  }

  /** Single file: by extension. Directory: primary language of its contents. */
  public Optional<String> detect(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    if (Files.isDirectory(path)) {
      return primaryLanguage(detectDirectoryLanguages(path));
    }
    if (Files.isRegularFile(path)) {
      return detectFileLanguage(path);
    }
    return Optional.empty();
  }

  private boolean isExcluded(Path dir) {
    Path name = dir.getFileName();
    return name != null && excludedDirectories.contains(name.toString().toLowerCase(Locale.ROOT));
  }

  private static String extension(String filename) {
    int idx = filename.lastIndexOf('.');
    if (idx == -1 || idx == filename.length() - 1) {
      return "";
    }
    return filename.substring(idx).toLowerCase(Locale.ROOT);
  }

  private static Map<String, String> buildExtensionTable() {
    Map<String, List<String>> languages = new LinkedHashMap<>();
    languages.put("python", List.of(".py", ".pyw", ".pyi"));
    languages.put("javascript", List.of(".js", ".mjs", ".cjs"));
    languages.put("typescript", List.of(".ts", ".tsx", ".mts", ".cts"));
    languages.put("go", List.of(".go"));
    languages.put("rust", List.of(".rs"));
    languages.put("java", List.of(".java"));
    languages.put("cpp", List.of(".cpp", ".cc", ".cxx", ".c++", ".hpp", ".h", ".hh"));
    languages.put("c", List.of(".c", ".h"));
    languages.put("ruby", List.of(".rb"));
    languages.put("php", List.of(".php"));
    languages.put("swift", List.of(".swift"));
    languages.put("kotlin", List.of(".kt", ".kts"));
    languages.put("scala", List.of(".scala"));
    languages.put("csharp", List.of(".cs"));
    languages.put("dart", List.of(".dart"));
    languages.put("elixir", List.of(".ex", ".exs"));
    languages.put("erlang", List.of(".erl"));
    languages.put("haskell", List.of(".hs"));
    languages.put("ocaml", List.of(".ml", ".mli"));
    languages.put("perl", List.of(".pl", ".pm"));
    languages.put("lua", List.of(".lua"));
    languages.put("r", List.of(".r"));
    languages.put("julia", List.of(".jl"));

    Map<String, String> table = new LinkedHashMap<>();
    languages.forEach(
        (language, extensions) -> extensions.forEach(ext -> table.putIfAbsent(ext, language)));
    return Map.copyOf(table);
  }
}
