package io.inpdeck.parser.api;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Opens documents referenced by {@code @INCLUDE}. The parser itself never touches the file system;
 * the caller decides where included names point to.
 */
@FunctionalInterface
public interface IncludeResolver {

  /** Resolver that rejects every include. */
  IncludeResolver DISABLED =
      (name, includingSource) -> {
        throw new IOException("includes are not enabled");
      };

  /**
   * Opens the included document.
   *
   * @param name the include target as written (variables expanded, quotes removed)
   * @param includingSource the source name of the document containing the directive
   * @return a reader over the included text, closed by the parser
   * @throws IOException if the document cannot be opened
   */
  Reader open(String name, String includingSource) throws IOException;

  /**
   * Returns the source name reported for lines of the included document.
   *
   * @param name the include target as written
   * @return the display name, by default {@code name}
   */
  default String describe(String name) {
    return name;
  }

  /**
   * Creates a resolver reading UTF-8 files relative to {@code baseDir}. Absolute names are used as
   * given.
   *
   * @param baseDir the directory relative names are resolved against
   * @return a new resolver
   */
  static IncludeResolver fromDirectory(Path baseDir) {
    Objects.requireNonNull(baseDir, "baseDir");
    return new IncludeResolver() {
      @Override
      public Reader open(String name, String includingSource) throws IOException {
        return Files.newBufferedReader(baseDir.resolve(name), StandardCharsets.UTF_8);
      }

      @Override
      public String describe(String name) {
        return baseDir.resolve(name).toString();
      }
    };
  }
}
