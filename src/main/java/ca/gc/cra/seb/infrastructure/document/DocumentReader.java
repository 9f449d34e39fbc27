package ca.gc.cra.seb.infrastructure.document;

import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a configuration document from text in one source format.
 *
 * @since 0.1.0
 */
public interface DocumentReader {
  /**
   * Parses document text.
   *
   * @param text source text
   * @return configuration document
   * @throws IllegalArgumentException when the text is malformed or its root is not a mapping
   */
  ConfigurationDocument parse(String text);

  /**
   * Reads and parses a UTF-8 file.
   *
   * @param path source file
   * @return configuration document
   * @throws IOException when the file cannot be read
   */
  default ConfigurationDocument read(Path path) throws IOException {
    return parse(Files.readString(path, StandardCharsets.UTF_8));
  }
}
