package ca.gc.cra.seb.infrastructure.document;

import ca.gc.cra.seb.infrastructure.plist.PlistParser;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Chooses a {@link DocumentReader} from a file extension.
 *
 * @since 0.1.0
 */
public final class DocumentReaders {
  private DocumentReaders() {}

  /**
   * Resolves the reader for {@code path}.
   *
   * @param path source file; {@code .json}, {@code .yaml}, {@code .yml}, {@code .plist} or {@code .xml}
   * @return matching reader
   * @throws IllegalArgumentException when the extension is not supported
   */
  public static DocumentReader forPath(Path path) {
    Objects.requireNonNull(path, "path");
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    String extension = dot < 0 ? "" : name.substring(dot + 1);
    return switch (extension) {
      case "json" -> new JsonDocumentReader();
      case "yaml", "yml" -> new YamlDocumentReader();
      case "plist", "xml" -> plistReader();
      default -> throw new IllegalArgumentException(
          "Unsupported configuration format for " + path + " (expected .json, .yaml, .yml, .plist or .xml)");
    };
  }

  private static DocumentReader plistReader() {
    PlistParser parser = new PlistParser();
    return parser::parse;
  }
}
