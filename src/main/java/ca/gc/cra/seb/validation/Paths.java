package ca.gc.cra.seb.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for CLI input and output files.
 * <p><strong>Why:</strong> Exported {@code .seb} files are handed to students; silently replacing an existing file
 * or writing into a missing directory must be caught before any work is done.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve input files to readable regular files.</li>
 *   <li>Refuse to replace an existing output file unless overwrite is allowed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; the filesystem may change between check and use.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {}

  /**
   * Resolves a readable regular file.
   *
   * @param name parameter name used in messages
   * @param path candidate file
   * @return real path of the file
   * @throws IllegalArgumentException when the file is missing, a directory or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    checkText(name, path);
    try {
      Path real = path.toRealPath();
      if (!Files.isRegularFile(real)) {
        throw new IllegalArgumentException(name + " is not a regular file: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(name + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(name + " does not exist: " + path, ex);
    }
  }

  /**
   * Validates an output file location.
   *
   * @param name parameter name used in messages
   * @param path candidate output file
   * @param allowOverwrite whether an existing regular file may be replaced
   * @return absolute normalized path
   * @throws IllegalArgumentException when the parent directory is missing or unwritable, the target is a directory
   *     or symbolic link, or the target exists and overwrite is not allowed
   */
  public static Path requireWritableFile(String name, Path path, boolean allowOverwrite) {
    checkText(name, path);
    Path normalized = path.toAbsolutePath().normalize();
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!Files.isRegularFile(normalized, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException(name + " must be a regular file: " + normalized);
      }
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " already exists (use --allow-overwrite to replace): " + normalized);
      }
    }
    return normalized;
  }

  private static void checkText(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
  }
}
