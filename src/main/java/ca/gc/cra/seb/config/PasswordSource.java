package ca.gc.cra.seb.config;

import ca.gc.cra.seb.validation.Paths;
import ca.gc.cra.seb.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Where a container password comes from: a file or an environment variable, never the command line.
 *
 * @param file file whose first line is the password
 * @param environmentVariable name of the variable holding the password
 * @since 0.1.0
 */
public record PasswordSource(Optional<Path> file, Optional<String> environmentVariable) {
  private static final int MAX_ENV_NAME_LENGTH = 256;

  public PasswordSource {
    file = Objects.requireNonNullElse(file, Optional.empty());
    environmentVariable = Objects.requireNonNullElse(environmentVariable, Optional.empty());
    if (file.isPresent() && environmentVariable.isPresent()) {
      throw new IllegalArgumentException("passwordFile and passwordEnv are mutually exclusive");
    }
  }

  /** Source that supplies no password. */
  public static PasswordSource none() {
    return new PasswordSource(Optional.empty(), Optional.empty());
  }

  static PasswordSource fromMap(Map<String, String> map) {
    String file = trim(map.get("passwordFile"));
    String env = trim(map.get("passwordEnv"));
    return new PasswordSource(
        file.isEmpty() ? Optional.empty() : Optional.of(Path.of(file)),
        env.isEmpty()
            ? Optional.empty()
            : Optional.of(Strings.requirePrintableAscii("passwordEnv", env, MAX_ENV_NAME_LENGTH)));
  }

  public boolean isPresent() {
    return file.isPresent() || environmentVariable.isPresent();
  }

  /**
   * Reads the password from the process environment or the file.
   *
   * @return password, or empty when no source is configured
   * @throws IOException when the password file cannot be read
   * @throws IllegalArgumentException when the source yields an empty password
   */
  public Optional<String> resolve() throws IOException {
    return resolve(System::getenv);
  }

  /**
   * Reads the password using {@code environment} for variable lookups.
   *
   * @param environment variable lookup
   * @return password, or empty when no source is configured
   * @throws IOException when the password file cannot be read
   */
  public Optional<String> resolve(UnaryOperator<String> environment) throws IOException {
    if (environmentVariable.isPresent()) {
      String name = environmentVariable.get();
      String value = environment.apply(name);
      if (value == null || value.isEmpty()) {
        throw new IllegalArgumentException("environment variable " + name + " is not set");
      }
      return Optional.of(value);
    }
    if (file.isPresent()) {
      Path real = Paths.requireReadableFile("passwordFile", file.get());
      String content = Files.readString(real, StandardCharsets.UTF_8);
      int newline = content.indexOf('\n');
      String line = newline < 0 ? content : content.substring(0, newline);
      if (line.endsWith("\r")) {
        line = line.substring(0, line.length() - 1);
      }
      if (line.isEmpty()) {
        throw new IllegalArgumentException("passwordFile is empty: " + file.get());
      }
      return Optional.of(line);
    }
    return Optional.empty();
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }

  @Override
  public String toString() {
    return file.map(p -> "file:" + p).or(() -> environmentVariable.map(v -> "env:" + v)).orElse("none");
  }
}
