package ca.gc.cra.seb.api;

import ca.gc.cra.seb.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  private static final Set<String> SECRET_KEYS = Set.of("password", "pass", "pwd");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args arguments without flags
   * @return mutable, insertion-ordered map
   * @throws IllegalArgumentException for malformed, duplicated or secret-bearing arguments
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + arg + "')");
      }
      String key = arg.substring(0, idx).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (SECRET_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException(
            "passwords are not accepted on the command line; use passwordFile=PATH or passwordEnv=VAR");
      }
      String value = Strings.requireNonBlank(key, arg.substring(idx + 1));
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("argument given more than once: " + key);
      }
    }
    return map;
  }
}
