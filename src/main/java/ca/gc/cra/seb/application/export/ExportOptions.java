package ca.gc.cra.seb.application.export;

import java.util.Objects;
import java.util.Optional;

/**
 * Options for {@link ConfigExporter#export}.
 *
 * @param encrypt whether to write a password-encrypted container
 * @param password encryption password; required when {@code encrypt} is set
 * @param validate whether to run the configuration validator first
 * @since 0.1.0
 */
public record ExportOptions(boolean encrypt, Optional<String> password, boolean validate) {
  public ExportOptions {
    password = Objects.requireNonNullElse(password, Optional.empty());
    if (encrypt && password.filter(p -> !p.isEmpty()).isEmpty()) {
      throw new IllegalArgumentException("encrypt=true requires a non-empty password");
    }
  }

  /**
   * Unencrypted export with validation.
   *
   * @return default options
   */
  public static ExportOptions defaults() {
    return new ExportOptions(false, Optional.empty(), true);
  }

  /**
   * Encrypted export with validation.
   *
   * @param password encryption password
   * @return options
   */
  public static ExportOptions encrypted(String password) {
    return new ExportOptions(true, Optional.ofNullable(password), true);
  }

  /**
   * Copy with validation switched on or off.
   *
   * @param enabled whether to validate
   * @return new options
   */
  public ExportOptions withValidate(boolean enabled) {
    return new ExportOptions(encrypt, password, enabled);
  }

  @Override
  public String toString() {
    return "ExportOptions[encrypt=" + encrypt + ", password=" + (password.isPresent() ? "***" : "none")
        + ", validate=" + validate + "]";
  }
}
