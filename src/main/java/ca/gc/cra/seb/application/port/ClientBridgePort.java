package ca.gc.cra.seb.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Capability handle for the SEB client's security bridge ({@code SafeExamBrowser.security}
 * and {@code SafeExamBrowser.version}).
 * <p><strong>Role:</strong> Application port; absence of the bridge is modelled by an empty
 * {@code Optional<ClientBridgePort>} checked once by {@code ClientKeyReader}.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be immutable snapshots.</p>
 *
 * @since 0.1.0
 */
public interface ClientBridgePort {
  /**
   * Config Key hashed with the current page URL.
   *
   * @return key hash if exposed
   */
  Optional<String> configKey();

  /**
   * Browser Exam Key hashed with the current page URL.
   *
   * @return key hash if exposed
   */
  Optional<String> browserExamKey();

  /**
   * Client version string in {@code AppName_OS_Version_Build_BundleId} form.
   *
   * @return version string if exposed
   */
  Optional<String> version();
}
