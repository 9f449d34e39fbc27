package ca.gc.cra.seb.domain.client;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Parsed form of the SEB client version string
 * {@code AppName_OS_Version_Build_BundleId}.
 * <p><strong>Why:</strong> Servers gate features on client platform and build without guessing at malformed input.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param appName application display name
 * @param os reporting operating system
 * @param version marketing version, e.g. {@code 3.3.2}
 * @param build build number
 * @param bundleId bundle identifier; may itself contain underscores
 * @since 0.1.0
 */
public record ClientVersion(String appName, ClientOs os, String version, String build, String bundleId) {
  private static final int MIN_SEGMENTS = 5;

  public ClientVersion {
    Objects.requireNonNull(appName, "appName");
    Objects.requireNonNull(os, "os");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(build, "build");
    Objects.requireNonNull(bundleId, "bundleId");
  }

  /**
   * Parses a version string; everything after the fourth underscore is the bundle id.
   *
   * @param raw version string reported by the client; may be {@code null}
   * @return parsed version, or empty when there are fewer than five segments or the OS token is unknown
   */
  public static Optional<ClientVersion> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String[] parts = raw.split("_", MIN_SEGMENTS);
    if (parts.length < MIN_SEGMENTS) {
      return Optional.empty();
    }
    return ClientOs.fromToken(parts[1])
        .map(os -> new ClientVersion(parts[0], os, parts[2], parts[3], parts[4]));
  }

  /**
   * Re-assembles the underscore-delimited form.
   *
   * @return version string
   */
  public String format() {
    return String.join("_", appName, os.token(), version, build, bundleId);
  }
}
