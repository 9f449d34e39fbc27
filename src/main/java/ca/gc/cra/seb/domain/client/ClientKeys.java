package ca.gc.cra.seb.domain.client;

import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the keys and version a client exposes, hashed by the client with the current page URL.
 *
 * @param browserExamKey Browser Exam Key hash, when exposed
 * @param configKey Config Key hash, when exposed
 * @param version raw version string, when exposed
 * @param available whether the client bridge was present at all
 * @since 0.1.0
 */
public record ClientKeys(
    Optional<String> browserExamKey,
    Optional<String> configKey,
    Optional<String> version,
    boolean available) {

  private static final ClientKeys UNAVAILABLE =
      new ClientKeys(Optional.empty(), Optional.empty(), Optional.empty(), false);

  public ClientKeys {
    browserExamKey = Objects.requireNonNullElse(browserExamKey, Optional.empty());
    configKey = Objects.requireNonNullElse(configKey, Optional.empty());
    version = Objects.requireNonNullElse(version, Optional.empty());
  }

  /**
   * Snapshot used when no client bridge exists in the execution environment.
   *
   * @return empty, unavailable snapshot
   */
  public static ClientKeys unavailable() {
    return UNAVAILABLE;
  }

  /**
   * Parses the exposed version string.
   *
   * @return parsed version, or empty when absent or unparseable
   */
  public Optional<ClientVersion> parsedVersion() {
    return version.flatMap(ClientVersion::parse);
  }
}
