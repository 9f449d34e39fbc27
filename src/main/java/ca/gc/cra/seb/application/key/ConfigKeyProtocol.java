package ca.gc.cra.seb.application.key;

import ca.gc.cra.seb.application.canonical.CanonicalSerializer;
import ca.gc.cra.seb.application.port.CapabilityUnavailableException;
import ca.gc.cra.seb.application.port.DigestPort;
import ca.gc.cra.seb.application.port.MetricsPort;
import ca.gc.cra.seb.domain.config.ConfigKey;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.config.RequestHash;
import ca.gc.cra.seb.domain.util.Hex;
import ca.gc.cra.seb.logging.Logs;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Derives Config Keys from documents and per-request hashes from a Config Key and a URL,
 * and verifies hashes received in the {@value #CONFIG_KEY_HASH_HEADER} header.
 * <p><strong>Why:</strong> An exam server proves that the client runs the expected configuration without ever
 * receiving the configuration itself.</p>
 * <p><strong>Role:</strong> Application service on top of {@link CanonicalSerializer} and the {@link DigestPort}
 * capability.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hash the UTF-8 canonical form into a {@link ConfigKey}.</li>
 *   <li>Strip URL fragments before hashing.</li>
 *   <li>Compare received hashes case-insensitively.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use when the digest port is.</p>
 * <p><strong>Performance:</strong> One digest per call; nothing is cached.</p>
 * <p><strong>Observability:</strong> Emits {@code configkey.verify.match} and {@code configkey.verify.mismatch}.
 * Keys and hashes are only logged at DEBUG and never in full.</p>
 *
 * @since 0.1.0
 */
public final class ConfigKeyProtocol {
  private static final Logger log = LoggerFactory.getLogger(ConfigKeyProtocol.class);

  /** Request header carrying the {@link RequestHash}. */
  public static final String CONFIG_KEY_HASH_HEADER = "X-SafeExamBrowser-ConfigKeyHash";

  private final DigestPort digest;
  private final CanonicalSerializer serializer;
  private final MetricsPort metrics;

  /**
   * Creates a protocol instance without metrics.
   *
   * @param digest SHA-256 capability
   */
  public ConfigKeyProtocol(DigestPort digest) {
    this(digest, new CanonicalSerializer(), MetricsPort.NO_OP);
  }

  /**
   * Creates a protocol instance.
   *
   * @param digest SHA-256 capability
   * @param serializer canonical serializer
   * @param metrics metrics sink for verification outcomes
   */
  public ConfigKeyProtocol(DigestPort digest, CanonicalSerializer serializer, MetricsPort metrics) {
    this.digest = Objects.requireNonNull(digest, "digest");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds a protocol from a capability handle looked up once by the caller.
   *
   * @param digest digest handle, empty when the environment has none
   * @return protocol instance
   * @throws CapabilityUnavailableException when the handle is absent
   */
  public static ConfigKeyProtocol from(Optional<DigestPort> digest) {
    return from(digest, MetricsPort.NO_OP);
  }

  /**
   * Builds a protocol reporting verification outcomes to {@code metrics}.
   *
   * @param digest digest handle, empty when the environment has none
   * @param metrics metrics sink
   * @return protocol instance
   * @throws CapabilityUnavailableException when the handle is absent
   */
  public static ConfigKeyProtocol from(Optional<DigestPort> digest, MetricsPort metrics) {
    DigestPort port = digest.orElseThrow(
        () -> new CapabilityUnavailableException("SHA-256 digest capability is not available"));
    return new ConfigKeyProtocol(port, new CanonicalSerializer(), metrics);
  }

  /**
   * Computes the Config Key of a document.
   *
   * @param document configuration document
   * @return lowercase hex SHA-256 of the canonical form
   */
  public ConfigKey computeConfigKey(ConfigurationDocument document) {
    String canonical = serializer.serialize(document);
    ConfigKey key = new ConfigKey(sha256Hex(canonical));
    log.debug("Computed Config Key {} from {} canonical chars", Logs.fingerprint(key.hex()), canonical.length());
    return key;
  }

  /**
   * Removes the fragment from a URL: everything from the first {@code #} on is dropped.
   *
   * @param url absolute or relative URL
   * @return URL without fragment; unchanged when it has none
   */
  public static String normalizeUrl(String url) {
    Objects.requireNonNull(url, "url");
    int hash = url.indexOf('#');
    return hash < 0 ? url : url.substring(0, hash);
  }

  /**
   * Computes the request hash a client sends for {@code url}.
   *
   * @param url request URL; its fragment is ignored
   * @param configKey Config Key of the expected configuration
   * @return lowercase hex SHA-256 of the normalized URL followed by the key
   */
  public RequestHash computeRequestHash(String url, ConfigKey configKey) {
    Objects.requireNonNull(configKey, "configKey");
    return new RequestHash(sha256Hex(normalizeUrl(url) + configKey.hex()));
  }

  /**
   * Verifies a received request hash.
   *
   * @param url request URL as seen by the server
   * @param configKey stored Config Key
   * @param receivedHash header value; {@code null} or garbled values never match
   * @return {@code true} when the received hash equals the expected one ignoring case
   */
  public boolean verify(String url, ConfigKey configKey, String receivedHash) {
    boolean match = computeRequestHash(url, configKey).matches(receivedHash);
    metrics.increment(match ? "configkey.verify.match" : "configkey.verify.mismatch");
    if (!match) {
      log.debug("Config Key hash mismatch for {}", normalizeUrl(url));
    }
    return match;
  }

  /**
   * Computes the request hash on {@code executor}.
   *
   * @param url request URL
   * @param configKey Config Key
   * @param executor executor running the digest
   * @return future completing with the hash, or exceptionally when the digest fails
   */
  public CompletableFuture<RequestHash> computeRequestHashAsync(String url, ConfigKey configKey, Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> computeRequestHash(url, configKey), executor);
  }

  /**
   * Verifies a received hash on {@code executor}.
   *
   * @param url request URL
   * @param configKey stored Config Key
   * @param receivedHash header value
   * @param executor executor running the digest
   * @return future completing with the verification result
   */
  public CompletableFuture<Boolean> verifyAsync(
      String url, ConfigKey configKey, String receivedHash, Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(() -> verify(url, configKey, receivedHash), executor);
  }

  private String sha256Hex(String text) {
    return Hex.encode(digest.sha256(text.getBytes(StandardCharsets.UTF_8)));
  }
}
