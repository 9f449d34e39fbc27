package ca.gc.cra.seb.application.client;

import ca.gc.cra.seb.application.port.CapabilityUnavailableException;
import ca.gc.cra.seb.application.port.ClientBridgePort;
import ca.gc.cra.seb.domain.client.ClientKeys;
import java.util.Optional;

/**
 * Reads the keys and version exposed by an SEB client bridge.
 *
 * <p>Blank strings reported by the bridge are treated as absent.</p>
 *
 * @since 0.1.0
 */
public final class ClientKeyReader {
  private ClientKeyReader() {}

  /**
   * Snapshots the bridge, or reports it unavailable.
   *
   * @param bridge bridge handle; empty outside an SEB client
   * @return client keys; {@link ClientKeys#available()} is {@code false} when the bridge is absent
   */
  public static ClientKeys read(Optional<ClientBridgePort> bridge) {
    if (bridge.isEmpty()) {
      return ClientKeys.unavailable();
    }
    ClientBridgePort port = bridge.get();
    return new ClientKeys(
        nonBlank(port.browserExamKey()), nonBlank(port.configKey()), nonBlank(port.version()), true);
  }

  /**
   * Snapshots the bridge, failing when it is absent.
   *
   * @param bridge bridge handle
   * @return client keys
   * @throws CapabilityUnavailableException when no bridge exists
   */
  public static ClientKeys require(Optional<ClientBridgePort> bridge) {
    if (bridge.isEmpty()) {
      throw new CapabilityUnavailableException("SEB client bridge is not available");
    }
    return read(bridge);
  }

  private static Optional<String> nonBlank(Optional<String> value) {
    if (value == null) {
      return Optional.empty();
    }
    return value.filter(v -> !v.isBlank());
  }
}
