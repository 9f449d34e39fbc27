package ca.gc.cra.seb.application.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.seb.application.port.CapabilityUnavailableException;
import ca.gc.cra.seb.application.port.ClientBridgePort;
import ca.gc.cra.seb.domain.client.ClientKeys;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ClientKeyReaderTest {

  private static ClientBridgePort bridge(String configKey, String browserExamKey, String version) {
    return new ClientBridgePort() {
      @Override
      public Optional<String> configKey() {
        return Optional.ofNullable(configKey);
      }

      @Override
      public Optional<String> browserExamKey() {
        return Optional.ofNullable(browserExamKey);
      }

      @Override
      public Optional<String> version() {
        return Optional.ofNullable(version);
      }
    };
  }

  @Test
  void absentBridgeIsUnavailableWithoutFailing() {
    ClientKeys keys = ClientKeyReader.read(Optional.empty());
    assertFalse(keys.available());
    assertTrue(keys.configKey().isEmpty());
  }

  @Test
  void blankValuesAreTreatedAsMissing() {
    ClientKeys keys = ClientKeyReader.read(Optional.of(bridge("abc", "  ", "SEB_Windows_3.5_1_org.seb")));
    assertTrue(keys.available());
    assertEquals(Optional.of("abc"), keys.configKey());
    assertTrue(keys.browserExamKey().isEmpty());
    assertEquals("3.5", keys.parsedVersion().orElseThrow().version());
  }

  @Test
  void requireFailsOutsideClient() {
    assertThrows(CapabilityUnavailableException.class, () -> ClientKeyReader.require(Optional.empty()));
    assertTrue(ClientKeyReader.require(Optional.of(bridge(null, null, null))).available());
  }
}
