package ca.gc.cra.seb.domain.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigKeyTest {

  @Test
  void normalizesCaseAndWhitespace() {
    ConfigKey key = ConfigKey.of("  " + "AB".repeat(32) + "\n");
    assertEquals("ab".repeat(32), key.hex());
    assertEquals(key.hex(), key.toString());
  }

  @Test
  void rejectsNonDigests() {
    assertThrows(IllegalArgumentException.class, () -> ConfigKey.of("abc"));
    assertThrows(IllegalArgumentException.class, () -> ConfigKey.of("z".repeat(64)));
  }

  @Test
  void requestHashMatchesIgnoringCase() {
    RequestHash hash = new RequestHash("ab".repeat(32));
    assertTrue(hash.matches("AB".repeat(32)));
    assertFalse(hash.matches("cd".repeat(32)));
    assertFalse(hash.matches(null));
  }

  @Test
  void documentExposesOriginatorVersion() {
    ConfigurationDocument document = ConfigurationDocument.of(Map.of(
        "originatorVersion", "SEB_Win_3.5", "startURL", "https://exam.example.com"));
    assertEquals("SEB_Win_3.5", document.originatorVersion().orElseThrow());
    assertEquals(2, document.size());
    assertTrue(document.get("missing").isEmpty());
  }
}
