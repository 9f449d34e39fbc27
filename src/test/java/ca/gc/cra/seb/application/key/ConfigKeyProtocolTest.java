package ca.gc.cra.seb.application.key;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.seb.application.canonical.CanonicalSerializer;
import ca.gc.cra.seb.application.port.CapabilityUnavailableException;
import ca.gc.cra.seb.domain.config.ConfigKey;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValues;
import ca.gc.cra.seb.infrastructure.crypto.JdkSha256DigestAdapter;
import ca.gc.cra.seb.testutil.RecordingMetrics;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ConfigKeyProtocolTest {
  private static final String EXAM_KEY = "5958b083d3107c8f61a81df46bd8e728e3ab2785896556463988e47a36c2e771";
  private static final String QUIZ_HASH = "f4c6163d2f5c69f6463384193b138e028944aef6f7baf4b2075eb0b8ba963b32";

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final ConfigKeyProtocol protocol =
      new ConfigKeyProtocol(new JdkSha256DigestAdapter(), new CanonicalSerializer(), metrics);

  private static ConfigurationDocument examDocument() {
    return new ConfigurationDocument(ConfigValues.map()
        .put("startURL", "https://exam.example.com")
        .put("allowQuit", false)
        .build());
  }

  @Test
  void configKeyIsSha256OfCanonicalForm() {
    assertEquals(EXAM_KEY, protocol.computeConfigKey(examDocument()).hex());
  }

  @Test
  void originatorVersionDoesNotAffectKey() {
    ConfigurationDocument withVersion = new ConfigurationDocument(ConfigValues.map()
        .put("allowQuit", false)
        .put("startURL", "https://exam.example.com")
        .put("originatorVersion", "SEB_macOS_3.3_1_org.seb")
        .build());
    assertEquals(EXAM_KEY, protocol.computeConfigKey(withVersion).hex());
  }

  @Test
  void changingAnyValueChangesKey() {
    ConfigurationDocument changed = new ConfigurationDocument(ConfigValues.map()
        .put("startURL", "https://exam.example.com")
        .put("allowQuit", true)
        .build());
    assertNotEquals(EXAM_KEY, protocol.computeConfigKey(changed).hex());
  }

  @Test
  void requestHashIgnoresFragment() {
    ConfigKey key = ConfigKey.of(EXAM_KEY);
    assertEquals(QUIZ_HASH, protocol.computeRequestHash("https://exam.example.com/quiz/1", key).hex());
    assertEquals(QUIZ_HASH, protocol.computeRequestHash("https://exam.example.com/quiz/1#s2", key).hex());
  }

  @Test
  void requestHashConcatenatesUrlAndKey() {
    ConfigKey key = ConfigKey.of("a".repeat(64));
    assertEquals("e4ce5d8c929841d011d5de8beb56561fd00e2bd9809e3cdae598a502c94f67b6",
        protocol.computeRequestHash("https://example.com/exam", key).hex());
  }

  @Test
  void normalizeUrlCutsAtFirstHash() {
    assertEquals("https://a/b?x=1", ConfigKeyProtocol.normalizeUrl("https://a/b?x=1#frag#more"));
    assertEquals("https://a/", ConfigKeyProtocol.normalizeUrl("https://a/#"));
    assertEquals("https://a/b", ConfigKeyProtocol.normalizeUrl("https://a/b"));
    assertEquals("", ConfigKeyProtocol.normalizeUrl("#only"));
  }

  @Test
  void verifyCountsMatchesAndMismatches() {
    ConfigKey key = ConfigKey.of(EXAM_KEY);

    assertTrue(protocol.verify("https://exam.example.com/quiz/1#top", key, QUIZ_HASH.toUpperCase()));
    assertFalse(protocol.verify("https://exam.example.com/quiz/2", key, QUIZ_HASH));
    assertFalse(protocol.verify("https://exam.example.com/quiz/1", key, null));

    assertEquals(1, metrics.count("configkey.verify.match"));
    assertEquals(2, metrics.count("configkey.verify.mismatch"));
  }

  @Test
  void verifyRejectsOtherConfigKey() {
    String url = "https://exam.example.com/quiz/1";
    assertTrue(protocol.verify(url, ConfigKey.of(EXAM_KEY), QUIZ_HASH));
    assertFalse(protocol.verify(url, ConfigKey.of("a".repeat(64)), QUIZ_HASH));
  }

  @Test
  void verifyRejectsGarbledHashes() {
    ConfigKey key = ConfigKey.of(EXAM_KEY);
    String url = "https://exam.example.com/quiz/1";

    assertFalse(protocol.verify(url, key, QUIZ_HASH.substring(0, 63)));
    assertFalse(protocol.verify(url, key, "z" + QUIZ_HASH.substring(1)));
    assertFalse(protocol.verify(url, key, ""));
    assertFalse(protocol.verify(url, key, " " + QUIZ_HASH + " "));
    assertEquals(4, metrics.count("configkey.verify.mismatch"));
  }

  @Test
  void asyncVariantsCompleteOnExecutor() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      ConfigKey key = ConfigKey.of(EXAM_KEY);
      assertEquals(QUIZ_HASH,
          protocol.computeRequestHashAsync("https://exam.example.com/quiz/1", key, executor)
              .get(5, TimeUnit.SECONDS).hex());
      assertTrue(protocol.verifyAsync("https://exam.example.com/quiz/1", key, QUIZ_HASH, executor)
          .get(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void missingDigestCapabilityFailsFast() {
    assertThrows(CapabilityUnavailableException.class, () -> ConfigKeyProtocol.from(Optional.empty()));
  }

  @Test
  void digestPortIsUsedForHashing() {
    ConfigKeyProtocol fixed = new ConfigKeyProtocol(data -> new byte[32]);
    assertEquals("0".repeat(64), fixed.computeConfigKey(examDocument()).hex());
  }
}
