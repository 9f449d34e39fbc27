package ca.gc.cra.seb.infrastructure.plist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.seb.application.plist.PlistRenderer;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValue;
import ca.gc.cra.seb.domain.value.ConfigValues;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PlistParserTest {
  private final PlistParser parser = new PlistParser();

  @Test
  void readsRenderedDocumentsBack() {
    ConfigurationDocument original = new ConfigurationDocument(ConfigValues.map()
        .put("startURL", "https://exam.example.com/?a=1&b=<2>")
        .put("allowQuit", false)
        .putInt("browserViewMode", 1)
        .putReal("zoom", 1.25)
        .put("blob", new byte[] {9, 8, 7})
        .put("when", Instant.parse("2024-05-06T07:08:09Z"))
        .put("rules", List.of(Map.of("active", true, "expression", "*.example.com")))
        .put("empty", Map.of())
        .build());

    ConfigurationDocument parsed = parser.parse(new PlistRenderer().render(original));

    assertEquals(original.root().entries().keySet(), parsed.root().entries().keySet());
    for (String key : original.root().entries().keySet()) {
      assertEquals(original.root().get(key), parsed.root().get(key), key);
    }
  }

  @Test
  void nullRendersAsEmptyStringAndReadsBackAsString() {
    ConfigurationDocument original = new ConfigurationDocument(ConfigValues.map()
        .put("gone", ConfigValue.Null.INSTANCE)
        .build());

    ConfigurationDocument parsed = parser.parse(new PlistRenderer().render(original));

    assertEquals(new ConfigValue.Str(""), parsed.root().get("gone"));
  }

  @Test
  void acceptsApplePlistsWithWhitespaceAndWrappedData() {
    String xml = """
        <?xml version="1.0" encoding="UTF-8"?>
        <!DOCTYPE plist PUBLIC "-//Apple//DTD PLIST 1.0//EN" "http://www.apple.com/DTDs/PropertyList-1.0.dtd">
        <plist version="1.0">
          <dict>
            <key>sebConfigPurpose</key>
            <integer> 1 </integer>
            <key>key</key>
            <data>
              AQID
              BAU=
            </data>
          </dict>
        </plist>
        """;

    ConfigurationDocument document = parser.parse(xml);

    assertEquals(new ConfigValue.Int(1), document.root().get("sebConfigPurpose"));
    assertEquals(ConfigValue.Bytes.of(new byte[] {1, 2, 3, 4, 5}), document.root().get("key"));
  }

  @Test
  void rejectsNonDictRoot() {
    String xml = "<plist version=\"1.0\"><array/></plist>";
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> parser.parse(xml));
    assertTrue(ex.getMessage().contains("array"));
    assertEquals(new ConfigValue.ListValue(List.of()), parser.parseValue(xml));
  }

  @Test
  void rejectsMalformedStructures() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("<plist><dict>"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("<html/>"));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse("<plist><dict><key>a</key></dict></plist>"));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse("<plist><dict><key>a</key><true/><key>a</key><false/></dict></plist>"));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse("<plist><dict><key>a</key><uid>1</uid></dict></plist>"));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse("<plist><dict><key>a</key><integer>1.5</integer></dict></plist>"));
    assertThrows(IllegalArgumentException.class,
        () -> parser.parse("<plist><dict>stray<key>a</key><true/></dict></plist>"));
  }

  @Test
  void doesNotResolveExternalEntities() {
    String xml = """
        <?xml version="1.0"?>
        <!DOCTYPE plist [<!ENTITY leak SYSTEM "file:///etc/passwd">]>
        <plist version="1.0"><dict><key>k</key><string>&leak;</string></dict></plist>
        """;

    String value;
    try {
      value = ((ConfigValue.Str) parser.parse(xml).root().get("k")).value();
    } catch (IllegalArgumentException rejected) {
      value = "";
    }
    assertFalse(value.contains("root:"));
  }
}
