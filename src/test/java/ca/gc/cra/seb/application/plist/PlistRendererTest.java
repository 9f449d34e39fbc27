package ca.gc.cra.seb.application.plist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValue;
import ca.gc.cra.seb.domain.value.ConfigValues;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PlistRendererTest {
  private final PlistRenderer renderer = new PlistRenderer();

  @Test
  void rendersSortedDictWithTabIndentation() {
    ConfigurationDocument document = new ConfigurationDocument(ConfigValues.map()
        .put("startURL", "https://exam.example.com")
        .put("allowQuit", false)
        .putInt("browserViewMode", 1)
        .build());

    String expected = String.join("\n",
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>",
        "<!DOCTYPE plist PUBLIC \"-//Apple//DTD PLIST 1.0//EN\" \"http://www.apple.com/DTDs/PropertyList-1.0.dtd\">",
        "<plist version=\"1.0\">",
        "<dict>",
        "\t<key>allowQuit</key>",
        "\t<false/>",
        "\t<key>browserViewMode</key>",
        "\t<integer>1</integer>",
        "\t<key>startURL</key>",
        "\t<string>https://exam.example.com</string>",
        "</dict>",
        "</plist>");
    assertEquals(expected, renderer.render(document));
  }

  @Test
  void keepsOriginatorVersionAndRealKind() {
    ConfigurationDocument document = new ConfigurationDocument(ConfigValues.map()
        .put("originatorVersion", "SEB_Win_3.5")
        .putReal("ratio", 2)
        .build());

    String xml = renderer.render(document);
    assertTrue(xml.contains("\t<key>originatorVersion</key>\n\t<string>SEB_Win_3.5</string>"));
    assertTrue(xml.contains("\t<real>2</real>"));
  }

  @Test
  void rendersNestedContainersAndEmpties() {
    ConfigurationDocument document = new ConfigurationDocument(ConfigValues.map()
        .put("rules", List.of(Map.of("expression", "a&b")))
        .put("none", List.of())
        .put("empty", Map.of())
        .build());

    String xml = renderer.render(document);
    assertTrue(xml.contains("\t<key>empty</key>\n\t<dict/>"));
    assertTrue(xml.contains("\t<key>none</key>\n\t<array/>"));
    assertTrue(xml.contains("\t<array>\n\t\t<dict>\n\t\t\t<key>expression</key>\n\t\t\t<string>a&amp;b</string>\n"
        + "\t\t</dict>\n\t</array>"));
  }

  @Test
  void rendersDataDatesAndNull() {
    ConfigurationDocument document = new ConfigurationDocument(ConfigValues.map()
        .put("blob", new byte[] {1, 2, 3})
        .put("when", Instant.parse("2024-05-06T07:08:09.123Z"))
        .put("gone", ConfigValue.Null.INSTANCE)
        .build());

    String xml = renderer.render(document);
    assertTrue(xml.contains("<data>AQID</data>"));
    assertTrue(xml.contains("<date>2024-05-06T07:08:09Z</date>"));
    assertTrue(xml.contains("\t<key>gone</key>\n\t<string></string>"));
  }

  @Test
  void escapesAllFiveXmlSpecials() {
    assertEquals("&lt;a href=&quot;x&quot;&gt;&amp;&apos;", PlistRenderer.escapeXml("<a href=\"x\">&'"));
  }

  @Test
  void emptyDocumentIsEmptyDict() {
    String xml = renderer.render(ConfigurationDocument.of(Map.of()));
    assertTrue(xml.endsWith("<plist version=\"1.0\">\n<dict/>\n</plist>"));
  }
}
