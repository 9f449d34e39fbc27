package ca.gc.cra.seb.infrastructure.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.seb.application.port.ConfigValidationException;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValues;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SettingsValidatorTest {
  private final SettingsValidator validator = new SettingsValidator();

  @Test
  void acceptsWellFormedSettingsAndUnknownKeys() {
    ConfigurationDocument document = new ConfigurationDocument(ConfigValues.map()
        .put("startURL", "https://exam.example.com")
        .put("allowQuit", false)
        .putInt("browserViewMode", 1)
        .putReal("audioVolumeLevel", 50)
        .put("someFutureOption", List.of("x"))
        .put("urlFilterRules", List.of(Map.of("expression", "*.example.com", "action", 1)))
        .build());

    assertSame(document, validator.validate(document));
  }

  @Test
  void doesNotInjectDefaults() {
    ConfigurationDocument empty = ConfigurationDocument.of(Map.of());
    assertEquals(0, validator.validate(empty).size());
  }

  @Test
  void reportsEveryViolationWithItsPath() {
    ConfigurationDocument document = new ConfigurationDocument(ConfigValues.map()
        .put("startURL", "ftp://exam.example.com")
        .put("allowQuit", "no")
        .putInt("browserViewMode", 3)
        .putReal("zoomMode", 1.5)
        .put("urlFilterRules", List.of(Map.of("active", true)))
        .put("additionalResources", List.of(Map.of("URL", "relative/path", "title", "Notes")))
        .put("prohibitedProcesses", "calc.exe")
        .build());

    ConfigValidationException ex =
        assertThrows(ConfigValidationException.class, () -> validator.validate(document));
    List<String> violations = ex.violations();

    assertEquals(7, violations.size(), violations.toString());
    assertTrue(violations.contains("startURL: expected http(s) URL but was ftp://exam.example.com"));
    assertTrue(violations.contains("allowQuit: expected boolean but was string"));
    assertTrue(violations.contains("browserViewMode: 3 is outside [0, 1]"));
    assertTrue(violations.contains("zoomMode: expected integer but was real"));
    assertTrue(violations.contains("urlFilterRules[0].expression: required"));
    assertTrue(violations.contains("additionalResources[0].URL: not an absolute URL: relative/path"));
    assertTrue(violations.contains("prohibitedProcesses: expected array but was string"));
  }

  @Test
  void checksNestedProcessFields() {
    ConfigurationDocument document = new ConfigurationDocument(ConfigValues.map()
        .put("permittedProcesses", List.of(Map.of("executable", "notes.exe", "arguments", List.of(1))))
        .build());

    ConfigValidationException ex =
        assertThrows(ConfigValidationException.class, () -> validator.validate(document));
    assertEquals(List.of("permittedProcesses[0].arguments[0]: expected string but was int"), ex.violations());
  }
}
