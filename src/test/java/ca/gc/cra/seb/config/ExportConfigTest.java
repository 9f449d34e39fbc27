package ca.gc.cra.seb.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExportConfigTest {

  @Test
  void parsesMergedSettings() {
    ExportConfig config = ExportConfig.fromMap(Map.of(
        "in", "exam.json", "out", "exam.seb", "encrypt", "yes", "passwordEnv", "PW", "validate", "0"));

    assertEquals(Path.of("exam.json"), config.input());
    assertEquals(Path.of("exam.seb"), config.output());
    assertTrue(config.encrypt());
    assertFalse(config.validate());
    assertEquals(Optional.of("PW"), config.password().environmentVariable());
  }

  @Test
  void appliesDefaultsForFlags() {
    ExportConfig config = ExportConfig.fromMap(Map.of("in", "a.yaml", "out", "a.seb"));
    assertFalse(config.encrypt());
    assertTrue(config.validate());
    assertFalse(config.password().isPresent());
  }

  @Test
  void rejectsMissingPathsAndBadBooleans() {
    assertThrows(IllegalArgumentException.class, () -> ExportConfig.fromMap(Map.of("out", "a.seb")));
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("in", "a.json", "out", "a.seb", "encrypt", "maybe")));
    assertThrows(IllegalArgumentException.class,
        () -> ExportConfig.fromMap(Map.of("in", "a.json", "out", "a.seb", "encrypt", "true")));
  }

  @Test
  void inspectConfigTreatsBlankXmlOutAsAbsent() {
    InspectConfig config = InspectConfig.fromMap(Map.of("in", "a.seb", "xmlOut", " "));
    assertTrue(config.xmlOut().isEmpty());
    assertEquals(Path.of("out.plist"),
        InspectConfig.fromMap(Map.of("in", "a.seb", "xmlOut", "out.plist")).xmlOut().orElseThrow());
  }
}
