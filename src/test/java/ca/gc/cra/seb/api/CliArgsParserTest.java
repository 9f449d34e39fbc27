package ca.gc.cra.seb.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"url=https://a/b?x=1", " in = exam.json "});
    assertEquals("https://a/b?x=1", map.get("url"));
    assertEquals("exam.json", map.get("in"));
  }

  @Test
  void rejectsMalformedDuplicateAndSecretArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"novalue"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a", "in=b"}));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"Password=hunter2"}));
    assertFalse(ex.getMessage().contains("hunter2"));
  }

  @Test
  void nullInputYieldsEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlagsFromArguments() {
    CliInput input = CliInput.parse(new String[] {"in=a.json", "--DRY-RUN", "-v", "", null, "--bogus"});

    assertArrayEquals(new String[] {"in=a.json"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertEquals(List.of("--bogus"), input.unknownFlags(Set.of("--dry-run")));
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }
}
