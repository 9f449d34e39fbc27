package ca.gc.cra.seb.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidationHelpersTest {
  @TempDir Path tempDir;

  @Test
  void stringsTrimAndRejectBlankOrControl() {
    assertEquals("abc", Strings.requireNonBlank("name", "  abc "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0000b"));
  }

  @Test
  void printableAsciiEnforcesLengthAndRange() {
    assertEquals("SEB_PW", Strings.requirePrintableAscii("env", "SEB_PW", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("env", "TOO_LONG", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("env", "café", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("env", "x", -1));
  }

  @Test
  void urlsRequireHttpSchemeAndHost() {
    assertEquals("https://exam.example.com/a#b", Urls.requireHttpUrl("url", " https://exam.example.com/a#b "));
    assertThrows(IllegalArgumentException.class, () -> Urls.requireHttpUrl("url", "ftp://exam.example.com"));
    assertThrows(IllegalArgumentException.class, () -> Urls.requireHttpUrl("url", "/relative"));
    assertThrows(IllegalArgumentException.class, () -> Urls.requireHttpUrl("url", "https:///nohost"));
    assertThrows(IllegalArgumentException.class, () -> Urls.requireHttpUrl("url", "http://bad host/"));
  }

  @Test
  void readableFileMustExistAndBeRegular() throws Exception {
    Path file = Files.writeString(tempDir.resolve("exam.json"), "{}");
    assertEquals(file.toRealPath(), Paths.requireReadableFile("in", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir.resolve("nope")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir));
  }

  @Test
  void writableFileGuardsOverwrite() throws Exception {
    Path existing = Files.writeString(tempDir.resolve("exam.seb"), "old");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireWritableFile("out", existing, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(existing.toAbsolutePath().normalize(), Paths.requireWritableFile("out", existing, true));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireWritableFile("out", tempDir.resolve("missing/dir/exam.seb"), true));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireWritableFile("out", tempDir, true));
  }
}
