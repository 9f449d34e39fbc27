package ca.gc.cra.seb.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PasswordSourceTest {
  @TempDir Path tempDir;

  @Test
  void readsFirstLineOfFileWithoutLineEnding() throws Exception {
    Path file = Files.writeString(tempDir.resolve("pw.txt"), "s3cret pass\r\nsecond line\n");
    PasswordSource source = PasswordSource.fromMap(Map.of("passwordFile", file.toString()));

    assertEquals(Optional.of("s3cret pass"), source.resolve());
    assertEquals("file:" + file, source.toString());
  }

  @Test
  void emptyFileIsRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("empty.txt"), "\n");
    PasswordSource source = new PasswordSource(Optional.of(file), Optional.empty());
    assertThrows(IllegalArgumentException.class, source::resolve);
  }

  @Test
  void readsEnvironmentVariableThroughLookup() throws Exception {
    PasswordSource source = PasswordSource.fromMap(Map.of("passwordEnv", "SEB_PW"));

    assertEquals(Optional.of("from-env"), source.resolve(name -> name.equals("SEB_PW") ? "from-env" : null));
    assertThrows(IllegalArgumentException.class, () -> source.resolve(name -> null));
    assertFalse(source.toString().contains("from-env"));
  }

  @Test
  void noneResolvesToEmpty() throws Exception {
    assertFalse(PasswordSource.none().isPresent());
    assertTrue(PasswordSource.none().resolve().isEmpty());
    assertTrue(PasswordSource.fromMap(Map.of("passwordFile", " ", "passwordEnv", "")).resolve().isEmpty());
  }

  @Test
  void bothSourcesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new PasswordSource(Optional.of(tempDir.resolve("pw")), Optional.of("PW")));
  }
}
