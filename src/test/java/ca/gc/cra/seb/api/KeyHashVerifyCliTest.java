package ca.gc.cra.seb.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class KeyHashVerifyCliTest {
  private static final String EXAM_KEY = "5958b083d3107c8f61a81df46bd8e728e3ab2785896556463988e47a36c2e771";
  private static final String QUIZ_HASH = "f4c6163d2f5c69f6463384193b138e028944aef6f7baf4b2075eb0b8ba963b32";

  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    appender = new ListAppender<>();
    appender.start();
    for (Class<?> type : new Class<?>[] {KeyCli.class, HashCli.class, VerifyCli.class}) {
      ((Logger) LoggerFactory.getLogger(type)).addAppender(appender);
    }
  }

  @AfterEach
  void tearDown() {
    for (Class<?> type : new Class<?>[] {KeyCli.class, HashCli.class, VerifyCli.class}) {
      ((Logger) LoggerFactory.getLogger(type)).detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }

  @Test
  void keyPrintsConfigKeyForJson() throws Exception {
    Path json = Files.writeString(tempDir.resolve("exam.json"),
        "{\"startURL\": \"https://exam.example.com\", \"allowQuit\": false, \"originatorVersion\": \"x\"}");

    ExitCode code = KeyCli.run(new String[] {"in=" + json, "--show-canonical"});

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = buffer.toString().strip().split("\\R");
    assertEquals("{\"allowQuit\":false,\"startURL\":\"https://exam.example.com\"}", lines[0]);
    assertEquals(EXAM_KEY, lines[1]);
  }

  @Test
  void keyIsIndependentOfSourceFormat() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("exam.yaml"),
        "allowQuit: false\nstartURL: https://exam.example.com\n");

    assertEquals(ExitCode.SUCCESS, KeyCli.run(new String[] {"in=" + yaml}));
    assertEquals(EXAM_KEY, buffer.toString().strip());
  }

  @Test
  void keyReportsMissingAndMalformedInput() throws Exception {
    assertEquals(ExitCode.INVALID_ARGS, KeyCli.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: seb key"));
    assertTrue(loggedError("in is required"));

    Path broken = Files.writeString(tempDir.resolve("broken.json"), "{\"a\": ");
    assertEquals(ExitCode.CONFIG_ERROR, KeyCli.run(new String[] {"in=" + broken}));
    assertEquals(ExitCode.INVALID_ARGS, KeyCli.run(new String[] {"in=" + broken, "--bogus"}));
  }

  @Test
  void hashPrintsRequestHash() {
    ExitCode code = HashCli.run(new String[] {"url=https://exam.example.com/quiz/1#s2", "configKey=" + EXAM_KEY});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(QUIZ_HASH, buffer.toString().strip());
  }

  @Test
  void hashRejectsBadArguments() {
    assertEquals(ExitCode.INVALID_ARGS, HashCli.run(new String[] {"configKey=" + EXAM_KEY}));
    assertTrue(loggedError("url is required"));
    assertEquals(ExitCode.INVALID_ARGS,
        HashCli.run(new String[] {"url=ftp://exam.example.com", "configKey=" + EXAM_KEY}));
    assertEquals(ExitCode.INVALID_ARGS, HashCli.run(new String[] {"url=https://a.example", "configKey=abc"}));
    assertEquals(ExitCode.INVALID_ARGS,
        HashCli.run(new String[] {"url=https://a.example", "configKey=" + EXAM_KEY, "extra=1"}));
    assertTrue(loggedError("unknown argument(s): extra"));
  }

  @Test
  void verifyDistinguishesMatchFromMismatch() {
    ExitCode match = VerifyCli.run(new String[] {
        "url=https://exam.example.com/quiz/1", "configKey=" + EXAM_KEY, "hash=" + QUIZ_HASH.toUpperCase()});
    ExitCode mismatch = VerifyCli.run(new String[] {
        "url=https://exam.example.com/quiz/2", "configKey=" + EXAM_KEY, "hash=" + QUIZ_HASH});

    assertEquals(ExitCode.SUCCESS, match);
    assertEquals(ExitCode.VERIFICATION_FAILED, mismatch);
    assertEquals(1, mismatch.code());
    assertEquals("match\nmismatch", buffer.toString().strip().replace("\r\n", "\n"));
  }

  @Test
  void mainDispatchesAndRejectsUnknownCommands() {
    assertEquals(ExitCode.SUCCESS,
        Main.run(new String[] {"HASH", "url=https://exam.example.com/quiz/1", "configKey=" + EXAM_KEY}));
    assertTrue(buffer.toString().contains(QUIZ_HASH));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("SEB configuration toolkit"));
  }
}
