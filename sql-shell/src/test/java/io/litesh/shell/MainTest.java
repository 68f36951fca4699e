package io.litesh.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {

  @TempDir Path dir;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private PrintStream originalOut;
  private PrintStream originalErr;

  @BeforeEach
  void redirect() {
    originalOut = System.out;
    originalErr = System.err;
    System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void restore() {
    System.setOut(originalOut);
    System.setErr(originalErr);
  }

  private int run(String... args) {
    return new CommandLine(new Main()).execute(args);
  }

  @Test
  void runsCommandAndExits() {
    int code =
        run(
            databaseFile(),
            "--settings",
            dir.resolve("settings.db").toString(),
            "-m",
            "csv",
            "-c",
            "SELECT 1 AS one, 'two' AS two");

    assertEquals(0, code);
    assertEquals("one,two\n1,two\n", out.toString(StandardCharsets.UTF_8).replace("\r", ""));
  }

  @Test
  void failingCommandReturnsOne() {
    int code =
        run(":memory:", "--settings", dir.resolve("settings.db").toString(), "-c", "SELEC 1");

    assertEquals(1, code);
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("Error: "));
  }

  @Test
  void dotCommandsWorkFromTheCommandLine() {
    String db = databaseFile();
    String settings = dir.resolve("settings.db").toString();

    assertEquals(0, run(db, "--settings", settings, "-c", "CREATE TABLE kv (k, v)"));
    assertEquals(0, run(db, "--settings", settings, "-c", ".tables"));

    assertEquals("kv", out.toString(StandardCharsets.UTF_8).trim());
  }

  @Test
  void rejectsUnknownMode() {
    assertEquals(CommandLine.ExitCode.USAGE, run(":memory:", "-m", "xml", "-c", "SELECT 1"));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("unknown mode 'xml'"));
  }

  @Test
  void homeFollowsSystemProperty() {
    String previous = System.getProperty("litesh.home");
    System.setProperty("litesh.home", dir.toString());
    try {
      assertEquals(dir, Main.home());
    } finally {
      if (previous == null) {
        System.clearProperty("litesh.home");
      } else {
        System.setProperty("litesh.home", previous);
      }
    }
  }

  private String databaseFile() {
    return dir.resolve("data.db").toString();
  }
}
