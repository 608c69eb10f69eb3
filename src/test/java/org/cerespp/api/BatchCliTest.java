package org.cerespp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void filesAndDirectoryTogetherAreInvalid() {
    ExitCode code = BatchCli.run(new String[] {"files=a.fits", "in=" + tempDir, "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: batch"));
  }

  @Test
  void emptyDirectoryIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, BatchCli.run(new String[] {"in=" + tempDir, "--dry-run"}));
  }

  @Test
  void dryRunListsDirectoryInputsInNameOrder() throws Exception {
    Path in = Files.createDirectories(tempDir.resolve("night"));
    Files.writeString(in.resolve("b.fits"), "x");
    Files.writeString(in.resolve("a.fits"), "x");
    Files.writeString(in.resolve("notes.txt"), "x");
    Path out = tempDir.resolve("out");

    ExitCode code = BatchCli.run(new String[] {"in=" + in, "out=" + out, "workers=2", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Batch dry-run"));
    assertTrue(text.contains("Inputs           : 2"));
    assertTrue(text.indexOf("a.fits") < text.indexOf("b.fits"));
    assertFalse(text.contains("notes.txt"));
    assertTrue(text.contains("Workers          : 2"));
    assertFalse(Files.exists(out));
  }

  @Test
  void resolveInputsSplitsFileList() throws Exception {
    List<Path> inputs = BatchCli.resolveInputs(Map.of("files", "one.fits, two.fits"));

    assertEquals(List.of(Path.of("one.fits"), Path.of("two.fits")), inputs);
  }

  @Test
  void unreadableInputsFailTheBatch() {
    Path out = tempDir.resolve("out");

    ExitCode code = BatchCli.run(new String[] {
        "files=" + tempDir.resolve("x.fits") + "," + tempDir.resolve("y.fits"),
        "out=" + out});

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    String text = buffer.toString();
    assertTrue(text.contains("x.fits"));
    assertTrue(text.contains("status=LOAD"));
    assertTrue(text.contains("Batch complete: 0 of 2 input(s) succeeded"));
  }
}
