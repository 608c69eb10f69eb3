package org.cerespp.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.cerespp.domain.mask.MaskCatalog;
import org.cerespp.domain.mask.MaskId;
import org.cerespp.domain.spectrum.Order;
import org.cerespp.infrastructure.output.ActivityColumns;
import org.cerespp.testutil.FitsCubes;
import org.cerespp.testutil.SyntheticSpectra;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ProcessCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ProcessCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingInputFileReturnsUsageAndInvalidArgs() {
    ExitCode code = ProcessCli.run(new String[] {
        "file=" + tempDir.resolve("absent.fits"),
        "out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: process"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("file is not a regular file"));
    assertTrue(logged);
  }

  @Test
  void unknownMaskReturnsInvalidArgs() throws Exception {
    Path file = Files.writeString(tempDir.resolve("obs.fits"), "placeholder");

    ExitCode code = ProcessCli.run(new String[] {"file=" + file, "mask=X9", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("X9"));
    assertTrue(logged);
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() throws Exception {
    Path file = Files.writeString(tempDir.resolve("obs.fits"), "placeholder");

    ExitCode code = ProcessCli.run(new String[] {
        "file=" + file, "config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void dryRunPrintsPlanAndDoesNotCreateOutputs() throws Exception {
    Path file = Files.writeString(tempDir.resolve("obs.fits"), "placeholder");
    Path output = tempDir.resolve("out");

    ExitCode code = ProcessCli.run(new String[] {
        "file=" + file, "out=" + output, "mask=k5", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Process dry-run"));
    assertTrue(text.contains("K5"));
    assertFalse(Files.exists(output), "dry-run should not create output directory");
  }

  @Test
  void processesCubeAndWritesOutputs() throws Exception {
    List<Order> orders = SyntheticSpectra.absorptionOrders(
        MaskCatalog.builtIn().get(MaskId.G2), 12.0, 3880.0, 6700.0, 0.02, 4);
    Path file = tempDir.resolve("HD10700_night1.fits");
    FitsCubes.write(file, orders, "HD 10700", 2458123.5);
    Path output = tempDir.resolve("out");

    ExitCode code = ProcessCli.run(new String[] {
        "file=" + file,
        "out=" + output,
        "ccf.rvMin=-40",
        "ccf.rvMax=40",
        "save1d=true",
        "json=true",
        "logFile=" + output.resolve("steps.jsonl")});

    assertEquals(ExitCode.SUCCESS, code, buffer::toString);
    assertTrue(buffer.toString().contains("status=OK"));
    List<String> table = Files.readAllLines(output.resolve("HD_10700_activities.dat"));
    assertEquals(List.of(ActivityColumns.headerLine()), table.subList(0, 1));
    assertEquals(2, table.size());
    double rv = Double.parseDouble(table.get(1).split(" ")[1]);
    assertEquals(12.0, rv, 0.1);
    assertTrue(Files.exists(output.resolve("HD_10700_2458123.500000_1d_rest_frame.fits")));
    assertEquals(1, Files.readAllLines(output.resolve("results.jsonl")).size());
    assertFalse(Files.readAllLines(output.resolve("steps.jsonl")).isEmpty());
  }
}
