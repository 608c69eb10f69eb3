package org.cerespp.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidationHelpersTest {
  @TempDir Path tempDir;

  @Test
  void numbersEnforceBounds() {
    assertEquals(4L, Numbers.requireRange("batch.workers", 4, 1, 256));
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Numbers.requireRange("batch.workers", 0, 1, 256));
    assertEquals("batch.workers must be between 1 and 256 (was 0)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("x", Double.NaN, 0.0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("ccf.rvStep", 0.0));
  }

  @Test
  void stringsTrimAndSanitize() {
    assertEquals("-999", Strings.requireNonBlank("output.missingValue", " -999 "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("k", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("k", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("k", null));

    assertEquals("HD_10700", Strings.toFileToken("HD 10700"));
    assertEquals("alf_Cen_A", Strings.toFileToken(" alf/Cen A "));
    assertEquals("unknown", Strings.toFileToken(null));
  }

  @Test
  void readableFileMustExist() throws Exception {
    Path file = Files.writeString(tempDir.resolve("obs.fits"), "x");

    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("file", file));
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Paths.requireReadableFile("file", tempDir.resolve("absent.fits")));
    assertTrue(ex.getMessage().startsWith("file is not a regular file"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("file", tempDir));
  }

  @Test
  void writableDirCreatedOnlyWhenAsked() throws Exception {
    Path planned = tempDir.resolve("out").resolve("night1");

    Paths.validateWritableDir(planned, false);
    assertFalse(Files.exists(planned));

    Path created = Paths.validateWritableDir(planned, true);
    assertTrue(Files.isDirectory(created));

    Path file = Files.writeString(tempDir.resolve("plain.txt"), "x");
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }
}
