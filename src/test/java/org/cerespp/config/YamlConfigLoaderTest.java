package org.cerespp.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void flattensCommonAndModeSectionsWithModePrecedence() throws Exception {
    Path file = tempDir.resolve("cerespp.yaml");
    Files.writeString(file, String.join("\n",
        "common:",
        "  mask: K5",
        "  ccf:",
        "    rvMin: -100",
        "    rvStep: 0.5",
        "  output:",
        "    missingValue: nan",
        "batch:",
        "  mask: M2",
        "  files:",
        "    - a.fits",
        "    - b.fits",
        "process:",
        "  out: ./single",
        ""));

    Map<String, String> batch = YamlConfigLoader.load(file, "BATCH").orElseThrow();

    assertEquals("M2", batch.get("mask"));
    assertEquals("-100", batch.get("ccf.rvMin"));
    assertEquals("0.5", batch.get("ccf.rvStep"));
    assertEquals("nan", batch.get("output.missingValue"));
    assertEquals("a.fits,b.fits", batch.get("files"));
    assertFalse(batch.containsKey("out"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "process").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");
    assertEquals(Map.of(), YamlConfigLoader.load(file, "process").orElseThrow());
  }

  @Test
  void malformedYamlIsRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("bad.yaml"), "common: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "process"));
  }

  @Test
  void nestedListsAreRejected() throws Exception {
    Path file = Files.writeString(tempDir.resolve("nested.yaml"), "common:\n  files:\n    - [a, b]\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "batch"));
  }

  @Test
  void shippedExampleParsesIntoAValidConfig() throws Exception {
    Path example = Path.of("src/main/resources/cerespp-example.yaml");
    Map<String, String> options = YamlConfigLoader.load(example, "batch").orElseThrow();

    PipelineConfig config = PipelineConfig.fromMap(options);

    assertEquals(4, config.workers());
    assertTrue(config.json());
  }
}
