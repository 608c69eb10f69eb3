package org.cerespp.infrastructure.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.cerespp.testutil.Results;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesResultWriterTest {
  @TempDir Path tempDir;

  @Test
  void writesOneObjectPerLineWithNullForNonFiniteNumbers() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonLinesResultWriter writer = new JsonLinesResultWriter(out)) {
      writer.write(Results.withoutHelium("HD 1"));
      writer.write(Results.convergenceFailure("HD 1"));
    }

    String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
    assertEquals(2, lines.length);

    Map<String, String> first = scalars(lines[0]);
    assertEquals("ok", first.get("status"));
    assertEquals("15.012", first.get("rv.value"));
    assertTrue(first.containsKey("rv.bis"));
    assertNull(first.get("rv.bis"));
    assertEquals("0.171234", first.get("indices.S.value"));
    assertTrue(first.get("missingIndices.HeI").contains("0 usable pixel"));
    assertEquals("3", first.get("rejectedPoints"));
    assertEquals("0.25", first.get("steps.mask-correlation"));

    Map<String, String> second = scalars(lines[1]);
    assertEquals("failed", second.get("status"));
    assertEquals("CONVERGENCE", second.get("failure.kind"));
    assertNull(second.get("snr"));
    assertFalse(second.containsKey("indices.S.value"));
  }

  @Test
  void fileWriterAppendsAcrossInstances() throws Exception {
    Path file = tempDir.resolve("nested").resolve(JsonLinesResultWriter.DEFAULT_FILE_NAME);
    try (JsonLinesResultWriter writer = new JsonLinesResultWriter(file)) {
      writer.write(Results.withoutHelium("A"));
    }
    try (JsonLinesResultWriter writer = new JsonLinesResultWriter(file)) {
      writer.write(Results.withoutHelium("B"));
    }

    List<String> lines = Files.readAllLines(file);
    assertEquals(2, lines.size());
    assertEquals("B", scalars(lines.get(1)).get("target"));
  }

  /** Flattens a JSON object into dotted keys; JSON null maps to a present key with a null value. */
  private static Map<String, String> scalars(String json) throws Exception {
    Map<String, String> values = new HashMap<>();
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      StringBuilder path = new StringBuilder();
      Deque<Integer> marks = new ArrayDeque<>();
      String field = null;
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        switch (token) {
          case FIELD_NAME -> field = parser.getCurrentName();
          case START_OBJECT -> {
            marks.push(path.length());
            if (field != null) {
              path.append(field).append('.');
            }
          }
          case END_OBJECT -> path.setLength(marks.pop());
          case VALUE_NULL -> values.put(path + field, null);
          default -> values.put(path + field, parser.getText());
        }
      }
    }
    return values;
  }
}
