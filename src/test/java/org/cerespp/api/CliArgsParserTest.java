package org.cerespp.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrderAndKeepsLastValue() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"file=/data/obs.fits", " mask = K5 ", "ccf.rvStep=0.5", "mask=M2", ""});

    assertEquals(Map.of("file", "/data/obs.fits", "mask", "M2", "ccf.rvStep", "0.5"), map);
    assertEquals("file", map.keySet().iterator().next());
  }

  @Test
  void valueMayContainEquals() {
    assertEquals("service.name=ceres,site=eso",
        CliArgsParser.toMap(new String[] {"otelResourceAttributes=service.name=ceres,site=eso"})
            .get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedTokens() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"file"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1mask=G2"}));
    IllegalArgumentException empty = assertThrows(
        IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out="}));
    assertTrue(empty.getMessage().contains("needs a value"));
  }

  @Test
  void cliInputSeparatesFlags() {
    CliInput input = CliInput.parse(new String[] {"batch", "in=/data", "--DRY-RUN", "-v", null});

    assertArrayEquals(new String[] {"batch", "in=/data"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertEquals(false, input.help());
  }
}
