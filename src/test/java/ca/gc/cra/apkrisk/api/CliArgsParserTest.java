package ca.gc.cra.apkrisk.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(List.of("job=/tmp/a.json", "weights.permission_density= 0.3 "));

    assertEquals(List.of("job", "weights.permission_density"), List.copyOf(map.keySet()));
    assertEquals("0.3", map.get("weights.permission_density"));
  }

  @Test
  void valueMayContainEquals() {
    assertEquals("a=b", CliArgsParser.toMap(List.of("jobId=a=b")).get("jobId"));
  }

  @Test
  void nullTokensYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedTokens() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("job")));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("=value")));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("job=")));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("bad key=1")));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("jobId=a\u0007b")));
  }

  @Test
  void rejectsDuplicateKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(List.of("format=json", "format=text")));

    assertEquals("argument format supplied more than once", ex.getMessage());
  }
}
