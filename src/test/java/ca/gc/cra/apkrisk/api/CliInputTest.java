package ca.gc.cra.apkrisk.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"assess", "--VERBOSE", " job=a.json ", "", null, "--dry"});

    assertEquals(List.of("assess", "job=a.json"), input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertEquals(Set.of("--dry"), input.flags());
  }

  @Test
  void dropFirstRemovesCommandOnly() {
    CliInput input = CliInput.parse(new String[] {"catalog", "-h", "bands.high=80"}).dropFirst();

    assertEquals(List.of("bands.high=80"), input.keyValueArgs());
    assertTrue(input.help());
  }

  @Test
  void unknownFlagsAreRejectedOnDemand() {
    CliInput.parse(new String[] {"job=a.json"}).rejectUnknownFlags();

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliInput.parse(new String[] {"--bogus"}).rejectUnknownFlags());
    assertEquals("unknown option: --bogus", ex.getMessage());
  }
}
