package ca.gc.cra.apkrisk.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(0L, Numbers.requireRange("threads", 0, 0, 4));
    assertEquals(4L, Numbers.requireRange("threads", 4, 0, 4));
  }

  @Test
  void requireRangeReportsValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("extractorThreads", 65, 1, 64));
    assertEquals("extractorThreads must be between 1 and 64 (was 65)", ex.getMessage());
  }

  @Test
  void parseInRangeTrimsAndParses() {
    assertEquals(300000L, Numbers.parseInRange("dynamicWindowMs", " 300000 ", 0, 86_400_000L));
  }

  @Test
  void parseInRangeRejectsNonIntegers() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("dynamicWindowMs", "5m", 0, 10));
    assertTrue(ex.getCause() instanceof NumberFormatException);
  }
}
